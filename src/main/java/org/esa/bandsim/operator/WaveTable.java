package org.esa.bandsim.operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The externally visible result of one sensor (variant): a leading "Wave" column with the
 * band center wavelengths, followed by one column per output station. One row per band.
 *
 * @author bandsim team
 */
public class WaveTable {

    private final String name;
    private final int[] waves;
    private final List<String> columnNames;
    // columns[station][band]
    private final double[][] columns;

    WaveTable(String name, int[] waves, List<String> columnNames, double[][] columns) {
        this.name = name;
        this.waves = waves;
        this.columnNames = Collections.unmodifiableList(new ArrayList<String>(columnNames));
        this.columns = columns;
    }

    public String getName() {
        return name;
    }

    public boolean isEmpty() {
        return waves.length == 0;
    }

    public int getRowCount() {
        return waves.length;
    }

    /**
     * @return number of station columns ("Wave" not counted)
     */
    public int getStationColumnCount() {
        return columns.length;
    }

    /**
     * @return all column names, "Wave" first
     */
    public List<String> getColumnNames() {
        return columnNames;
    }

    public int getWave(int row) {
        return waves[row];
    }

    public int[] getWaves() {
        return waves.clone();
    }

    public double getValue(int row, int stationColumn) {
        return columns[stationColumn][row];
    }

    public double[] getStationColumn(int stationColumn) {
        return columns[stationColumn].clone();
    }
}
