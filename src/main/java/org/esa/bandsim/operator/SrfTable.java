package org.esa.bandsim.operator;

import java.util.Arrays;

/**
 * Spectral response function table of one satellite: a wavelength column (column 0)
 * followed by one response column per raw band, in sensor-native order.
 * <p/>
 * Values may be NaN where the source table has gaps. Instances are immutable.
 *
 * @author bandsim team
 */
public class SrfTable {

    private final String name;
    private final String[] columnNames;
    private final double[] wavelengths;
    private final double[][] responses;

    /**
     * @param name        - table name, e.g. "s3"
     * @param columnNames - names of all columns, wavelength column first
     * @param wavelengths - wavelength column [nm]
     * @param responses   - responses[band][row] for the columns 1..n
     */
    public SrfTable(String name, String[] columnNames, double[] wavelengths, double[][] responses) {
        if (columnNames.length != responses.length + 1) {
            throw new IllegalArgumentException("Table '" + name + "': " + columnNames.length +
                                                       " column names for " + (responses.length + 1) + " columns");
        }
        for (int i = 0; i < responses.length; i++) {
            if (responses[i].length != wavelengths.length) {
                throw new IllegalArgumentException("Table '" + name + "': column '" + columnNames[i + 1] +
                                                           "' has " + responses[i].length + " rows, expected " +
                                                           wavelengths.length);
            }
        }
        this.name = name;
        this.columnNames = columnNames.clone();
        this.wavelengths = wavelengths.clone();
        this.responses = new double[responses.length][];
        for (int i = 0; i < responses.length; i++) {
            this.responses[i] = responses[i].clone();
        }
    }

    public String getName() {
        return name;
    }

    public int getColumnCount() {
        return columnNames.length;
    }

    public int getRowCount() {
        return wavelengths.length;
    }

    public String getColumnName(int column) {
        return columnNames[column];
    }

    public double getWavelength(int row) {
        return wavelengths[row];
    }

    /**
     * @param column - response column, 1..getColumnCount()-1
     * @param row    - row index
     * @return the raw response value, possibly NaN
     */
    public double getResponse(int column, int row) {
        return responses[column - 1][row];
    }

    public double[] getWavelengths() {
        return wavelengths.clone();
    }

    public double[] getResponses(int column) {
        if (column < 1 || column >= columnNames.length) {
            throw new IndexOutOfBoundsException("Table '" + name + "' has no response column " + column);
        }
        return responses[column - 1].clone();
    }

    @Override
    public String toString() {
        return "SrfTable[" + name + ", columns=" + Arrays.toString(columnNames) + ", rows=" + wavelengths.length + "]";
    }
}
