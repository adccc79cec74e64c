package org.esa.bandsim.operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Container holding the simulated band values of one sensor (variant): a band x station
 * matrix together with the band center wavelengths and the station identifiers.
 * "No data" entries are NaN.
 *
 * @author bandsim team
 */
public class BandValues {

    private final String name;
    private final int[] centerWavelengths;
    private final List<String> stationIds;
    private final double[][] values;

    /**
     * @param name              - output name, e.g. "msi_s2a"
     * @param centerWavelengths - one center wavelength per band
     * @param stationIds        - one identifier per station
     * @param values            - values[band][station]
     */
    public BandValues(String name, int[] centerWavelengths, List<String> stationIds, double[][] values) {
        if (values.length != centerWavelengths.length) {
            throw new IllegalArgumentException(values.length + " value rows for " +
                                                       centerWavelengths.length + " bands");
        }
        for (double[] bandValues : values) {
            if (bandValues.length != stationIds.size()) {
                throw new IllegalArgumentException(bandValues.length + " values for " +
                                                           stationIds.size() + " stations");
            }
        }
        this.name = name;
        this.centerWavelengths = centerWavelengths.clone();
        this.stationIds = Collections.unmodifiableList(new ArrayList<String>(stationIds));
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            this.values[i] = values[i].clone();
        }
    }

    public String getName() {
        return name;
    }

    public int getBandCount() {
        return centerWavelengths.length;
    }

    public int getStationCount() {
        return stationIds.size();
    }

    public int[] getCenterWavelengths() {
        return centerWavelengths.clone();
    }

    public List<String> getStationIds() {
        return stationIds;
    }

    public double getValue(int band, int station) {
        return values[band][station];
    }

    public boolean isNoData(int band, int station) {
        return Double.isNaN(values[band][station]);
    }

    public double[] getBandValues(int band) {
        return values[band].clone();
    }

    public double[] getStationValues(int station) {
        double[] stationValues = new double[values.length];
        for (int band = 0; band < values.length; band++) {
            stationValues[band] = values[band][station];
        }
        return stationValues;
    }
}
