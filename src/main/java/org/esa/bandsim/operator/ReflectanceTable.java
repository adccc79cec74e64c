package org.esa.bandsim.operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rectangular wavelength x station table of water reflectances (Rrs).
 * All stations share the same integer wavelength grid. Values may be NaN (missing)
 * or negative until the table has been through the {@link ReflectancePreprocessor}.
 * <p/>
 * Instances are immutable and may be shared between sensor runs.
 *
 * @author bandsim team
 */
public class ReflectanceTable {

    private final int[] wavelengths;
    private final List<String> stationIds;
    // spectra[station][wavelength index]
    private final double[][] spectra;
    private final Map<Integer, Integer> wavelengthIndex;

    /**
     * @param wavelengths - the wavelength grid [nm], strictly increasing
     * @param stationIds  - one identifier per station
     * @param spectra     - spectra[station][wavelengthIndex]
     */
    public ReflectanceTable(int[] wavelengths, List<String> stationIds, double[][] spectra) {
        if (stationIds.size() != spectra.length) {
            throw new IllegalArgumentException(stationIds.size() + " station identifiers for " +
                                                       spectra.length + " spectra");
        }
        for (int i = 1; i < wavelengths.length; i++) {
            if (wavelengths[i] <= wavelengths[i - 1]) {
                throw new IllegalArgumentException("Wavelengths not strictly increasing at " + wavelengths[i]);
            }
        }
        for (int s = 0; s < spectra.length; s++) {
            if (spectra[s].length != wavelengths.length) {
                throw new IllegalArgumentException("Spectrum of station '" + stationIds.get(s) + "' has " +
                                                           spectra[s].length + " values, expected " +
                                                           wavelengths.length);
            }
        }
        this.wavelengths = wavelengths.clone();
        this.stationIds = Collections.unmodifiableList(new ArrayList<String>(stationIds));
        this.spectra = new double[spectra.length][];
        for (int s = 0; s < spectra.length; s++) {
            this.spectra[s] = spectra[s].clone();
        }
        wavelengthIndex = new HashMap<Integer, Integer>(wavelengths.length);
        for (int i = 0; i < wavelengths.length; i++) {
            wavelengthIndex.put(wavelengths[i], i);
        }
    }

    public int getStationCount() {
        return spectra.length;
    }

    public int getWavelengthCount() {
        return wavelengths.length;
    }

    public int[] getWavelengths() {
        return wavelengths.clone();
    }

    public int getWavelength(int index) {
        return wavelengths[index];
    }

    public List<String> getStationIds() {
        return stationIds;
    }

    public String getStationId(int station) {
        return stationIds.get(station);
    }

    /**
     * @param wavelength - wavelength [nm]
     * @return the row of this wavelength in the grid, or -1 if it is not part of the grid
     */
    public int indexOfWavelength(int wavelength) {
        final Integer index = wavelengthIndex.get(wavelength);
        return index != null ? index : -1;
    }

    public boolean containsWavelength(int wavelength) {
        return wavelengthIndex.containsKey(wavelength);
    }

    public double getValue(int station, int wavelengthIndex) {
        return spectra[station][wavelengthIndex];
    }

    public double[] getSpectrum(int station) {
        return spectra[station].clone();
    }
}
