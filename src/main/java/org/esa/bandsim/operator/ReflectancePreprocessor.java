package org.esa.bandsim.operator;

import org.esa.bandsim.BandSimConstants;
import org.esa.bandsim.WavelengthWindow;
import org.esa.bandsim.util.BandSimUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Prepares a raw reflectance table for the band convolution: restricts it to 400-900nm,
 * sets negative and missing reflectances to 0 and pads the stations up to a target count
 * by duplicating the real stations cyclically.
 *
 * @author bandsim team
 */
public class ReflectancePreprocessor {

    private static final Logger LOG = Logger.getLogger(ReflectancePreprocessor.class.getName());

    private ReflectancePreprocessor() {
    }

    /**
     * Cleans and pads the given table.
     *
     * @param rawTable       - the table as read from the input
     * @param targetStations - number of stations the result shall have at least
     * @return the preprocessing result
     */
    public static PreprocessingResult process(ReflectanceTable rawTable, int targetStations) {
        List<String> warnings = new ArrayList<String>();
        final ReflectanceTable restricted = restrictWavelengths(rawTable, WavelengthWindow.VIS_NIR);

        final int numStations = restricted.getStationCount();
        double[][] spectra = new double[numStations][];
        int clipped = 0;
        int filled = 0;
        for (int s = 0; s < numStations; s++) {
            double[] spectrum = restricted.getSpectrum(s);
            for (int i = 0; i < spectrum.length; i++) {
                if (Double.isNaN(spectrum[i])) {
                    spectrum[i] = 0.0;
                    filled++;
                } else if (spectrum[i] < 0.0) {
                    spectrum[i] = 0.0;
                    clipped++;
                }
            }
            spectra[s] = spectrum;
        }
        if (clipped > 0) {
            LOG.info("Set " + clipped + " negative reflectance values to 0");
        }
        if (filled > 0) {
            LOG.info("Set " + filled + " missing reflectance values to 0");
        }

        ReflectanceTable cleaned = new ReflectanceTable(restricted.getWavelengths(),
                                                        restricted.getStationIds(), spectra);
        LOG.info("Total stations in input dataset: " + numStations);
        if (numStations == 0) {
            final String warning = "No real stations to duplicate, cannot pad to " + targetStations + " stations";
            LOG.warning(warning);
            warnings.add(warning);
        } else if (numStations < targetStations) {
            cleaned = extendStations(cleaned, targetStations);
            LOG.info("Extended spectra from " + numStations + " to " + targetStations +
                             " stations with duplicated real data");
        } else {
            LOG.info("Using all " + numStations + " stations from input dataset");
        }
        return new PreprocessingResult(cleaned, numStations, clipped, filled, warnings);
    }

    /**
     * Appends duplicates of the existing stations until the table has <code>targetStations</code>
     * stations. Station <code>n + k</code> is a copy of station <code>k mod n</code>; the new
     * stations are named <code>PLACEHOLDER_STATION_&lt;column number&gt;</code>.
     *
     * @param table          - table with at least one station
     * @param targetStations - the wanted number of stations
     * @return the extended table, or the given table if it is already large enough
     */
    public static ReflectanceTable extendStations(ReflectanceTable table, int targetStations) {
        final int numStations = table.getStationCount();
        if (numStations >= targetStations) {
            return table;
        }
        final int[] sourceIndices = BandSimUtils.getCyclicPaddingIndices(numStations, targetStations);
        List<String> stationIds = new ArrayList<String>(table.getStationIds());
        double[][] spectra = new double[targetStations][];
        for (int s = 0; s < numStations; s++) {
            spectra[s] = table.getSpectrum(s);
        }
        for (int k = 0; k < sourceIndices.length; k++) {
            final int column = numStations + k;
            spectra[column] = table.getSpectrum(sourceIndices[k]);
            stationIds.add(BandSimConstants.PLACEHOLDER_STATION_PREFIX + (column + 1));
        }
        return new ReflectanceTable(table.getWavelengths(), stationIds, spectra);
    }

    /**
     * @return a table holding only the wavelengths inside the given window
     */
    public static ReflectanceTable restrictWavelengths(ReflectanceTable table, WavelengthWindow window) {
        final int[] wavelengths = table.getWavelengths();
        int count = 0;
        for (int wavelength : wavelengths) {
            if (window.contains(wavelength)) {
                count++;
            }
        }
        if (count == wavelengths.length) {
            return table;
        }
        int[] keptWavelengths = new int[count];
        int[] keptRows = new int[count];
        int j = 0;
        for (int i = 0; i < wavelengths.length; i++) {
            if (window.contains(wavelengths[i])) {
                keptWavelengths[j] = wavelengths[i];
                keptRows[j] = i;
                j++;
            }
        }
        double[][] spectra = new double[table.getStationCount()][count];
        for (int s = 0; s < spectra.length; s++) {
            for (int i = 0; i < count; i++) {
                spectra[s][i] = table.getValue(s, keptRows[i]);
            }
        }
        return new ReflectanceTable(keptWavelengths, table.getStationIds(), spectra);
    }
}
