package org.esa.bandsim.operator;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.util.MathArrays;
import org.esa.bandsim.BandDefinition;
import org.esa.bandsim.BandSimConstants;
import org.esa.bandsim.WavelengthWindow;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Band convolution: weights a reflectance spectrum with the spectral response function
 * of each band of a sensor and gives one value per band and station.
 * <p/>
 * For every band the SRF samples are filtered (NaN pairs dropped, optional wavelength
 * window applied) and normalized to sum 1 over the filtered support. The band value is
 * the dot product of these weights with the reflectances at the SRF wavelengths that are
 * part of the spectrum's grid. SRF wavelengths missing from the grid are dropped, their
 * weight is not redistributed. Bands without usable support give NaN ("no data").
 *
 * @author bandsim team
 */
public class BandConvolution {

    private static final Logger LOG = Logger.getLogger(BandConvolution.class.getName());

    private BandConvolution() {
    }

    /**
     * Simulates all bands of a sensor for all given stations.
     *
     * @param name            - name of the result, e.g. "oli"
     * @param srfTable        - the SRF table of the sensor (variant)
     * @param bandDefinitions - the sensor's bands, in output order
     * @param spectra         - cleaned reflectance table (no negatives, no NaN)
     * @param stationIds      - identifiers of the stations to simulate, the first
     *                          <code>stationIds.size()</code> columns of the table
     * @return band x station values
     * @throws BandSimException if the SRF table or the station list do not fit
     */
    public static BandValues convolve(String name,
                                      SrfTable srfTable,
                                      List<BandDefinition> bandDefinitions,
                                      ReflectanceTable spectra,
                                      List<String> stationIds) {
        checkShapes(srfTable, bandDefinitions, spectra, stationIds);

        final int numBands = bandDefinitions.size();
        final int numStations = stationIds.size();
        double[][] values = new double[numBands][numStations];
        int[] centerWavelengths = new int[numBands];

        for (int band = 0; band < numBands; band++) {
            final BandDefinition bandDefinition = bandDefinitions.get(band);
            centerWavelengths[band] = bandDefinition.getCenterWavelength();
            final BandWeights bandWeights = computeBandWeights(srfTable, bandDefinition);
            if (bandWeights == null) {
                LOG.fine(name + ": no valid SRF support for " + bandDefinition);
                Arrays.fill(values[band], BandSimConstants.NO_DATA_VALUE);
                continue;
            }
            final MatchedWeights matched = matchToGrid(bandWeights, spectra);
            if (matched == null) {
                LOG.fine(name + ": no SRF wavelength of " + bandDefinition + " is part of the spectra grid");
                Arrays.fill(values[band], BandSimConstants.NO_DATA_VALUE);
                continue;
            }
            for (int station = 0; station < numStations; station++) {
                values[band][station] = computeBandValue(matched, spectra, station);
            }
        }
        return new BandValues(name, centerWavelengths, stationIds, values);
    }

    /* package local for testing*/
    static BandWeights computeBandWeights(SrfTable srfTable, BandDefinition bandDefinition) {
        final int column = bandDefinition.getSrfColumn();
        final WavelengthWindow window = bandDefinition.getWindow();
        final int numRows = srfTable.getRowCount();

        double[] wavelengths = new double[numRows];
        double[] responses = new double[numRows];
        int count = 0;
        for (int row = 0; row < numRows; row++) {
            final double wavelength = srfTable.getWavelength(row);
            final double response = srfTable.getResponse(column, row);
            if (Double.isNaN(wavelength) || Double.isNaN(response)) {
                continue;
            }
            if (window != null && !window.contains(wavelength)) {
                continue;
            }
            wavelengths[count] = wavelength;
            responses[count] = response;
            count++;
        }
        if (count == 0) {
            return null;
        }
        responses = Arrays.copyOf(responses, count);
        final double responseSum = StatUtils.sum(responses);
        if (!(responseSum > 0.0)) {
            return null;
        }

        double[] weights = new double[count];
        for (int i = 0; i < count; i++) {
            weights[i] = responses[i] / responseSum;
        }
        return new BandWeights(Arrays.copyOf(wavelengths, count), weights);
    }

    /* package local for testing*/
    static MatchedWeights matchToGrid(BandWeights bandWeights, ReflectanceTable spectra) {
        final int size = bandWeights.size();
        int[] rows = new int[size];
        double[] weights = new double[size];
        int count = 0;
        for (int i = 0; i < size; i++) {
            final double wavelength = bandWeights.getWavelength(i);
            // exact match only, no interpolation
            if (wavelength != Math.rint(wavelength)) {
                continue;
            }
            final int row = spectra.indexOfWavelength((int) wavelength);
            if (row >= 0) {
                rows[count] = row;
                weights[count] = bandWeights.getWeight(i);
                count++;
            }
        }
        if (count == 0) {
            return null;
        }
        return new MatchedWeights(Arrays.copyOf(rows, count), Arrays.copyOf(weights, count));
    }

    /* package local for testing*/
    static double computeBandValue(MatchedWeights matched, ReflectanceTable spectra, int station) {
        final int[] rows = matched.rows;
        double[] reflectances = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            reflectances[i] = spectra.getValue(station, rows[i]);
        }
        return MathArrays.linearCombination(matched.weights, reflectances);
    }

    private static void checkShapes(SrfTable srfTable,
                                    List<BandDefinition> bandDefinitions,
                                    ReflectanceTable spectra,
                                    List<String> stationIds) {
        for (BandDefinition bandDefinition : bandDefinitions) {
            if (bandDefinition.getSrfColumn() >= srfTable.getColumnCount()) {
                throw new BandSimException("SRF table '" + srfTable.getName() + "' has " +
                                                   srfTable.getColumnCount() + " columns, band " +
                                                   bandDefinition + " needs column " +
                                                   bandDefinition.getSrfColumn());
            }
        }
        if (stationIds.size() > spectra.getStationCount()) {
            throw new BandSimException(stationIds.size() + " stations requested, but the reflectance table has only " +
                                               spectra.getStationCount());
        }
    }

    /**
     * Weights of the SRF wavelengths found in the spectra grid, with their grid rows.
     */
    static class MatchedWeights {
        final int[] rows;
        final double[] weights;

        MatchedWeights(int[] rows, double[] weights) {
            this.rows = rows;
            this.weights = weights;
        }
    }
}
