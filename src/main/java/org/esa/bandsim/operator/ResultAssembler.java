package org.esa.bandsim.operator;

import org.esa.bandsim.BandSimConstants;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Turns the band x station values of the convolution into the wave-centric output table
 * and pads its station columns to a fixed width.
 * <p/>
 * This padding is independent of the station padding done by the {@link ReflectancePreprocessor}:
 * the output always has exactly the target number of station columns.
 *
 * @author bandsim team
 */
public class ResultAssembler {

    private static final Logger LOG = Logger.getLogger(ResultAssembler.class.getName());

    private ResultAssembler() {
    }

    /**
     * @param bandValues     - the convolution result
     * @param targetStations - number of station columns of the output
     * @return the wave table; empty (no rows) if the result has no bands
     */
    public static WaveTable assemble(BandValues bandValues, int targetStations) {
        final int[] waves = bandValues.getCenterWavelengths();
        final int numBands = waves.length;
        final int available = Math.min(bandValues.getStationCount(), targetStations);

        List<String> columnNames = new ArrayList<String>(targetStations + 1);
        columnNames.add(BandSimConstants.WAVE_COLUMN_NAME);
        double[][] columns = new double[targetStations][];
        for (int i = 0; i < targetStations; i++) {
            columnNames.add(BandSimConstants.STATION_COLUMN_PREFIX + (i + 1));
            if (available > 0) {
                // real columns first, then cyclic copies of them
                columns[i] = bandValues.getStationValues(i % available);
            } else {
                columns[i] = new double[numBands];
                Arrays.fill(columns[i], 0.0);
            }
        }
        if (available == 0 && targetStations > 0) {
            LOG.warning(bandValues.getName() + ": no station results available, output columns set to 0");
        } else if (available < targetStations) {
            LOG.fine(bandValues.getName() + ": padded " + available + " result columns to " + targetStations);
        }
        return new WaveTable(bandValues.getName(), waves, columnNames, columns);
    }
}
