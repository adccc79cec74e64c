package org.esa.bandsim.operator;

import org.esa.bandsim.BandDefinition;
import org.esa.bandsim.Sensor;
import org.esa.bandsim.SensorBandCatalog;
import org.esa.bandsim.SrfKey;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Simulates the bands of the supported sensors from a cleaned reflectance table.
 * One generic convolution is run per SRF table of a sensor; sensors with two satellite
 * variants (MSI) give two results.
 *
 * @author bandsim team
 */
public class BandSimulator {

    private static final Logger LOG = Logger.getLogger(BandSimulator.class.getName());

    private final SrfTableStore srfTableStore;

    public BandSimulator(SrfTableStore srfTableStore) {
        this.srfTableStore = srfTableStore;
    }

    /**
     * @param sensorName - sensor name as in {@link Sensor#getName()}, case insensitive
     * @throws IllegalArgumentException if the sensor is unknown
     * @see #simulate(Sensor, ReflectanceTable, List)
     */
    public Map<String, BandValues> simulate(String sensorName, ReflectanceTable spectra, List<String> stationIds) {
        return simulate(Sensor.fromName(sensorName), spectra, stationIds);
    }

    /**
     * Simulates all bands of one sensor.
     *
     * @param sensor     - the sensor
     * @param spectra    - the cleaned reflectance table
     * @param stationIds - the stations to simulate
     * @return the band values by output name, one entry per satellite variant
     * @throws BandSimException if the sensor's SRF tables do not fit its band definitions
     */
    public Map<String, BandValues> simulate(Sensor sensor, ReflectanceTable spectra, List<String> stationIds) {
        final List<BandDefinition> bandDefinitions = SensorBandCatalog.getBandDefinitions(sensor);
        Map<String, BandValues> results = new LinkedHashMap<String, BandValues>();
        for (SrfKey srfKey : sensor.getSrfKeys()) {
            final SrfTable srfTable = srfTableStore.getSrfTable(srfKey);
            if (srfTable == null) {
                throw new BandSimException("No SRF table '" + srfKey.getLabel() + "' for sensor " + sensor.getName());
            }
            final int requiredColumns = SensorBandCatalog.getRequiredSrfColumnCount(sensor);
            if (srfTable.getColumnCount() < requiredColumns) {
                throw new BandSimException("SRF table '" + srfKey.getLabel() + "' has " + srfTable.getColumnCount() +
                                                   " columns, " + sensor.getName() + " needs " + requiredColumns);
            }
            final String outputName = sensor.getOutputName(srfKey);
            results.put(outputName, BandConvolution.convolve(outputName, srfTable, bandDefinitions,
                                                             spectra, stationIds));
        }
        return results;
    }

    /**
     * Simulates all supported sensors.
     *
     * @see #simulateAll(ReflectanceTable, List, List)
     */
    public SimulationRun simulateAll(ReflectanceTable spectra, List<String> stationIds) {
        return simulateAll(spectra, stationIds, Arrays.asList(Sensor.values()));
    }

    /**
     * Simulates the given sensors one after the other. A sensor that fails is logged and
     * recorded in the run, the remaining sensors are still processed.
     *
     * @param spectra    - the cleaned reflectance table
     * @param stationIds - the stations to simulate
     * @param sensors    - the sensors, in processing order
     * @return the run holding results and failures
     */
    public SimulationRun simulateAll(ReflectanceTable spectra, List<String> stationIds, List<Sensor> sensors) {
        SimulationRun run = new SimulationRun();
        for (Sensor sensor : sensors) {
            final long t1 = System.currentTimeMillis();
            try {
                run.addResults(simulate(sensor, spectra, stationIds));
                final long t2 = System.currentTimeMillis();
                LOG.info(sensor.getName() + " simulation took " + (t2 - t1) + " ms");
            } catch (RuntimeException e) {
                LOG.log(Level.SEVERE, "Error in " + sensor.getName() + " simulation: " + e.getMessage(), e);
                run.addFailure(sensor, e);
            }
        }
        return run;
    }
}
