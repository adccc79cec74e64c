package org.esa.bandsim.operator;

import org.esa.bandsim.Sensor;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Results of a run over several sensors: the band values by output name, and the
 * failures of the sensors that could not be simulated.
 *
 * @author bandsim team
 */
public class SimulationRun {

    private final Map<String, BandValues> results = new LinkedHashMap<String, BandValues>();
    private final Map<Sensor, Exception> failures = new EnumMap<Sensor, Exception>(Sensor.class);

    void addResults(Map<String, BandValues> sensorResults) {
        results.putAll(sensorResults);
    }

    void addFailure(Sensor sensor, Exception failure) {
        failures.put(sensor, failure);
    }

    /**
     * @return results by output name, in processing order
     */
    public Map<String, BandValues> getResults() {
        return Collections.unmodifiableMap(results);
    }

    public BandValues getResult(String outputName) {
        return results.get(outputName);
    }

    public Map<Sensor, Exception> getFailures() {
        return Collections.unmodifiableMap(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
