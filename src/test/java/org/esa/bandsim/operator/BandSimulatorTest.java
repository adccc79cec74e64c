package org.esa.bandsim.operator;

import org.esa.bandsim.Sensor;
import org.esa.bandsim.SensorBandCatalog;
import org.esa.bandsim.SrfKey;
import org.esa.bandsim.TestDataFactory;
import org.esa.bandsim.config.BandSimConfigException;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import static junit.framework.Assert.assertEquals;
import static junit.framework.Assert.assertFalse;
import static junit.framework.Assert.assertNotNull;
import static junit.framework.Assert.assertNull;
import static junit.framework.Assert.assertTrue;

public class BandSimulatorTest {

    private ReflectanceTable spectra;

    @Before
    public void setUp() {
        spectra = TestDataFactory.createGaussianSpectra(3);
    }

    @Test
    public void testSimulateAllSensors() {
        final BandSimulator simulator = new BandSimulator(TestDataFactory.createSrfTableStore());
        final SimulationRun run = simulator.simulateAll(spectra, spectra.getStationIds());

        assertFalse(run.hasFailures());
        final Map<String, BandValues> results = run.getResults();
        assertEquals(Arrays.asList("msi_s2a", "msi_s2b", "oli", "etm", "tm", "olci", "superdove", "modis"),
                     new ArrayList<String>(results.keySet()));
        for (BandValues bandValues : results.values()) {
            assertEquals(3, bandValues.getStationCount());
        }
        assertEquals(19, run.getResult("olci").getBandCount());
        assertEquals(16, run.getResult("modis").getBandCount());
        assertEquals(2130, run.getResult("modis").getCenterWavelengths()[15]);
    }

    @Test
    public void testMsiGivesTwoVariants() {
        final BandSimulator simulator = new BandSimulator(TestDataFactory.createSrfTableStore());
        final Map<String, BandValues> results = simulator.simulate(Sensor.MSI, spectra, spectra.getStationIds());
        assertEquals(2, results.size());
        assertTrue(Arrays.equals(SensorBandCatalog.getCenterWavelengths(Sensor.MSI),
                                 results.get("msi_s2a").getCenterWavelengths()));
        assertTrue(Arrays.equals(SensorBandCatalog.getCenterWavelengths(Sensor.MSI),
                                 results.get("msi_s2b").getCenterWavelengths()));
    }

    @Test
    public void testSimulateBySensorName() {
        final BandSimulator simulator = new BandSimulator(TestDataFactory.createSrfTableStore());
        final Map<String, BandValues> results = simulator.simulate(" superdove ", spectra, spectra.getStationIds());
        assertEquals(1, results.size());
        assertEquals(8, results.get("superdove").getBandCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownSensorName() {
        final BandSimulator simulator = new BandSimulator(TestDataFactory.createSrfTableStore());
        simulator.simulate("AVHRR", spectra, spectra.getStationIds());
    }

    @Test
    public void testFailingSensorDoesNotStopOthers() throws BandSimConfigException {
        final Map<SrfKey, SrfTable> srfTables = TestDataFactory.createGaussianSrfTables();
        // OLI needs 5 response columns
        srfTables.put(SrfKey.L8, TestDataFactory.createGaussianSrfTable("l8", 3));
        final BandSimulator simulator = new BandSimulator(new SrfTableStore(srfTables));

        final SimulationRun run = simulator.simulateAll(spectra, spectra.getStationIds());
        assertTrue(run.hasFailures());
        assertEquals(1, run.getFailures().size());
        assertTrue(run.getFailures().get(Sensor.OLI) instanceof BandSimException);
        assertNull(run.getResult("oli"));
        assertEquals(7, run.getResults().size());
        assertNotNull(run.getResult("etm"));
    }

    @Test
    public void testSimulateSelectedSensors() {
        final BandSimulator simulator = new BandSimulator(TestDataFactory.createSrfTableStore());
        final SimulationRun run = simulator.simulateAll(spectra, spectra.getStationIds(),
                                                        Arrays.asList(Sensor.TM, Sensor.OLI));
        assertEquals(Arrays.asList("tm", "oli"), new ArrayList<String>(run.getResults().keySet()));
    }

    @Test
    public void testModisBandsInsideWindowHaveData() {
        final BandSimulator simulator = new BandSimulator(TestDataFactory.createSrfTableStore());
        final BandValues modis = simulator.simulate(Sensor.MODIS, spectra, spectra.getStationIds()).get("modis");
        // synthetic MODIS responses all lie inside 400-900nm
        for (int band = 0; band < modis.getBandCount(); band++) {
            assertFalse(modis.isNoData(band, 0));
        }
    }

    @Test
    public void testSimulatingSubsetOfStations() {
        final BandSimulator simulator = new BandSimulator(TestDataFactory.createSrfTableStore());
        final Map<String, BandValues> results = simulator.simulate(Sensor.TM, spectra,
                                                                   spectra.getStationIds().subList(0, 2));
        assertEquals(2, results.get("tm").getStationCount());
    }
}
