package org.esa.bandsim.config;

import junit.framework.TestCase;
import org.esa.bandsim.Sensor;

import java.io.File;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

public class BandSimConfigTest extends TestCase {

    private static final File BASE_DIR = new File("work");

    private BandSimConfig config;

    @Override
    protected void setUp() throws Exception {
        final Reader reader = new InputStreamReader(getClass().getResourceAsStream("test_config.xml"),
                                                    StandardCharsets.UTF_8);
        try {
            config = new BandSimConfig(reader, BASE_DIR);
        } finally {
            reader.close();
        }
    }

    public void testInput() throws BandSimConfigException {
        assertEquals(new File(BASE_DIR, "input/GLORIA_Rrs.csv"), config.getInputFile());
        assertEquals("station_id", config.getStationIdColumn());
        assertEquals("R_", config.getRrsPrefix());
    }

    public void testDirectories() throws BandSimConfigException {
        assertEquals(new File(BASE_DIR, "srf"), config.getSrfDir());
        final File outputDir = config.getOutputDir();
        assertEquals(new File("/tmp/bandsim/results"), outputDir);
    }

    public void testTargetStations() throws BandSimConfigException {
        assertEquals(250, config.getTargetStations());
    }

    public void testSensorsWithoutDuplicates() throws BandSimConfigException {
        assertEquals(Arrays.asList(Sensor.OLCI, Sensor.MSI), config.getSensors());
    }

    public void testDefaults() throws BandSimConfigException {
        final BandSimConfig minimal = createConfig("<bandsim_config>" +
                                                           "<input file='rrs.csv'/>" +
                                                           "<srf dir='srf'/>" +
                                                           "<output dir='out'/>" +
                                                           "</bandsim_config>");
        assertEquals("GLORIA_ID", minimal.getStationIdColumn());
        assertEquals("Rrs_", minimal.getRrsPrefix());
        assertEquals(1000, minimal.getTargetStations());
        assertEquals(Arrays.asList(Sensor.values()), minimal.getSensors());
    }

    public void testMissingElement() throws BandSimConfigException {
        final BandSimConfig noSrf = createConfig("<bandsim_config><input file='rrs.csv'/></bandsim_config>");
        try {
            noSrf.getSrfDir();
            fail("BandSimConfigException expected");
        } catch (BandSimConfigException expected) {
            assertEquals("Missing element 'srf' in element 'bandsim_config'", expected.getMessage());
        }
    }

    public void testInvalidTargetStations() throws BandSimConfigException {
        try {
            createConfig("<bandsim_config><stations target='many'/></bandsim_config>").getTargetStations();
            fail("BandSimConfigException expected");
        } catch (BandSimConfigException expected) {
            assertTrue(expected.getCause() instanceof NumberFormatException);
        }
        try {
            createConfig("<bandsim_config><stations target='-1'/></bandsim_config>").getTargetStations();
            fail("BandSimConfigException expected");
        } catch (BandSimConfigException expected) {
            // ok
        }
    }

    public void testUnknownSensor() throws BandSimConfigException {
        final BandSimConfig unknown = createConfig("<bandsim_config><sensors><sensor name='AVHRR'/></sensors>" +
                                                           "</bandsim_config>");
        try {
            unknown.getSensors();
            fail("BandSimConfigException expected");
        } catch (BandSimConfigException expected) {
            assertTrue(expected.getMessage().contains("AVHRR"));
        }
    }

    public void testWrongRootElement() {
        try {
            createConfig("<dpm_config/>");
            fail("BandSimConfigException expected");
        } catch (BandSimConfigException expected) {
            // ok
        }
    }

    public void testMalformedXml() {
        try {
            createConfig("<bandsim_config>");
            fail("BandSimConfigException expected");
        } catch (BandSimConfigException expected) {
            assertNotNull(expected.getCause());
        }
    }

    public void testMissingFile() {
        try {
            new BandSimConfig(new File("no_such_config.xml"));
            fail("BandSimConfigException expected");
        } catch (BandSimConfigException expected) {
            // ok
        }
    }

    public void testDefaultConfig() throws BandSimConfigException {
        final BandSimConfig defaultConfig = BandSimConfig.createDefault();
        assertEquals(1000, defaultConfig.getTargetStations());
        assertEquals(Sensor.values().length, defaultConfig.getSensors().size());
        assertEquals("GLORIA_Rrs.csv", defaultConfig.getInputFile().getName());
        assertEquals("data-raw", defaultConfig.getSrfDir().getName());
    }

    private static BandSimConfig createConfig(String xml) throws BandSimConfigException {
        return new BandSimConfig(new StringReader(xml), BASE_DIR);
    }
}
