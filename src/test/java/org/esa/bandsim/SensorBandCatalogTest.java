package org.esa.bandsim;

import junit.framework.TestCase;

import java.util.List;

public class SensorBandCatalogTest extends TestCase {

    public void testBandCounts() {
        assertEquals(9, SensorBandCatalog.getBandCount(Sensor.MSI));
        assertEquals(5, SensorBandCatalog.getBandCount(Sensor.OLI));
        assertEquals(4, SensorBandCatalog.getBandCount(Sensor.ETM));
        assertEquals(4, SensorBandCatalog.getBandCount(Sensor.TM));
        assertEquals(19, SensorBandCatalog.getBandCount(Sensor.OLCI));
        assertEquals(8, SensorBandCatalog.getBandCount(Sensor.SUPERDOVE));
        assertEquals(16, SensorBandCatalog.getBandCount(Sensor.MODIS));
    }

    public void testCenterWavelengths() {
        assertArrayEquals(new int[]{440, 490, 560, 665, 705, 740, 783, 842, 865},
                          SensorBandCatalog.getCenterWavelengths(Sensor.MSI));
        assertArrayEquals(new int[]{490, 560, 665, 865}, SensorBandCatalog.getCenterWavelengths(Sensor.TM));
        assertArrayEquals(new int[]{443, 490, 531, 565, 610, 665, 705, 865},
                          SensorBandCatalog.getCenterWavelengths(Sensor.SUPERDOVE));

        final int[] olci = SensorBandCatalog.getCenterWavelengths(Sensor.OLCI);
        assertEquals(400, olci[0]);
        assertEquals(900, olci[olci.length - 1]);

        final int[] modis = SensorBandCatalog.getCenterWavelengths(Sensor.MODIS);
        assertEquals(412, modis[0]);
        assertEquals(2130, modis[15]);
    }

    public void testSrfColumnsFollowSourceOrder() {
        final List<BandDefinition> bands = SensorBandCatalog.getBandDefinitions(Sensor.OLCI);
        for (int i = 0; i < bands.size(); i++) {
            assertEquals(i + 1, bands.get(i).getSrfColumn());
        }
        assertEquals(20, SensorBandCatalog.getRequiredSrfColumnCount(Sensor.OLCI));
        assertEquals(5, SensorBandCatalog.getRequiredSrfColumnCount(Sensor.ETM));
    }

    public void testWindows() {
        for (Sensor sensor : new Sensor[]{Sensor.MSI, Sensor.OLCI, Sensor.SUPERDOVE, Sensor.MODIS}) {
            for (BandDefinition band : SensorBandCatalog.getBandDefinitions(sensor)) {
                assertTrue(band.hasWindow());
                assertEquals(400.0, band.getWindow().getMin(), 0.0);
                assertEquals(900.0, band.getWindow().getMax(), 0.0);
            }
        }
        for (Sensor sensor : new Sensor[]{Sensor.OLI, Sensor.ETM, Sensor.TM}) {
            for (BandDefinition band : SensorBandCatalog.getBandDefinitions(sensor)) {
                assertFalse(band.hasWindow());
            }
        }
    }

    public void testBandDefinitionsAreReadOnly() {
        try {
            SensorBandCatalog.getBandDefinitions(Sensor.TM).clear();
            fail("UnsupportedOperationException expected");
        } catch (UnsupportedOperationException expected) {
            assertEquals(4, SensorBandCatalog.getBandCount(Sensor.TM));
        }
    }

    public void testSensorVariants() {
        assertTrue(Sensor.MSI.hasVariants());
        final SrfKey[] msiKeys = Sensor.MSI.getSrfKeys();
        assertEquals(2, msiKeys.length);
        assertEquals("msi_s2a", Sensor.MSI.getOutputName(msiKeys[0]));
        assertEquals("msi_s2b", Sensor.MSI.getOutputName(msiKeys[1]));

        assertFalse(Sensor.SUPERDOVE.hasVariants());
        assertEquals("superdove", Sensor.SUPERDOVE.getOutputName(SrfKey.PLANET));
        assertEquals("modis", Sensor.MODIS.getOutputName(SrfKey.MODIS));
    }

    public void testSensorFromName() {
        assertSame(Sensor.SUPERDOVE, Sensor.fromName("superdove"));
        assertSame(Sensor.OLCI, Sensor.fromName(" OLCI "));
        try {
            Sensor.fromName("AVHRR");
            fail("IllegalArgumentException expected");
        } catch (IllegalArgumentException expected) {
            assertTrue(expected.getMessage().contains("AVHRR"));
        }
    }

    public void testSrfKeyFileNames() {
        assertEquals("s3_srf.csv", SrfKey.S3.getFileName());
        assertEquals("planet_srf.csv", SrfKey.PLANET.getFileName());
        assertSame(SrfKey.S2B, SrfKey.fromLabel("S2B"));
    }

    public void testInvalidWindow() {
        try {
            new WavelengthWindow(900, 400);
            fail("IllegalArgumentException expected");
        } catch (IllegalArgumentException expected) {
        }
        assertTrue(WavelengthWindow.VIS_NIR.contains(400));
        assertTrue(WavelengthWindow.VIS_NIR.contains(900));
        assertFalse(WavelengthWindow.VIS_NIR.contains(900.5));
    }

    private static void assertArrayEquals(int[] expected, int[] actual) {
        assertEquals(expected.length, actual.length);
        for (int i = 0; i < expected.length; i++) {
            assertEquals("index " + i, expected[i], actual[i]);
        }
    }
}
