package org.esa.bandsim.io;

import junit.framework.TestCase;
import org.esa.bandsim.operator.SrfTable;

import java.io.IOException;
import java.io.StringReader;

public class SrfAccessTest extends TestCase {

    public void testReadSrfTable() throws IOException {
        final String csv = "# Landsat 5 TM\n" +
                "Wavelength,B1,B2\n" +
                "400,0.0,0.1\n" +
                "401,0.5,\n" +
                "\n" +
                "402,1.0,NA\n";
        final SrfTable table = SrfAccess.readSrfTable(new StringReader(csv), "l5");

        assertEquals("l5", table.getName());
        assertEquals(3, table.getColumnCount());
        assertEquals(3, table.getRowCount());
        assertEquals("Wavelength", table.getColumnName(0));
        assertEquals("B2", table.getColumnName(2));
        assertEquals(401.0, table.getWavelength(1), 0.0);
        assertEquals(0.5, table.getResponse(1, 1), 0.0);
        assertEquals(0.1, table.getResponse(2, 0), 0.0);
        assertTrue(Double.isNaN(table.getResponse(2, 1)));
        assertTrue(Double.isNaN(table.getResponse(2, 2)));
    }

    public void testQuotedHeader() throws IOException {
        final SrfTable table = SrfAccess.readSrfTable(new StringReader("\"SR_WL\",\"CA\"\n440,1.0\n"), "l8");
        assertEquals("SR_WL", table.getColumnName(0));
        assertEquals("CA", table.getColumnName(1));
    }

    public void testHeaderWithByteOrderMark() throws IOException {
        final SrfTable table = SrfAccess.readSrfTable(new StringReader("\uFEFFWavelength,B1\n400,1.0\n"), "s2a");
        assertEquals("Wavelength", table.getColumnName(0));
        assertEquals(1.0, table.getResponse(1, 0), 0.0);
    }

    public void testRaggedRow() {
        try {
            SrfAccess.readSrfTable(new StringReader("Wavelength,B1\n400,0.1,0.2\n"), "s3");
            fail("IOException expected");
        } catch (IOException expected) {
            assertTrue(expected.getMessage().contains("line 2"));
        }
    }

    public void testNotANumber() {
        try {
            SrfAccess.readSrfTable(new StringReader("Wavelength,B1\n400,high\n"), "s3");
            fail("IOException expected");
        } catch (IOException expected) {
            assertTrue(expected.getMessage().contains("high"));
        }
    }

    public void testEmptyTable() {
        try {
            SrfAccess.readSrfTable(new StringReader("Wavelength,B1\n"), "modis");
            fail("IOException expected");
        } catch (IOException expected) {
            assertTrue(expected.getMessage().contains("empty"));
        }
    }

    public void testMissingBandColumn() {
        try {
            SrfAccess.readSrfTable(new StringReader("Wavelength\n400\n"), "planet");
            fail("IOException expected");
        } catch (IOException expected) {
            // ok
        }
    }
}
