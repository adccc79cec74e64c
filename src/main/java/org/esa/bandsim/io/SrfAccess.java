package org.esa.bandsim.io;

import org.esa.bandsim.SrfKey;
import org.esa.bandsim.config.BandSimConfigException;
import org.esa.bandsim.operator.SrfTable;
import org.esa.bandsim.util.BandSimUtils;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Access to the spectral response function tables.
 * <p/>
 * Each table is a CSV file <code>&lt;key&gt;_srf.csv</code> with a header row, the wavelength [nm]
 * in the first column and the raw band responses in the following columns.
 *
 * @author bandsim team
 */
public class SrfAccess {

    private static final Logger LOG = Logger.getLogger(SrfAccess.class.getName());

    private SrfAccess() {
    }

    /**
     * Reads the SRF tables of all satellites from the given directory.
     *
     * @param srfDir - directory holding one <code>&lt;key&gt;_srf.csv</code> per {@link SrfKey}
     * @return the tables by key
     * @throws BandSimConfigException if any table is missing or cannot be read
     */
    public static Map<SrfKey, SrfTable> readSrfTables(File srfDir) throws BandSimConfigException {
        if (!srfDir.isDirectory()) {
            throw new BandSimConfigException("SRF directory not found: " + srfDir.getPath());
        }
        Map<SrfKey, SrfTable> tables = new EnumMap<SrfKey, SrfTable>(SrfKey.class);
        for (SrfKey key : SrfKey.values()) {
            final File file = new File(srfDir, key.getFileName());
            if (!file.isFile()) {
                throw new BandSimConfigException("SRF table not found: " + file.getPath());
            }
            try {
                tables.put(key, readSrfTable(file, key.getLabel()));
            } catch (IOException e) {
                throw new BandSimConfigException("Cannot read SRF table " + file.getPath() + ": " + e.getMessage(), e);
            }
        }
        return tables;
    }

    public static SrfTable readSrfTable(File file, String name) throws IOException {
        final InputStream inputStream = new FileInputStream(file);
        try {
            return readSrfTable(new InputStreamReader(inputStream, StandardCharsets.UTF_8), name);
        } finally {
            inputStream.close();
        }
    }

    public static SrfTable readSrfTable(Reader reader, String name) throws IOException {
        BufferedReader bufferedReader = new BufferedReader(reader);
        String[] header = null;
        List<double[]> rows = new ArrayList<double[]>();
        String line;
        int lineNumber = 0;
        while ((line = bufferedReader.readLine()) != null) {
            lineNumber++;
            if (lineNumber == 1) {
                line = CsvSupport.stripByteOrderMark(line);
            }
            if (CsvSupport.isSkippable(line)) {
                continue;
            }
            final String[] tokens = CsvSupport.split(line);
            if (header == null) {
                header = tokens;
                if (header.length < 2) {
                    throw new IOException("SRF table '" + name + "' needs a wavelength and at least one band column");
                }
                continue;
            }
            if (tokens.length != header.length) {
                throw new IOException("SRF table '" + name + "', line " + lineNumber + ": " + tokens.length +
                                              " values, expected " + header.length);
            }
            double[] row = new double[tokens.length];
            for (int i = 0; i < tokens.length; i++) {
                try {
                    row[i] = CsvSupport.parseValue(tokens[i]);
                } catch (NumberFormatException e) {
                    throw new IOException("SRF table '" + name + "', line " + lineNumber +
                                                  ": not a number: '" + tokens[i] + "'", e);
                }
            }
            rows.add(row);
        }
        if (header == null || rows.isEmpty()) {
            throw new IOException("SRF table '" + name + "' is empty");
        }

        final int numRows = rows.size();
        double[] wavelengths = new double[numRows];
        double[][] responses = new double[header.length - 1][numRows];
        for (int r = 0; r < numRows; r++) {
            final double[] row = rows.get(r);
            wavelengths[r] = row[0];
            for (int c = 1; c < row.length; c++) {
                responses[c - 1][r] = row[c];
            }
        }
        for (int c = 0; c < responses.length; c++) {
            if (BandSimUtils.isAllNaNDouble1D(responses[c])) {
                LOG.warning("SRF table '" + name + "': column '" + header[c + 1] + "' has no valid responses");
            }
        }
        return new SrfTable(name, header, wavelengths, responses);
    }
}
