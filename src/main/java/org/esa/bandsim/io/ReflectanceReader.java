package org.esa.bandsim.io;

import org.esa.bandsim.BandSimConstants;
import org.esa.bandsim.operator.ReflectanceTable;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads hyperspectral reflectance datasets in the GLORIA layout: one row per station,
 * a station identifier column and one <code>Rrs_&lt;wavelength&gt;</code> column per wavelength.
 * Further columns are ignored.
 *
 * @author bandsim team
 */
public class ReflectanceReader {

    private static final Logger LOG = Logger.getLogger(ReflectanceReader.class.getName());

    private final String stationIdColumn;
    private final String rrsPrefix;

    public ReflectanceReader() {
        this(BandSimConstants.DEFAULT_STATION_ID_COLUMN, BandSimConstants.DEFAULT_RRS_PREFIX);
    }

    public ReflectanceReader(String stationIdColumn, String rrsPrefix) {
        this.stationIdColumn = stationIdColumn;
        this.rrsPrefix = rrsPrefix;
    }

    public ReflectanceTable read(File file) throws IOException {
        if (!file.isFile()) {
            throw new FileNotFoundException("File " + file.getPath() + " not found");
        }
        final InputStream inputStream = new FileInputStream(file);
        try {
            return read(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        } finally {
            inputStream.close();
        }
    }

    /**
     * @param reader - reader on the CSV content
     * @return the table, wavelengths in ascending order, stations in row order
     * @throws IOException              if the content cannot be read or parsed
     * @throws IllegalArgumentException if there are no reflectance columns
     */
    public ReflectanceTable read(Reader reader) throws IOException {
        BufferedReader bufferedReader = new BufferedReader(reader);
        String line = CsvSupport.stripByteOrderMark(bufferedReader.readLine());
        while (line != null && CsvSupport.isSkippable(line)) {
            line = bufferedReader.readLine();
        }
        if (line == null) {
            throw new IOException("Reflectance table is empty");
        }
        final String[] header = CsvSupport.split(line);
        final int idIndex = Arrays.asList(header).indexOf(stationIdColumn);
        if (idIndex < 0) {
            throw new IOException("Station identifier column '" + stationIdColumn + "' not found");
        }
        final RrsColumns rrsColumns = findRrsColumns(header);

        List<String> stationIds = new ArrayList<String>();
        List<double[]> spectra = new ArrayList<double[]>();
        int lineNumber = 1;
        while ((line = bufferedReader.readLine()) != null) {
            lineNumber++;
            if (CsvSupport.isSkippable(line)) {
                continue;
            }
            final String[] tokens = CsvSupport.split(line);
            if (tokens.length != header.length) {
                throw new IOException("Line " + lineNumber + ": " + tokens.length + " values, expected " +
                                              header.length);
            }
            double[] spectrum = new double[rrsColumns.wavelengths.length];
            for (int i = 0; i < spectrum.length; i++) {
                final String token = tokens[rrsColumns.columnIndices[i]];
                try {
                    spectrum[i] = CsvSupport.parseValue(token);
                } catch (NumberFormatException e) {
                    throw new IOException("Line " + lineNumber + ": not a number: '" + token + "'", e);
                }
            }
            stationIds.add(tokens[idIndex]);
            spectra.add(spectrum);
        }
        LOG.info("Read " + stationIds.size() + " stations with " + rrsColumns.wavelengths.length + " wavelengths (" +
                         rrsColumns.wavelengths[0] + "-" +
                         rrsColumns.wavelengths[rrsColumns.wavelengths.length - 1] + "nm)");
        return new ReflectanceTable(rrsColumns.wavelengths, stationIds, spectra.toArray(new double[spectra.size()][]));
    }

    private RrsColumns findRrsColumns(String[] header) {
        List<int[]> columns = new ArrayList<int[]>();
        for (int i = 0; i < header.length; i++) {
            if (header[i].startsWith(rrsPrefix)) {
                final String suffix = header[i].substring(rrsPrefix.length());
                try {
                    columns.add(new int[]{Integer.parseInt(suffix), i});
                } catch (NumberFormatException e) {
                    LOG.warning("Ignoring column '" + header[i] + "': no wavelength in column name");
                }
            }
        }
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("No " + rrsPrefix + " columns found in data");
        }
        int[][] sorted = columns.toArray(new int[columns.size()][]);
        Arrays.sort(sorted, new WavelengthColumnComparator());
        RrsColumns rrsColumns = new RrsColumns(sorted.length);
        for (int i = 0; i < sorted.length; i++) {
            rrsColumns.wavelengths[i] = sorted[i][0];
            rrsColumns.columnIndices[i] = sorted[i][1];
        }
        return rrsColumns;
    }

    private static class RrsColumns {
        final int[] wavelengths;
        final int[] columnIndices;

        RrsColumns(int size) {
            wavelengths = new int[size];
            columnIndices = new int[size];
        }
    }
}
