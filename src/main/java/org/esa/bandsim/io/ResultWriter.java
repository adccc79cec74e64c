package org.esa.bandsim.io;

import org.esa.bandsim.BandSimConstants;
import org.esa.bandsim.operator.WaveTable;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes wave tables as CSV files <code>&lt;name&gt;_simulation.csv</code> into an output directory.
 * No-data values are written as empty fields.
 *
 * @author bandsim team
 */
public class ResultWriter {

    private static final Logger LOG = Logger.getLogger(ResultWriter.class.getName());

    private final File outputDir;

    public ResultWriter(File outputDir) throws IOException {
        if (!outputDir.isDirectory() && !outputDir.mkdirs()) {
            throw new IOException("Cannot create output directory " + outputDir.getPath());
        }
        this.outputDir = outputDir;
    }

    public File getOutputDir() {
        return outputDir;
    }

    public File getOutputFile(String name) {
        return new File(outputDir, name + BandSimConstants.SIMULATION_FILE_SUFFIX);
    }

    /**
     * Writes all given tables. Empty tables are skipped, a table that cannot be written is
     * logged and does not stop the others.
     *
     * @param waveTables - the tables
     * @return the files written
     */
    public List<File> writeAll(Collection<WaveTable> waveTables) {
        List<File> files = new ArrayList<File>();
        for (WaveTable waveTable : waveTables) {
            if (waveTable.isEmpty()) {
                LOG.warning(waveTable.getName() + " results are empty");
                continue;
            }
            try {
                files.add(write(waveTable));
            } catch (IOException e) {
                LOG.log(Level.SEVERE, "Error saving " + waveTable.getName() + " results: " + e.getMessage(), e);
            }
        }
        return files;
    }

    public File write(WaveTable waveTable) throws IOException {
        final File file = getOutputFile(waveTable.getName());
        final Writer writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file),
                                                                        StandardCharsets.UTF_8));
        try {
            write(waveTable, writer);
        } finally {
            writer.close();
        }
        return file;
    }

    public static void write(WaveTable waveTable, Writer writer) throws IOException {
        final List<String> columnNames = waveTable.getColumnNames();
        for (int i = 0; i < columnNames.size(); i++) {
            if (i > 0) {
                writer.write(CsvSupport.SEPARATOR);
            }
            writer.write(columnNames.get(i));
        }
        writer.write('\n');
        final int numStations = waveTable.getStationColumnCount();
        for (int row = 0; row < waveTable.getRowCount(); row++) {
            writer.write(Integer.toString(waveTable.getWave(row)));
            for (int s = 0; s < numStations; s++) {
                writer.write(CsvSupport.SEPARATOR);
                writer.write(CsvSupport.formatValue(waveTable.getValue(row, s)));
            }
            writer.write('\n');
        }
        writer.flush();
    }
}
