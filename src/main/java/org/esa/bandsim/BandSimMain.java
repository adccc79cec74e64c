package org.esa.bandsim;

import org.esa.bandsim.config.BandSimConfig;
import org.esa.bandsim.config.BandSimConfigException;
import org.esa.bandsim.io.ReflectanceReader;
import org.esa.bandsim.io.ResultWriter;
import org.esa.bandsim.operator.BandSimulator;
import org.esa.bandsim.operator.BandValues;
import org.esa.bandsim.operator.PreprocessingResult;
import org.esa.bandsim.operator.ReflectancePreprocessor;
import org.esa.bandsim.operator.ReflectanceTable;
import org.esa.bandsim.operator.ResultAssembler;
import org.esa.bandsim.operator.SimulationRun;
import org.esa.bandsim.operator.SrfTableStore;
import org.esa.bandsim.operator.WaveTable;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point: reads the reflectance dataset, simulates the configured sensors
 * and writes one CSV file per sensor (variant).
 * <p/>
 * Usage: <code>BandSimMain [config.xml]</code>. Without argument the bundled default
 * configuration is used.
 *
 * @author bandsim team
 */
public class BandSimMain {

    private static final Logger LOG = Logger.getLogger(BandSimMain.class.getName());

    private final BandSimConfig config;

    public BandSimMain(BandSimConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        try {
            final BandSimConfig config;
            if (args.length > 0) {
                config = new BandSimConfig(new File(args[0]));
            } else {
                config = BandSimConfig.createDefault();
            }
            final List<File> files = new BandSimMain(config).run();
            LOG.info("Simulation completed, " + files.size() + " result files written");
        } catch (BandSimConfigException e) {
            LOG.log(Level.SEVERE, "Configuration error: " + e.getMessage(), e);
            System.exit(1);
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "I/O error: " + e.getMessage(), e);
            System.exit(2);
        }
    }

    /**
     * Runs the complete simulation.
     *
     * @return the files written
     * @throws BandSimConfigException if the configuration or the SRF tables are incomplete
     * @throws IOException            if the input cannot be read or the output directory not created
     */
    public List<File> run() throws BandSimConfigException, IOException {
        final long t1 = System.currentTimeMillis();
        // SRF tables first, nothing is simulated unless all of them are available
        final SrfTableStore srfTableStore = SrfTableStore.load(config.getSrfDir());
        final BandSimulator simulator = new BandSimulator(srfTableStore);
        final int targetStations = config.getTargetStations();
        final ResultWriter resultWriter = new ResultWriter(config.getOutputDir());
        final long t2 = System.currentTimeMillis();
        LOG.info("Reading SRF tables took " + (t2 - t1) + " ms");

        LOG.info("Loading reflectance data from " + config.getInputFile().getPath());
        final ReflectanceReader reader = new ReflectanceReader(config.getStationIdColumn(), config.getRrsPrefix());
        final ReflectanceTable rawTable = reader.read(config.getInputFile());

        LOG.info("Processing spectra...");
        final PreprocessingResult preprocessed = ReflectancePreprocessor.process(rawTable, targetStations);
        final long t3 = System.currentTimeMillis();
        LOG.info("Reading and processing spectra took " + (t3 - t2) + " ms");

        LOG.info("Running satellite band simulations...");
        final SimulationRun run = simulator.simulateAll(preprocessed.getTable(), preprocessed.getStationIds(),
                                                        config.getSensors());
        final long t4 = System.currentTimeMillis();
        LOG.info("Simulations took " + (t4 - t3) + " ms");

        LOG.info("Saving results...");
        List<WaveTable> waveTables = new ArrayList<WaveTable>();
        for (BandValues bandValues : run.getResults().values()) {
            waveTables.add(ResultAssembler.assemble(bandValues, targetStations));
        }
        final List<File> files = resultWriter.writeAll(waveTables);
        LOG.info("Results saved to " + resultWriter.getOutputDir().getPath());
        if (run.hasFailures()) {
            LOG.warning("Simulation failed for sensor(s) " + run.getFailures().keySet());
        }
        return files;
    }
}
