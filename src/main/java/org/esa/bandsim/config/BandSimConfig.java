package org.esa.bandsim.config;

import org.esa.bandsim.BandSimConstants;
import org.esa.bandsim.Sensor;
import org.jdom.Document;
import org.jdom.Element;
import org.jdom.JDOMException;
import org.jdom.input.SAXBuilder;

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
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Represents the configuration of a band simulation run.
 * <p/>
 * Example:
 * <pre>
 * &lt;bandsim_config&gt;
 *     &lt;input file="GLORIA_Rrs.csv" idColumn="GLORIA_ID" prefix="Rrs_"/&gt;
 *     &lt;srf dir="data-raw"/&gt;
 *     &lt;output dir="results"/&gt;
 *     &lt;stations target="1000"/&gt;
 *     &lt;sensors&gt;
 *         &lt;sensor name="MSI"/&gt;
 *         &lt;sensor name="OLCI"/&gt;
 *     &lt;/sensors&gt;
 * &lt;/bandsim_config&gt;
 * </pre>
 * Relative paths are resolved against the directory of the configuration file.
 * Without a <code>sensors</code> element all sensors are simulated.
 *
 * @author bandsim team
 */
public class BandSimConfig {

    public static final String DEFAULT_CONFIG_RESOURCE = "bandsim_config.xml";

    private static final Logger LOG = Logger.getLogger(BandSimConfig.class.getName());

    private Element rootElement;
    private final File baseDir;

    /**
     * Constructs a configuration from the given file.
     *
     * @param configFile - the XML file
     * @throws BandSimConfigException if the file could not be found or parsed
     */
    public BandSimConfig(File configFile) throws BandSimConfigException {
        baseDir = configFile.getAbsoluteFile().getParentFile();
        final InputStream inputStream;
        try {
            inputStream = new FileInputStream(configFile);
        } catch (FileNotFoundException e) {
            throw new BandSimConfigException("Configuration file not found: " + configFile.getPath(), e);
        }
        try {
            init(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        } finally {
            closeQuietly(inputStream);
        }
    }

    /**
     * Constructs a configuration from the given reader. Relative paths are resolved
     * against the given base directory.
     */
    public BandSimConfig(Reader reader, File baseDir) throws BandSimConfigException {
        this.baseDir = baseDir;
        init(reader);
    }

    /**
     * @return the configuration bundled with this module, paths relative to the working directory
     */
    public static BandSimConfig createDefault() throws BandSimConfigException {
        final InputStream inputStream = BandSimConfig.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE);
        if (inputStream == null) {
            throw new IllegalArgumentException("Could not find resource: " + DEFAULT_CONFIG_RESOURCE);
        }
        try {
            return new BandSimConfig(new InputStreamReader(inputStream, StandardCharsets.UTF_8), new File("."));
        } finally {
            closeQuietly(inputStream);
        }
    }

    public File getInputFile() throws BandSimConfigException {
        final Element inputElement = getMandatoryChild(rootElement, "input");
        return resolve(getMandatoryAttribute(inputElement, "file"));
    }

    public String getStationIdColumn() throws BandSimConfigException {
        final Element inputElement = getMandatoryChild(rootElement, "input");
        final String idColumn = getOptionalAttribute(inputElement, "idColumn");
        return idColumn != null ? idColumn : BandSimConstants.DEFAULT_STATION_ID_COLUMN;
    }

    public String getRrsPrefix() throws BandSimConfigException {
        final Element inputElement = getMandatoryChild(rootElement, "input");
        final String prefix = getOptionalAttribute(inputElement, "prefix");
        return prefix != null ? prefix : BandSimConstants.DEFAULT_RRS_PREFIX;
    }

    public File getSrfDir() throws BandSimConfigException {
        final Element srfElement = getMandatoryChild(rootElement, "srf");
        return resolve(getMandatoryAttribute(srfElement, "dir"));
    }

    public File getOutputDir() throws BandSimConfigException {
        final Element outputElement = getMandatoryChild(rootElement, "output");
        return resolve(getMandatoryAttribute(outputElement, "dir"));
    }

    /**
     * @return the number of output stations, {@link BandSimConstants#DEFAULT_TARGET_STATIONS} if not configured
     */
    public int getTargetStations() throws BandSimConfigException {
        final Element stationsElement = rootElement.getChild("stations");
        if (stationsElement == null) {
            return BandSimConstants.DEFAULT_TARGET_STATIONS;
        }
        final String target = getMandatoryAttribute(stationsElement, "target");
        final int targetStations;
        try {
            targetStations = Integer.parseInt(target.trim());
        } catch (NumberFormatException e) {
            throw new BandSimConfigException("Invalid target station count: '" + target + "'", e);
        }
        if (targetStations < 0) {
            throw new BandSimConfigException("Target station count must not be negative: " + targetStations);
        }
        return targetStations;
    }

    /**
     * @return the sensors to simulate, in processing order
     */
    public List<Sensor> getSensors() throws BandSimConfigException {
        final Element sensorsElement = rootElement.getChild("sensors");
        if (sensorsElement == null) {
            return Arrays.asList(Sensor.values());
        }
        List<Sensor> sensors = new ArrayList<Sensor>();
        final Iterator sensorElementIt = getMandatoryChildren(sensorsElement, "sensor");
        while (sensorElementIt.hasNext()) {
            Element sensorElement = (Element) sensorElementIt.next();
            final String name = getMandatoryAttribute(sensorElement, "name");
            final Sensor sensor;
            try {
                sensor = Sensor.fromName(name);
            } catch (IllegalArgumentException e) {
                throw new BandSimConfigException(e.getMessage(), e);
            }
            if (!sensors.contains(sensor)) {
                sensors.add(sensor);
            }
        }
        return sensors;
    }

    ///////////////////////////////////////////////////////////////////////////////////////////////////////////////////
    // Private implementation helpers

    private File resolve(String path) {
        final File file = new File(path);
        if (file.isAbsolute() || baseDir == null) {
            return file;
        }
        return new File(baseDir, path);
    }

    private Element getMandatoryChild(Element parent, String name) throws BandSimConfigException {
        final Element child = parent.getChild(name);
        if (child == null) {
            throw new BandSimConfigException("Missing element '" + name + "' in element '" + parent.getName() + "'");
        }
        return child;
    }

    private Iterator getMandatoryChildren(Element parent, String name) throws BandSimConfigException {
        final Iterator iterator = (parent.getChildren(name)).iterator();
        if (!iterator.hasNext()) {
            throw new BandSimConfigException("Missing element(s) '" + name + "' in element '" + parent.getName() + "'");
        }
        return iterator;
    }

    private String getOptionalAttribute(Element element, String name) {
        return element.getAttributeValue(name);
    }

    private String getMandatoryAttribute(Element element, String name) throws BandSimConfigException {
        final String value = element.getAttributeValue(name);
        if (value == null) {
            throw new BandSimConfigException("Missing attribute '" + name + "' in element '" + element.getName() + "'");
        }
        return value;
    }

    private void init(Reader reader) throws BandSimConfigException {
        final SAXBuilder saxBuilder = new SAXBuilder();
        saxBuilder.setValidation(false);
        try {
            final Document document = saxBuilder.build(reader);
            rootElement = document.getRootElement();
        } catch (JDOMException e) {
            throw new BandSimConfigException("Failed to load configuration", e);
        } catch (IOException e) {
            throw new BandSimConfigException("Failed to load configuration", e);
        }
        if (!"bandsim_config".equals(rootElement.getName())) {
            throw new BandSimConfigException("Unexpected root element '" + rootElement.getName() + "'");
        }
    }

    private static void closeQuietly(InputStream inputStream) {
        try {
            inputStream.close();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not close configuration stream", e);
        }
    }
}
