package org.esa.bandsim;

import java.util.Locale;

/**
 * Enumeration of the sensors whose bands can be simulated.
 * <p/>
 * The declaration order is the order in which a full run processes the sensors.
 *
 * @author bandsim team
 */
public enum Sensor {

    MSI("MSI", "Sentinel-2 MultiSpectral Instrument", SrfKey.S2A, SrfKey.S2B),
    OLI("OLI", "Landsat 8 Operational Land Imager", SrfKey.L8),
    ETM("ETM", "Landsat 7 Enhanced Thematic Mapper Plus", SrfKey.L7),
    TM("TM", "Landsat 5 Thematic Mapper", SrfKey.L5),
    OLCI("OLCI", "Sentinel-3 Ocean and Land Colour Instrument", SrfKey.S3),
    SUPERDOVE("SuperDove", "PlanetScope SuperDove", SrfKey.PLANET),
    MODIS("MODIS", "Moderate Resolution Imaging Spectroradiometer", SrfKey.MODIS);

    private final String name;
    private final String description;
    private final SrfKey[] srfKeys;

    Sensor(String name, String description, SrfKey... srfKeys) {
        this.name = name;
        this.description = description;
        this.srfKeys = srfKeys;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return the SRF tables of this sensor, one per satellite variant
     */
    public SrfKey[] getSrfKeys() {
        return srfKeys.clone();
    }

    public boolean hasVariants() {
        return srfKeys.length > 1;
    }

    /**
     * Gets the name under which the result for the given SRF variant is written,
     * e.g. <code>"oli"</code> or <code>"msi_s2a"</code>.
     *
     * @param srfKey - one of this sensor's SRF keys
     * @return the output name
     */
    public String getOutputName(SrfKey srfKey) {
        final String sensorName = name.toLowerCase(Locale.ENGLISH);
        if (hasVariants()) {
            return sensorName + "_" + srfKey.getLabel();
        }
        return sensorName;
    }

    public static Sensor fromName(String name) {
        for (Sensor sensor : values()) {
            if (sensor.name.equalsIgnoreCase(name.trim())) {
                return sensor;
            }
        }
        throw new IllegalArgumentException("Unknown sensor: " + name);
    }
}
