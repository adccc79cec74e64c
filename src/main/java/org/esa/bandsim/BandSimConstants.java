package org.esa.bandsim;

/**
 * Band simulation constants
 *
 * @author bandsim team
 */
public class BandSimConstants {

    public final static int MIN_WAVELENGTH = 400;
    public final static int MAX_WAVELENGTH = 900;

    public final static int DEFAULT_TARGET_STATIONS = 1000;

    public final static double NO_DATA_VALUE = Double.NaN;

    // input table (GLORIA layout)
    public final static String DEFAULT_STATION_ID_COLUMN = "GLORIA_ID";
    public final static String DEFAULT_RRS_PREFIX = "Rrs_";
    public final static String PLACEHOLDER_STATION_PREFIX = "PLACEHOLDER_STATION_";

    // output table
    public final static String WAVE_COLUMN_NAME = "Wave";
    public final static String STATION_COLUMN_PREFIX = "GID_";
    public final static String SIMULATION_FILE_SUFFIX = "_simulation.csv";

    public final static String SRF_FILE_SUFFIX = "_srf.csv";

    private BandSimConstants() {
    }
}
