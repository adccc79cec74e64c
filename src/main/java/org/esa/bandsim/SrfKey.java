package org.esa.bandsim;

import java.util.Locale;

/**
 * Keys of the persisted spectral response function tables, one per satellite (variant).
 *
 * @author bandsim team
 */
public enum SrfKey {
    S3("s3"),
    S2A("s2a"),
    S2B("s2b"),
    L8("l8"),
    L7("l7"),
    L5("l5"),
    PLANET("planet"),
    MODIS("modis");

    private final String label;

    private SrfKey(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public String getFileName() {
        return label + BandSimConstants.SRF_FILE_SUFFIX;
    }

    public static SrfKey fromLabel(String label) {
        for (SrfKey key : values()) {
            if (key.label.equals(label.toLowerCase(Locale.ENGLISH))) {
                return key;
            }
        }
        throw new IllegalArgumentException("Unknown SRF table: " + label);
    }
}
