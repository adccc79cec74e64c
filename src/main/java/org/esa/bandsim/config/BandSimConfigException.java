package org.esa.bandsim.config;

/**
 * Thrown when the band simulation cannot be configured: the configuration itself is
 * incomplete, or auxiliary data it refers to (SRF tables) are missing or malformed.
 *
 * @author bandsim team
 */
public class BandSimConfigException extends Exception {

    public BandSimConfigException(String message) {
        super(message);
    }

    public BandSimConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
