package org.esa.bandsim.operator;

/**
 * Unchecked exception thrown when a band simulation cannot be carried out with the
 * given inputs, e.g. an SRF table lacks a column the sensor's bands need.
 *
 * @author bandsim team
 */
public class BandSimException extends RuntimeException {

    public BandSimException(String message) {
        super(message);
    }

    public BandSimException(String message, Throwable cause) {
        super(message, cause);
    }
}
