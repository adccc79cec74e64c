package org.esa.bandsim;

/**
 * Closed wavelength interval [min, max] in nm.
 *
 * @author bandsim team
 */
public class WavelengthWindow {

    public static final WavelengthWindow VIS_NIR =
            new WavelengthWindow(BandSimConstants.MIN_WAVELENGTH, BandSimConstants.MAX_WAVELENGTH);

    private final double min;
    private final double max;

    public WavelengthWindow(double min, double max) {
        if (min > max) {
            throw new IllegalArgumentException("Invalid wavelength window: [" + min + ", " + max + "]");
        }
        this.min = min;
        this.max = max;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public boolean contains(double wavelength) {
        return wavelength >= min && wavelength <= max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
