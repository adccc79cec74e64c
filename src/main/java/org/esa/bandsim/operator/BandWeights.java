package org.esa.bandsim.operator;

/**
 * Normalized SRF weights of one band over its filtered wavelength support.
 *
 * @author bandsim team
 */
class BandWeights {

    private final double[] wavelengths;
    private final double[] weights;

    BandWeights(double[] wavelengths, double[] weights) {
        this.wavelengths = wavelengths;
        this.weights = weights;
    }

    int size() {
        return wavelengths.length;
    }

    double getWavelength(int i) {
        return wavelengths[i];
    }

    double getWeight(int i) {
        return weights[i];
    }

    double[] getWeights() {
        return weights.clone();
    }
}
