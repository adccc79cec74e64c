package org.esa.bandsim;

/**
 * Definition of a single simulated band: the SRF column holding its response curve,
 * the nominal center wavelength used to label the output, and an optional
 * wavelength window restricting the SRF samples used for normalization.
 *
 * @author bandsim team
 */
public class BandDefinition {

    private final int srfColumn;
    private final int centerWavelength;
    private final WavelengthWindow window;

    /**
     * @param srfColumn        - index of the response column in the SRF table (column 0 is the wavelength)
     * @param centerWavelength - nominal center wavelength [nm]
     * @param window           - the restriction window, or <code>null</code> to use the native SRF range
     */
    public BandDefinition(int srfColumn, int centerWavelength, WavelengthWindow window) {
        if (srfColumn < 1) {
            throw new IllegalArgumentException("SRF column must be >= 1, was " + srfColumn);
        }
        this.srfColumn = srfColumn;
        this.centerWavelength = centerWavelength;
        this.window = window;
    }

    public int getSrfColumn() {
        return srfColumn;
    }

    public int getCenterWavelength() {
        return centerWavelength;
    }

    public WavelengthWindow getWindow() {
        return window;
    }

    public boolean hasWindow() {
        return window != null;
    }

    @Override
    public String toString() {
        return "Band_" + centerWavelength + "nm (SRF column " + srfColumn + ", window " + window + ")";
    }
}
