package org.esa.bandsim.io;

import java.util.Comparator;

/**
 * Orders (wavelength, column index) pairs by wavelength.
 *
 * @author bandsim team
 */
class WavelengthColumnComparator implements Comparator<int[]> {

    @Override
    public int compare(int[] o1, int[] o2) {
        return Integer.compare(o1[0], o2[0]);
    }
}
