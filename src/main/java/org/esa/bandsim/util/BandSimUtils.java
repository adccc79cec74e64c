package org.esa.bandsim.util;

/**
 * Band simulation utility class
 *
 * @author bandsim team
 */
public class BandSimUtils {

    private BandSimUtils() {
    }

    public static int getNaNCountDouble1D(double[] src) {
        int count = 0;
        for (double d : src) {
            if (Double.isNaN(d)) {
                count++;
            }
        }
        return count;
    }

    public static boolean isAllNaNDouble1D(double[] src) {
        return getNaNCountDouble1D(src) == src.length;
    }

    /**
     * Gives, for each of the columns <code>realCount..targetCount-1</code>, the real column it duplicates:
     * column <code>realCount + k</code> is a copy of column <code>k mod realCount</code>.
     *
     * @param realCount   - number of real columns, must be > 0
     * @param targetCount - number of columns wanted
     * @return source indices of the padding columns, empty if realCount >= targetCount
     */
    public static int[] getCyclicPaddingIndices(int realCount, int targetCount) {
        if (realCount <= 0) {
            throw new IllegalArgumentException("Cannot pad from " + realCount + " columns");
        }
        final int paddingCount = Math.max(0, targetCount - realCount);
        int[] indices = new int[paddingCount];
        for (int k = 0; k < paddingCount; k++) {
            indices[k] = k % realCount;
        }
        return indices;
    }
}
