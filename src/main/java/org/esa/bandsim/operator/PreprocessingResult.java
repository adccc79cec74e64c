package org.esa.bandsim.operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Container holding the cleaned (and possibly padded) reflectance table together with
 * what the preprocessing did to it.
 *
 * @author bandsim team
 */
public class PreprocessingResult {

    private final ReflectanceTable table;
    private final int realStationCount;
    private final int clippedValueCount;
    private final int filledValueCount;
    private final List<String> warnings;

    PreprocessingResult(ReflectanceTable table, int realStationCount,
                        int clippedValueCount, int filledValueCount, List<String> warnings) {
        this.table = table;
        this.realStationCount = realStationCount;
        this.clippedValueCount = clippedValueCount;
        this.filledValueCount = filledValueCount;
        this.warnings = Collections.unmodifiableList(new ArrayList<String>(warnings));
    }

    public ReflectanceTable getTable() {
        return table;
    }

    public List<String> getStationIds() {
        return table.getStationIds();
    }

    public int getRealStationCount() {
        return realStationCount;
    }

    public int getPaddedStationCount() {
        return table.getStationCount() - realStationCount;
    }

    public boolean isPadded() {
        return getPaddedStationCount() > 0;
    }

    /**
     * @return number of negative reflectances set to 0
     */
    public int getClippedValueCount() {
        return clippedValueCount;
    }

    /**
     * @return number of missing reflectances set to 0
     */
    public int getFilledValueCount() {
        return filledValueCount;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
