package org.esa.bandsim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static band definitions of all supported sensors.
 * <p/>
 * For each sensor the SRF columns 1..n are the real bands (in source order), the center
 * wavelengths label them, and the restriction flag tells whether SRF samples outside
 * 400-900nm are discarded before normalization.
 *
 * @author bandsim team
 */
public class SensorBandCatalog {

    private static final Object[][] CATALOG = {
            // sensor, restricted to 400-900nm, center wavelengths of SRF columns 1..n
            {Sensor.MSI, true, new int[]{440, 490, 560, 665, 705, 740, 783, 842, 865}},
            {Sensor.OLI, false, new int[]{440, 490, 560, 665, 865}},
            {Sensor.ETM, false, new int[]{490, 560, 665, 865}},
            {Sensor.TM, false, new int[]{490, 560, 665, 865}},
            {Sensor.OLCI, true, new int[]{
                    400, 412, 442, 490, 510, 560, 620, 665, 673, 681,
                    708, 753, 761, 764, 767, 778, 865, 885, 900}},
            {Sensor.SUPERDOVE, true, new int[]{443, 490, 531, 565, 610, 665, 705, 865}},
            {Sensor.MODIS, true, new int[]{
                    412, 443, 469, 488, 531, 551, 555, 645, 667, 678,
                    748, 859, 869, 1240, 1640, 2130}},
    };

    private static final Map<Sensor, List<BandDefinition>> BAND_DEFINITIONS = createBandDefinitions();

    private SensorBandCatalog() {
    }

    public static List<BandDefinition> getBandDefinitions(Sensor sensor) {
        final List<BandDefinition> bandDefinitions = BAND_DEFINITIONS.get(sensor);
        if (bandDefinitions == null) {
            throw new IllegalArgumentException("No band definitions for sensor: " + sensor);
        }
        return bandDefinitions;
    }

    public static int[] getCenterWavelengths(Sensor sensor) {
        final List<BandDefinition> bandDefinitions = getBandDefinitions(sensor);
        int[] centers = new int[bandDefinitions.size()];
        for (int i = 0; i < centers.length; i++) {
            centers[i] = bandDefinitions.get(i).getCenterWavelength();
        }
        return centers;
    }

    public static int getBandCount(Sensor sensor) {
        return getBandDefinitions(sensor).size();
    }

    /**
     * @return the number of SRF columns (wavelength column included) a table for this sensor needs at least
     */
    public static int getRequiredSrfColumnCount(Sensor sensor) {
        int maxColumn = 0;
        for (BandDefinition bandDefinition : getBandDefinitions(sensor)) {
            maxColumn = Math.max(maxColumn, bandDefinition.getSrfColumn());
        }
        return maxColumn + 1;
    }

    private static Map<Sensor, List<BandDefinition>> createBandDefinitions() {
        Map<Sensor, List<BandDefinition>> map = new EnumMap<Sensor, List<BandDefinition>>(Sensor.class);
        for (Object[] entry : CATALOG) {
            final Sensor sensor = (Sensor) entry[0];
            final boolean restricted = (Boolean) entry[1];
            final int[] centers = (int[]) entry[2];
            final WavelengthWindow window = restricted ? WavelengthWindow.VIS_NIR : null;
            List<BandDefinition> bandDefinitions = new ArrayList<BandDefinition>(centers.length);
            for (int i = 0; i < centers.length; i++) {
                bandDefinitions.add(new BandDefinition(i + 1, centers[i], window));
            }
            map.put(sensor, Collections.unmodifiableList(bandDefinitions));
        }
        return map;
    }
}
