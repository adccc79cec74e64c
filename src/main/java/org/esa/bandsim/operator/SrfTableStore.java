package org.esa.bandsim.operator;

import org.esa.bandsim.SrfKey;
import org.esa.bandsim.config.BandSimConfigException;
import org.esa.bandsim.io.SrfAccess;

import java.io.File;
import java.util.EnumMap;
import java.util.Map;

/**
 * Holds the SRF tables of all satellites. All tables must be available when the store
 * is created; they are never reloaded or changed afterwards.
 *
 * @author bandsim team
 */
public class SrfTableStore {

    private final Map<SrfKey, SrfTable> srfTables;

    /**
     * @param srfTables - one table for every {@link SrfKey}
     * @throws BandSimConfigException if a table is missing
     */
    public SrfTableStore(Map<SrfKey, SrfTable> srfTables) throws BandSimConfigException {
        for (SrfKey key : SrfKey.values()) {
            if (srfTables.get(key) == null) {
                throw new BandSimConfigException("SRF table not available: " + key.getLabel());
            }
        }
        this.srfTables = new EnumMap<SrfKey, SrfTable>(srfTables);
    }

    public static SrfTableStore load(File srfDir) throws BandSimConfigException {
        return new SrfTableStore(SrfAccess.readSrfTables(srfDir));
    }

    public SrfTable getSrfTable(SrfKey key) {
        return srfTables.get(key);
    }
}
