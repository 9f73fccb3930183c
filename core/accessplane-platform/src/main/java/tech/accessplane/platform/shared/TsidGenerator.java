package tech.accessplane.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

/**
 * Centralized TSID generation for execution and audit identifiers.
 *
 * TSIDs are time-sortable, so audit records and execution ids order naturally
 * by creation time. Principal ids stay UUIDs to match records already in the
 * table.
 */
public final class TsidGenerator {

    private TsidGenerator() {
    }

    /**
     * Generate a raw TSID string (13 characters, Crockford base32).
     *
     * @return the TSID string
     */
    public static String generateRaw() {
        return TsidCreator.getTsid().toString();
    }
}
