package com.streamanalytics.core.storage;

import java.util.Locale;

/**
 * Kind of a persisted record. Each kind is stored in its own partition set.
 *
 * @since 1.0.0
 */
public enum RecordKind {
    AGGREGATE,
    ANOMALY,
    OBSERVATION;

    /**
     * @return lower-case name used as partition table prefix
     */
    public String tablePrefix() {
        return name().toLowerCase(Locale.ROOT);
    }
}
