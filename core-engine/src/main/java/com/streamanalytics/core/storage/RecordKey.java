package com.streamanalytics.core.storage;

import java.time.Instant;
import java.util.Objects;

/**
 * Identity of a stored record: {@code (kind, metric, tags, qualifier, timestamp)}.
 *
 * <p>
 * The qualifier separates records of the same series and time that must not
 * overwrite each other: the aggregation level (and batch id) for aggregates,
 * the producing window for anomalies, the batch position for audited
 * observations. Writing a
 * record whose key already exists replaces the earlier record.
 * </p>
 *
 * @since 1.0.0
 */
public final class RecordKey {

    private final RecordKind kind;
    private final String metricName;
    private final String tagString;
    private final String qualifier;
    private final Instant timestamp;

    public RecordKey(RecordKind kind, String metricName, String tagString, String qualifier,
            Instant timestamp) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.tagString = tagString != null ? tagString : "";
        this.qualifier = qualifier != null ? qualifier : "";
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    /**
     * @return single-string form, used as a primary key column
     */
    public String asString() {
        return kind.name() + '|' + metricName + '|' + tagString + '|' + qualifier + '|'
                + timestamp.toEpochMilli();
    }

    public RecordKind getKind() {
        return kind;
    }

    public String getMetricName() {
        return metricName;
    }

    public String getTagString() {
        return tagString;
    }

    public String getQualifier() {
        return qualifier;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RecordKey that))
            return false;
        return kind == that.kind
                && metricName.equals(that.metricName)
                && tagString.equals(that.tagString)
                && qualifier.equals(that.qualifier)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, metricName, tagString, qualifier, timestamp);
    }

    @Override
    public String toString() {
        return asString();
    }
}
