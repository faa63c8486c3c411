package com.streamanalytics.core.storage;

import com.streamanalytics.core.model.AggregateResult;
import com.streamanalytics.core.model.AggregationLevel;
import com.streamanalytics.core.model.AnomalyResult;
import com.streamanalytics.core.model.EventPayload;
import com.streamanalytics.core.model.MetricKey;
import com.streamanalytics.core.model.Observation;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A persisted unit: one aggregate, one anomaly or one raw observation, with
 * the key derived from its payload.
 *
 * <ul>
 * <li>Window aggregates are keyed by window start, so a later revision of a
 * window replaces the earlier one. Batch aggregates also carry the batch id.</li>
 * <li>Anomalies are keyed by the timestamp of the flagged point and the
 * window that produced them, so overlapping windows keep separate
 * results.</li>
 * <li>Observations are keyed by their event time. Writers that store several
 * observations of one series per millisecond pass a distinct qualifier
 * through {@link #of(EventPayload, String)}.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class StorageRecord {

    private final RecordKey key;
    private final Map<String, String> tags;
    private final EventPayload payload;

    private StorageRecord(RecordKey key, Map<String, String> tags, EventPayload payload) {
        this.key = key;
        this.tags = Map.copyOf(tags);
        this.payload = payload;
    }

    /**
     * Wrap a payload, deriving kind and key from its type.
     *
     * @throws IllegalArgumentException if the payload type is not persistable
     */
    public static StorageRecord of(EventPayload payload) {
        return of(payload, defaultQualifier(payload));
    }

    /**
     * Wrap a payload under an explicit key qualifier. Records of one series
     * and timestamp with different qualifiers are stored side by side.
     *
     * @throws IllegalArgumentException if the payload type is not persistable
     */
    public static StorageRecord of(EventPayload payload, String qualifier) {
        Objects.requireNonNull(payload, "payload must not be null");
        if (payload instanceof AggregateResult aggregate) {
            return new StorageRecord(new RecordKey(RecordKind.AGGREGATE, aggregate.getMetricName(),
                    MetricKey.toTagString(aggregate.getTags()), qualifier,
                    aggregate.getWindowStart()), aggregate.getTags(), aggregate);
        }
        if (payload instanceof AnomalyResult anomaly) {
            return new StorageRecord(new RecordKey(RecordKind.ANOMALY, anomaly.getMetricName(),
                    MetricKey.toTagString(anomaly.getTags()), qualifier, anomaly.getTimestamp()),
                    anomaly.getTags(), anomaly);
        }
        if (payload instanceof Observation observation) {
            return new StorageRecord(new RecordKey(RecordKind.OBSERVATION, observation.getName(),
                    MetricKey.toTagString(observation.getTags()), qualifier, observation.getTimestamp()),
                    observation.getTags(), observation);
        }
        throw new IllegalArgumentException("Unsupported payload type: " + payload.getClass().getName());
    }

    private static String defaultQualifier(EventPayload payload) {
        if (payload instanceof AggregateResult aggregate) {
            return qualifierOf(aggregate);
        }
        if (payload instanceof AnomalyResult anomaly) {
            return anomaly.getWindowId() != null ? anomaly.getWindowId() : "";
        }
        return "";
    }

    private static String qualifierOf(AggregateResult aggregate) {
        if (aggregate.getLevel() == AggregationLevel.BATCH && aggregate.getWindowId() != null) {
            return AggregationLevel.BATCH.name() + "/" + aggregate.getWindowId();
        }
        return aggregate.getLevel().name();
    }

    public <T extends EventPayload> Optional<T> payloadAs(Class<T> type) {
        return type.isInstance(payload) ? Optional.of(type.cast(payload)) : Optional.empty();
    }

    public RecordKey getKey() {
        return key;
    }

    public RecordKind getKind() {
        return key.getKind();
    }

    public String getMetricName() {
        return key.getMetricName();
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public Instant getTimestamp() {
        return key.getTimestamp();
    }

    public EventPayload getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StorageRecord that))
            return false;
        return key.equals(that.key) && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, payload);
    }

    @Override
    public String toString() {
        return "StorageRecord{" + key + '}';
    }
}
