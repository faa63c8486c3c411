package com.streamanalytics.core.detection;

import com.streamanalytics.core.model.AnomalyEvidence;

import java.time.Instant;
import java.util.Objects;

/**
 * A single point flagged by one detection method.
 *
 * @since 1.0.0
 */
public final class MethodFinding {

    private final int index;
    private final Instant timestamp;
    private final double value;
    private final AnomalyEvidence evidence;

    public MethodFinding(int index, Instant timestamp, double value, AnomalyEvidence evidence) {
        this.index = index;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
        this.evidence = Objects.requireNonNull(evidence, "evidence must not be null");
    }

    public int getIndex() {
        return index;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public AnomalyEvidence getEvidence() {
        return evidence;
    }

    @Override
    public String toString() {
        return "MethodFinding{" + evidence.getMethod() + " index=" + index + ", value=" + value + '}';
    }
}
