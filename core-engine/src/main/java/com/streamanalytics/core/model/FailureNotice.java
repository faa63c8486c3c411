package com.streamanalytics.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Payload of a {@link EventType#PROCESSING_FAILED} event: which component
 * failed, and why.
 *
 * @since 1.0.0
 */
public final class FailureNotice implements EventPayload {

    private final String component;
    private final String message;
    private final Instant occurredAt;

    public FailureNotice(String component, String message, Instant occurredAt) {
        this.component = Objects.requireNonNull(component, "component must not be null");
        this.message = message != null ? message : "";
        this.occurredAt = Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    }

    public String getComponent() {
        return component;
    }

    public String getMessage() {
        return message;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    @Override
    public String toString() {
        return "FailureNotice{component='" + component + "', message='" + message + "'}";
    }
}
