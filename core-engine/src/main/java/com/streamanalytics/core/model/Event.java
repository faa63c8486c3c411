package com.streamanalytics.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Envelope published on the event bus.
 *
 * <p>
 * The {@code id} is the deduplication key: the bus dispatches each id at most
 * once within its deduplication horizon. Use {@link #of(EventType, String, EventPayload)}
 * to mint a fresh id, or the full constructor to re-publish with a known id.
 * </p>
 *
 * @since 1.0.0
 */
public final class Event {

    private final UUID id;
    private final EventType type;
    private final String source;
    private final EventPayload payload;
    private final Instant timestamp;

    public Event(UUID id, EventType type, String source, EventPayload payload, Instant timestamp) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.source = source != null ? source : "unknown";
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static Event of(EventType type, String source, EventPayload payload) {
        return new Event(UUID.randomUUID(), type, source, payload, Instant.now());
    }

    /**
     * Return the payload cast to the requested type.
     *
     * @param payloadType expected payload class
     * @return the payload, or empty if it is of a different type
     */
    public <T extends EventPayload> Optional<T> payloadAs(Class<T> payloadType) {
        return payloadType.isInstance(payload)
                ? Optional.of(payloadType.cast(payload))
                : Optional.empty();
    }

    public UUID getId() {
        return id;
    }

    public EventType getType() {
        return type;
    }

    public String getSource() {
        return source;
    }

    public EventPayload getPayload() {
        return payload;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Event that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Event{id=" + id + ", type=" + type + ", source='" + source + "'}";
    }
}
