package com.streamanalytics.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Sealed, immutable snapshot of a stream window handed to window listeners
 * and published with {@link EventType#WINDOW_CLOSED}.
 *
 * <p>
 * A window covers the half-open interval {@code [start, end)}. The
 * {@code revision} is {@code 0} for the first emission and increases each
 * time late data reopens the window within its grace period; a later
 * revision carries every element of the earlier ones.
 * </p>
 *
 * @since 1.0.0
 */
public final class Window implements EventPayload {

    private final String id;
    private final WindowType type;
    private final MetricKey key;
    private final Instant start;
    private final Instant end;
    private final int revision;
    private final List<Observation> elements;

    public Window(WindowType type, MetricKey key, Instant start, Instant end,
            int revision, List<Observation> elements) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        this.revision = revision;
        this.elements = Collections.unmodifiableList(List.copyOf(elements));
        this.id = idFor(type, key, start);
    }

    /**
     * Stable identifier of the window a given key and start belong to. The
     * same id is kept across revisions.
     */
    public static String idFor(WindowType type, MetricKey key, Instant start) {
        return key + "|" + type.name().toLowerCase() + "|" + start.toEpochMilli();
    }

    /**
     * @return element values in arrival order
     */
    public double[] values() {
        double[] values = new double[elements.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = elements.get(i).getValue();
        }
        return values;
    }

    public int size() {
        return elements.size();
    }

    public String getId() {
        return id;
    }

    public WindowType getType() {
        return type;
    }

    public MetricKey getKey() {
        return key;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public int getRevision() {
        return revision;
    }

    public List<Observation> getElements() {
        return elements;
    }

    @Override
    public String toString() {
        return "Window{id='" + id + "', end=" + end + ", revision=" + revision
                + ", size=" + elements.size() + '}';
    }
}
