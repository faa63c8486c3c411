package com.streamanalytics.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Identity of a metric series: the metric name plus its tag set.
 *
 * <p>
 * Tags are held sorted by key so that two observations carrying the same tags
 * in a different insertion order map to the same series. The canonical
 * {@link #tagString()} form is {@code k1=v1,k2=v2}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricKey implements Comparable<MetricKey> {

    private final String name;
    private final SortedMap<String, String> tags;
    private final String tagString;

    private MetricKey(String name, Map<String, String> tags) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.tags = Collections.unmodifiableSortedMap(
                new TreeMap<>(tags != null ? tags : Map.of()));
        this.tagString = toTagString(this.tags);
    }

    public static MetricKey of(String name, Map<String, String> tags) {
        return new MetricKey(name, tags);
    }

    public static MetricKey of(String name) {
        return new MetricKey(name, Map.of());
    }

    /**
     * Render a tag map in canonical sorted {@code k=v} form.
     *
     * @param tags tag map, may be {@code null}
     * @return comma-separated pairs, or the empty string for no tags
     */
    public static String toTagString(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return "";
        }
        return new TreeMap<>(tags).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
    }

    public String getName() {
        return name;
    }

    public SortedMap<String, String> getTags() {
        return tags;
    }

    public String tagString() {
        return tagString;
    }

    @Override
    public int compareTo(MetricKey other) {
        int byName = name.compareTo(other.name);
        return byName != 0 ? byName : tagString.compareTo(other.tagString);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricKey that))
            return false;
        return name.equals(that.name) && tagString.equals(that.tagString);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, tagString);
    }

    @Override
    public String toString() {
        return tagString.isEmpty() ? name : name + "{" + tagString + "}";
    }
}
