package com.streamanalytics.core.detection;

import com.streamanalytics.core.model.Observation;
import com.streamanalytics.core.model.Window;
import com.streamanalytics.core.stats.TimedValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Time-ordered series handed to the detection methods, together with the
 * identity of the series and window it came from.
 *
 * @since 1.0.0
 */
public final class DetectionInput {

    private final String metricName;
    private final Map<String, String> tags;
    private final String windowId;
    private final List<TimedValue> points;

    /**
     * @param points series points; re-ordered by timestamp, ties keep their
     *               given order
     */
    public DetectionInput(String metricName, Map<String, String> tags, String windowId, List<TimedValue> points) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.tags = tags == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(tags));
        this.windowId = windowId;
        List<TimedValue> ordered = new ArrayList<>(Objects.requireNonNull(points, "points must not be null"));
        ordered.sort(Comparator.comparing(TimedValue::getTimestamp));
        this.points = Collections.unmodifiableList(ordered);
    }

    public static DetectionInput fromWindow(Window window) {
        List<TimedValue> points = new ArrayList<>(window.size());
        for (Observation o : window.getElements()) {
            points.add(new TimedValue(o.getTimestamp(), o.getValue()));
        }
        return new DetectionInput(window.getKey().getName(), window.getKey().getTags(), window.getId(), points);
    }

    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public String getMetricName() {
        return metricName;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public String getWindowId() {
        return windowId;
    }

    public List<TimedValue> getPoints() {
        return points;
    }
}
