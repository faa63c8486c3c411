package com.streamanalytics.core.collector;

import com.streamanalytics.core.model.AggregateResult;
import com.streamanalytics.core.model.AggregationLevel;
import com.streamanalytics.core.model.MetricKey;
import com.streamanalytics.core.model.Observation;
import com.streamanalytics.core.model.Window;
import com.streamanalytics.core.stats.RunningStats;
import com.streamanalytics.core.stats.StatisticalAnalyzer;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Turns a group of observations of one series into an {@link AggregateResult}.
 *
 * <p>
 * Percentiles are exact over the group, which is bounded by the window or
 * the collector batch.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregateCalculator {

    private AggregateCalculator() {
        // utility class — not instantiable
    }

    /**
     * Aggregate a sealed window at {@link AggregationLevel#WINDOW} level.
     *
     * @throws IllegalArgumentException if the window is empty
     */
    public static AggregateResult fromWindow(Window window) {
        Objects.requireNonNull(window, "window must not be null");
        return aggregate(window.getKey(), window.getElements(), AggregationLevel.WINDOW,
                window.getId(), window.getStart(), window.getEnd());
    }

    /**
     * Aggregate one flush batch of a series at {@link AggregationLevel#BATCH}
     * level. The window bounds are the earliest and latest observation times.
     *
     * @throws IllegalArgumentException if {@code observations} is empty
     */
    public static AggregateResult fromBatch(MetricKey key, List<Observation> observations, String batchId) {
        requireNonEmpty(observations);
        Instant first = observations.get(0).getTimestamp();
        Instant last = first;
        for (Observation o : observations) {
            if (o.getTimestamp().isBefore(first)) {
                first = o.getTimestamp();
            }
            if (o.getTimestamp().isAfter(last)) {
                last = o.getTimestamp();
            }
        }
        return aggregate(key, observations, AggregationLevel.BATCH, batchId, first, last);
    }

    static AggregateResult aggregate(MetricKey key, List<Observation> observations, AggregationLevel level,
            String windowId, Instant start, Instant end) {
        requireNonEmpty(observations);
        RunningStats running = new RunningStats();
        double[] sorted = new double[observations.size()];
        for (int i = 0; i < sorted.length; i++) {
            double v = observations.get(i).getValue();
            running.add(v);
            sorted[i] = v;
        }
        Arrays.sort(sorted);

        return AggregateResult.builder()
                .metricName(key.getName())
                .tags(key.getTags())
                .level(level)
                .windowId(windowId)
                .windowStart(start)
                .windowEnd(end)
                .count(running.getCount())
                .min(sorted[0])
                .max(sorted[sorted.length - 1])
                .mean(running.getMean())
                .median(StatisticalAnalyzer.percentileOfSorted(sorted, 0.5))
                .stddev(running.getStddev())
                .p95(StatisticalAnalyzer.percentileOfSorted(sorted, 0.95))
                .p99(StatisticalAnalyzer.percentileOfSorted(sorted, 0.99))
                .sum(running.getSum())
                .build();
    }

    private static void requireNonEmpty(List<Observation> observations) {
        Objects.requireNonNull(observations, "observations must not be null");
        if (observations.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty group");
        }
    }
}
