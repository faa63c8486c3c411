package com.streamanalytics.core.detection;

import com.streamanalytics.core.config.DetectionConfig;
import com.streamanalytics.core.model.AnomalyEvidence;
import com.streamanalytics.core.model.AnomalyResult;
import com.streamanalytics.core.model.DetectionMethod;
import com.streamanalytics.core.model.Severity;
import com.streamanalytics.core.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs the requested detection methods over a series and merges their
 * findings into one {@link AnomalyResult} per flagged point.
 *
 * <h3>Methods</h3>
 * <p>
 * Requesting {@link DetectionMethod#COMBINED} runs every independent method
 * and adds a {@code COMBINED} evidence entry carrying the ensemble
 * confidence. Methods that are not applicable to the input (no configured
 * bounds, too few points) are skipped and do not count in the vote.
 * </p>
 *
 * <h3>Deduplication</h3>
 * <p>
 * Findings refer to the same point when they share an index, or when their
 * timestamps lie within the configured tolerance and their values are equal.
 * Such findings become a single result with one evidence entry per method.
 * </p>
 *
 * <p>
 * The detector holds no mutable state and is safe to share across threads.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    private final Map<DetectionMethod, DetectionMethodStrategy> strategies;
    private final VotingPolicy voting;
    private final Set<DetectionMethod> defaultMethods;
    private final long toleranceMillis;

    public AnomalyDetector(Map<DetectionMethod, DetectionMethodStrategy> strategies, VotingPolicy voting,
            Set<DetectionMethod> defaultMethods, Duration dedupTolerance) {
        Objects.requireNonNull(strategies, "strategies must not be null");
        this.strategies = Collections.unmodifiableMap(new EnumMap<>(strategies));
        this.voting = Objects.requireNonNull(voting, "VotingPolicy must not be null");
        this.defaultMethods = defaultMethods.isEmpty()
                ? EnumSet.of(DetectionMethod.COMBINED)
                : EnumSet.copyOf(defaultMethods);
        this.toleranceMillis = Objects.requireNonNull(dedupTolerance, "dedupTolerance must not be null").toMillis();
    }

    public AnomalyDetector(DetectionConfig config) {
        this(DetectionMethodFactory.createAll(config), VotingPolicy.from(config), config.methodSet(),
                Duration.ofMillis(config.getDedupToleranceMillis()));
    }

    /**
     * Detect anomalies in a closed window with the configured methods.
     */
    public List<AnomalyResult> detectWindow(Window window) {
        return detect(DetectionInput.fromWindow(window), defaultMethods);
    }

    /**
     * @param input   time-ordered series
     * @param methods methods to run; {@code COMBINED} expands to all
     *                independent methods
     * @return one result per flagged point, highest confidence first; empty
     *         when no method flagged anything
     */
    public List<AnomalyResult> detect(DetectionInput input, Set<DetectionMethod> methods) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(methods, "methods must not be null");
        if (input.isEmpty() || methods.isEmpty()) {
            return List.of();
        }

        boolean combined = methods.contains(DetectionMethod.COMBINED);
        Set<DetectionMethod> requested = combined
                ? DetectionMethod.independentMethods()
                : EnumSet.copyOf(methods);

        Set<DetectionMethod> effective = EnumSet.noneOf(DetectionMethod.class);
        List<PointGroup> groups = new ArrayList<>();
        for (DetectionMethod method : requested) {
            DetectionMethodStrategy strategy = strategies.get(method);
            if (strategy == null || !strategy.isApplicable(input)) {
                LOG.trace("Method {} not applicable to {} ({} point(s))", method, input.getMetricName(),
                        input.size());
                continue;
            }
            effective.add(method);
            for (MethodFinding finding : strategy.apply(input)) {
                groupFor(groups, finding).add(finding);
            }
        }

        List<AnomalyResult> results = new ArrayList<>(groups.size());
        for (PointGroup group : groups) {
            results.add(toResult(input, group, effective, combined));
        }
        results.sort(Comparator.comparingDouble(AnomalyResult::getCombinedConfidence).reversed()
                .thenComparing(AnomalyResult::getTimestamp));

        if (!results.isEmpty()) {
            LOG.debug("Detected {} flagged point(s) in {} [{}] using {}", results.size(), input.getMetricName(),
                    input.getWindowId(), effective);
        }
        return results;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private AnomalyResult toResult(DetectionInput input, PointGroup group, Set<DetectionMethod> effective,
            boolean combined) {
        List<AnomalyEvidence> evidence = new ArrayList<>(group.evidence.values());
        VotingPolicy.Verdict verdict = voting.evaluate(evidence, effective);
        if (combined) {
            Severity severity = evidence.stream()
                    .map(AnomalyEvidence::getSeverity)
                    .max(Comparator.naturalOrder())
                    .orElse(Severity.LOW);
            evidence.add(new AnomalyEvidence(DetectionMethod.COMBINED, verdict.getConfidence(),
                    verdict.isAnomaly(), severity, verdict.getFlaggingMethods(),
                    verdict.getFlaggingMethods() + " of " + effective.size() + " method(s) flagged, "
                            + voting.getMode().name().toLowerCase(Locale.ROOT) + " vote"));
        }
        return AnomalyResult.builder()
                .metricName(input.getMetricName())
                .tags(input.getTags())
                .windowId(input.getWindowId())
                .timestamp(group.timestamp)
                .value(group.value)
                .evidence(evidence)
                .combinedConfidence(verdict.getConfidence())
                .anomaly(verdict.isAnomaly())
                .build();
    }

    private PointGroup groupFor(List<PointGroup> groups, MethodFinding finding) {
        for (PointGroup group : groups) {
            if (group.matches(finding, toleranceMillis)) {
                return group;
            }
        }
        PointGroup group = new PointGroup(finding.getIndex(), finding.getTimestamp(), finding.getValue());
        groups.add(group);
        return group;
    }

    private static final class PointGroup {
        final int index;
        final Instant timestamp;
        final double value;
        final Map<DetectionMethod, AnomalyEvidence> evidence = new EnumMap<>(DetectionMethod.class);

        PointGroup(int index, Instant timestamp, double value) {
            this.index = index;
            this.timestamp = timestamp;
            this.value = value;
        }

        boolean matches(MethodFinding finding, long toleranceMillis) {
            if (finding.getIndex() == index) {
                return true;
            }
            long gap = Math.abs(Duration.between(timestamp, finding.getTimestamp()).toMillis());
            return gap <= toleranceMillis && Double.compare(finding.getValue(), value) == 0;
        }

        void add(MethodFinding finding) {
            // a method reporting the same point twice keeps its strongest evidence
            evidence.merge(finding.getEvidence().getMethod(), finding.getEvidence(),
                    (a, b) -> a.getScore() >= b.getScore() ? a : b);
        }
    }
}
