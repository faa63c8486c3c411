package com.streamanalytics.core.detection;

import com.streamanalytics.core.config.DetectionConfig;
import com.streamanalytics.core.config.VotingMode;
import com.streamanalytics.core.model.AnomalyEvidence;
import com.streamanalytics.core.model.DetectionMethod;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Combines per-method evidence for one point into a confidence and a verdict.
 *
 * <h3>Confidence</h3>
 * <p>
 * {@code Σ(w·score over flagging methods) / Σ(w over effective methods)},
 * where the effective methods are the requested independent methods that
 * were applicable to the input.
 * </p>
 *
 * <h3>Verdict</h3>
 * <ul>
 * <li>{@link VotingMode#MAJORITY}: at least {@code floor(n/2) + 1} of the
 * {@code n} effective methods flag the point.</li>
 * <li>{@link VotingMode#WEIGHTED}: the confidence reaches
 * {@code weightedThreshold}.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class VotingPolicy {

    private final VotingMode mode;
    private final double weightedThreshold;
    private final Map<DetectionMethod, Double> weights;

    public VotingPolicy(VotingMode mode, double weightedThreshold, Map<DetectionMethod, Double> weights) {
        this.mode = Objects.requireNonNull(mode, "VotingMode must not be null");
        if (weightedThreshold < 0.0 || weightedThreshold > 1.0) {
            throw new IllegalArgumentException("weightedThreshold must be in [0, 1], got: " + weightedThreshold);
        }
        this.weightedThreshold = weightedThreshold;
        this.weights = new EnumMap<>(DetectionMethod.class);
        if (weights != null) {
            this.weights.putAll(weights);
        }
    }

    public static VotingPolicy from(DetectionConfig config) {
        return new VotingPolicy(config.getVotingMode(), config.getWeightedThreshold(), config.methodWeights());
    }

    public static VotingPolicy majority() {
        return new VotingPolicy(VotingMode.MAJORITY, 0.5, Map.of());
    }

    /**
     * @param evidence  evidence gathered for a single point
     * @param effective independent methods that took part in the vote
     */
    public Verdict evaluate(Collection<AnomalyEvidence> evidence, Set<DetectionMethod> effective) {
        if (effective.isEmpty()) {
            return new Verdict(0.0, false, 0);
        }
        double total = 0.0;
        for (DetectionMethod method : effective) {
            total += weightOf(method);
        }
        double flaggedWeight = 0.0;
        int flagging = 0;
        for (AnomalyEvidence e : evidence) {
            if (e.isAnomaly() && effective.contains(e.getMethod())) {
                flaggedWeight += weightOf(e.getMethod()) * e.getScore();
                flagging++;
            }
        }
        double confidence = total > 0 ? Math.min(1.0, Math.max(0.0, flaggedWeight / total)) : 0.0;
        boolean anomaly = switch (mode) {
            case MAJORITY -> flagging >= effective.size() / 2 + 1;
            case WEIGHTED -> confidence >= weightedThreshold;
        };
        return new Verdict(confidence, anomaly, flagging);
    }

    public VotingMode getMode() {
        return mode;
    }

    private double weightOf(DetectionMethod method) {
        return weights.getOrDefault(method, 1.0);
    }

    /**
     * Outcome of a vote.
     */
    public static final class Verdict {

        private final double confidence;
        private final boolean anomaly;
        private final int flaggingMethods;

        Verdict(double confidence, boolean anomaly, int flaggingMethods) {
            this.confidence = confidence;
            this.anomaly = anomaly;
            this.flaggingMethods = flaggingMethods;
        }

        public double getConfidence() {
            return confidence;
        }

        public boolean isAnomaly() {
            return anomaly;
        }

        public int getFlaggingMethods() {
            return flaggingMethods;
        }

        @Override
        public String toString() {
            return "Verdict{confidence=" + confidence + ", anomaly=" + anomaly
                    + ", flaggingMethods=" + flaggingMethods + '}';
        }
    }
}
