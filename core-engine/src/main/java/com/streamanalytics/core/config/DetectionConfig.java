package com.streamanalytics.core.config;

import com.streamanalytics.core.model.DetectionMethod;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Anomaly detection settings.
 *
 * <pre>
 * detection:
 *   methods: [COMBINED]
 *   zscoreThreshold: 2.0
 *   iqrMultiplier: 1.5
 *   changePointSigmas: 2.0
 *   thresholdMax: 1000.0
 *   votingMode: MAJORITY
 *   weights:
 *     ZSCORE: 1.0
 *     IQR: 1.0
 * </pre>
 *
 * <p>
 * The threshold method only runs when at least one of {@code thresholdMin}
 * and {@code thresholdMax} is set. Method weights default to {@code 1.0}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionConfig {

    private List<DetectionMethod> methods = new ArrayList<>(List.of(DetectionMethod.COMBINED));
    private double zscoreThreshold = 2.0;
    private double iqrMultiplier = 1.5;
    private double changePointSigmas = 2.0;
    private Double thresholdMin;
    private Double thresholdMax;
    private VotingMode votingMode = VotingMode.MAJORITY;
    private double weightedThreshold = 0.5;
    private Map<String, Double> weights = new LinkedHashMap<>();
    private long dedupToleranceMillis = 0;

    /**
     * @return configured methods as a set, in declaration order of the enum
     */
    public Set<DetectionMethod> methodSet() {
        return methods.isEmpty()
                ? EnumSet.noneOf(DetectionMethod.class)
                : EnumSet.copyOf(methods);
    }

    /**
     * @return weight per method; unspecified methods weigh {@code 1.0}
     */
    public Map<DetectionMethod, Double> methodWeights() {
        Map<DetectionMethod, Double> resolved = new EnumMap<>(DetectionMethod.class);
        for (DetectionMethod method : DetectionMethod.values()) {
            resolved.put(method, 1.0);
        }
        weights.forEach((name, weight) -> resolved.put(
                DetectionMethod.valueOf(name.toUpperCase(Locale.ROOT)), weight));
        return resolved;
    }

    void collectErrors(List<String> errors) {
        if (methods == null || methods.isEmpty()) {
            errors.add("detection.methods must name at least one method");
        }
        if (zscoreThreshold <= 0) {
            errors.add("detection.zscoreThreshold must be > 0, got: " + zscoreThreshold);
        }
        if (iqrMultiplier <= 0) {
            errors.add("detection.iqrMultiplier must be > 0, got: " + iqrMultiplier);
        }
        if (changePointSigmas <= 0) {
            errors.add("detection.changePointSigmas must be > 0, got: " + changePointSigmas);
        }
        if (thresholdMin != null && thresholdMax != null && thresholdMin >= thresholdMax) {
            errors.add("detection.thresholdMin (" + thresholdMin
                    + ") must be < thresholdMax (" + thresholdMax + ")");
        }
        if (votingMode == null) {
            errors.add("detection.votingMode is required");
        }
        if (weightedThreshold < 0 || weightedThreshold > 1) {
            errors.add("detection.weightedThreshold must be in [0, 1], got: " + weightedThreshold);
        }
        if (dedupToleranceMillis < 0) {
            errors.add("detection.dedupToleranceMillis must be >= 0, got: " + dedupToleranceMillis);
        }
        weights.forEach((name, weight) -> {
            try {
                DetectionMethod.valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                errors.add("detection.weights has unknown method '" + name + "'");
            }
            if (weight == null || weight <= 0) {
                errors.add("detection.weights." + name + " must be > 0, got: " + weight);
            }
        });
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public List<DetectionMethod> getMethods() {
        return Collections.unmodifiableList(methods);
    }

    public void setMethods(List<DetectionMethod> methods) {
        this.methods = methods != null ? new ArrayList<>(methods) : new ArrayList<>();
    }

    public double getZscoreThreshold() {
        return zscoreThreshold;
    }

    public void setZscoreThreshold(double zscoreThreshold) {
        this.zscoreThreshold = zscoreThreshold;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public void setIqrMultiplier(double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
    }

    public double getChangePointSigmas() {
        return changePointSigmas;
    }

    public void setChangePointSigmas(double changePointSigmas) {
        this.changePointSigmas = changePointSigmas;
    }

    public Double getThresholdMin() {
        return thresholdMin;
    }

    public void setThresholdMin(Double thresholdMin) {
        this.thresholdMin = thresholdMin;
    }

    public Double getThresholdMax() {
        return thresholdMax;
    }

    public void setThresholdMax(Double thresholdMax) {
        this.thresholdMax = thresholdMax;
    }

    public VotingMode getVotingMode() {
        return votingMode;
    }

    public void setVotingMode(VotingMode votingMode) {
        this.votingMode = votingMode;
    }

    public double getWeightedThreshold() {
        return weightedThreshold;
    }

    public void setWeightedThreshold(double weightedThreshold) {
        this.weightedThreshold = weightedThreshold;
    }

    public Map<String, Double> getWeights() {
        return Collections.unmodifiableMap(weights);
    }

    public void setWeights(Map<String, Double> weights) {
        this.weights = weights != null ? new LinkedHashMap<>(weights) : new LinkedHashMap<>();
    }

    public long getDedupToleranceMillis() {
        return dedupToleranceMillis;
    }

    public void setDedupToleranceMillis(long dedupToleranceMillis) {
        this.dedupToleranceMillis = dedupToleranceMillis;
    }

    @Override
    public String toString() {
        return "DetectionConfig{methods=" + methods
                + ", zscoreThreshold=" + zscoreThreshold
                + ", iqrMultiplier=" + iqrMultiplier
                + ", changePointSigmas=" + changePointSigmas
                + ", thresholdMin=" + thresholdMin
                + ", thresholdMax=" + thresholdMax
                + ", votingMode=" + votingMode + '}';
    }
}
