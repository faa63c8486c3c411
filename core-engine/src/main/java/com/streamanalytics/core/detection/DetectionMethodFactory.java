package com.streamanalytics.core.detection;

import com.streamanalytics.core.config.DetectionConfig;
import com.streamanalytics.core.model.DetectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Factory that creates {@link DetectionMethodStrategy} instances from
 * {@link DetectionConfig}.
 *
 * <p>
 * This is the single point of extension when adding new detection methods:
 * add the enum constant to {@link DetectionMethod} and create the
 * corresponding strategy here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionMethodFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionMethodFactory.class);

    private DetectionMethodFactory() {
        // utility class — not instantiable
    }

    /**
     * Create the strategy for one independent method.
     *
     * @throws NullPointerException     if an argument is {@code null}
     * @throws IllegalArgumentException for {@link DetectionMethod#COMBINED},
     *                                  which is a vote over the others
     */
    public static DetectionMethodStrategy create(DetectionMethod method, DetectionConfig config) {
        Objects.requireNonNull(method, "DetectionMethod must not be null");
        Objects.requireNonNull(config, "DetectionConfig must not be null");

        return switch (method) {
            case ZSCORE -> new ZScoreMethod(config.getZscoreThreshold());
            case IQR -> new IqrMethod(config.getIqrMultiplier());
            case CHANGE_POINT -> new ChangePointMethod(config.getChangePointSigmas());
            case THRESHOLD -> new ThresholdMethod(config.getThresholdMin(), config.getThresholdMax());
            case COMBINED -> throw new IllegalArgumentException(
                    "COMBINED is not an independent method. Supported: " + DetectionMethod.independentMethods());
        };
    }

    /**
     * Create a strategy for every independent method.
     *
     * @return unmodifiable map keyed by method
     */
    public static Map<DetectionMethod, DetectionMethodStrategy> createAll(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        Map<DetectionMethod, DetectionMethodStrategy> strategies = new EnumMap<>(DetectionMethod.class);
        for (DetectionMethod method : DetectionMethod.independentMethods()) {
            strategies.put(method, create(method, config));
        }
        LOG.info("Created {} detection method(s): {}", strategies.size(), strategies.keySet());
        return Collections.unmodifiableMap(strategies);
    }
}
