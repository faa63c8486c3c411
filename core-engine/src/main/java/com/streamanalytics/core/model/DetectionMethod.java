package com.streamanalytics.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Anomaly detection methods.
 *
 * <p>
 * {@link #COMBINED} is a meta-method: it runs every independent method and
 * contributes an ensemble evidence entry of its own.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectionMethod {
    ZSCORE,
    IQR,
    CHANGE_POINT,
    THRESHOLD,
    COMBINED;

    /**
     * @return {@code true} for every method except {@link #COMBINED}
     */
    public boolean isIndependent() {
        return this != COMBINED;
    }

    /**
     * @return the methods that can flag a point on their own
     */
    public static Set<DetectionMethod> independentMethods() {
        return EnumSet.of(ZSCORE, IQR, CHANGE_POINT, THRESHOLD);
    }
}
