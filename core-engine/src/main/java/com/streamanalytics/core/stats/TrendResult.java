package com.streamanalytics.core.stats;

import java.util.Locale;

/**
 * Least-squares line of value over sample index.
 *
 * <p>
 * {@code strength} is the share of the sample range the fitted line travels
 * across the sample, capped at {@code 1}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendResult {

    private final double slope;
    private final double intercept;
    private final double rSquared;
    private final double strength;
    private final TrendDirection direction;

    TrendResult(double slope, double intercept, double rSquared, double strength,
            TrendDirection direction) {
        this.slope = slope;
        this.intercept = intercept;
        this.rSquared = rSquared;
        this.strength = strength;
        this.direction = direction;
    }

    public double getSlope() {
        return slope;
    }

    public double getIntercept() {
        return intercept;
    }

    public double getRSquared() {
        return rSquared;
    }

    public double getStrength() {
        return strength;
    }

    public TrendDirection getDirection() {
        return direction;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "TrendResult{%s, slope=%.4f, r2=%.4f}", direction, slope, rSquared);
    }
}
