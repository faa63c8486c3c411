package com.streamanalytics.core.stats;

import java.util.Locale;

/**
 * Pearson correlation coefficient with its two-sided p-value.
 *
 * @since 1.0.0
 */
public final class CorrelationResult {

    private final double coefficient;
    private final double pValue;
    private final int sampleSize;

    CorrelationResult(double coefficient, double pValue, int sampleSize) {
        this.coefficient = coefficient;
        this.pValue = pValue;
        this.sampleSize = sampleSize;
    }

    public double getCoefficient() {
        return coefficient;
    }

    public double getPValue() {
        return pValue;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    /**
     * @param alpha significance level, e.g. {@code 0.05}
     * @return {@code true} if the p-value is below {@code alpha}
     */
    public boolean isSignificant(double alpha) {
        return pValue < alpha;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "CorrelationResult{r=%.4f, p=%.4g, n=%d}",
                coefficient, pValue, sampleSize);
    }
}
