package com.streamanalytics.core.stats;

/**
 * Full descriptive summary of a sample, produced by
 * {@link StatisticalAnalyzer#describe(double[])}.
 *
 * <p>
 * Variance, skewness and kurtosis are population moments; kurtosis is excess
 * kurtosis (normal = 0). For a constant sample skewness, kurtosis and the
 * coefficient of variation are reported as {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DescriptiveStats {

    private final int count;
    private final double sum;
    private final double min;
    private final double max;
    private final double mean;
    private final double median;
    private final double variance;
    private final double stddev;
    private final double skewness;
    private final double kurtosis;
    private final double coefficientOfVariation;
    private final double q1;
    private final double q3;
    private final double p95;
    private final double p99;

    DescriptiveStats(int count, double sum, double min, double max, double mean, double median,
            double variance, double skewness, double kurtosis, double q1, double q3,
            double p95, double p99) {
        this.count = count;
        this.sum = sum;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.median = median;
        this.variance = variance;
        this.stddev = Math.sqrt(variance);
        this.skewness = skewness;
        this.kurtosis = kurtosis;
        this.coefficientOfVariation = mean != 0.0 ? stddev / Math.abs(mean) : 0.0;
        this.q1 = q1;
        this.q3 = q3;
        this.p95 = p95;
        this.p99 = p99;
    }

    public int getCount() {
        return count;
    }

    public double getSum() {
        return sum;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getVariance() {
        return variance;
    }

    public double getStddev() {
        return stddev;
    }

    public double getSkewness() {
        return skewness;
    }

    public double getKurtosis() {
        return kurtosis;
    }

    public double getCoefficientOfVariation() {
        return coefficientOfVariation;
    }

    public double getQ1() {
        return q1;
    }

    public double getQ3() {
        return q3;
    }

    public double getIqr() {
        return q3 - q1;
    }

    public double getP95() {
        return p95;
    }

    public double getP99() {
        return p99;
    }

    @Override
    public String toString() {
        return "DescriptiveStats{count=" + count
                + ", mean=" + mean
                + ", median=" + median
                + ", stddev=" + stddev
                + ", min=" + min
                + ", max=" + max
                + '}';
    }
}
