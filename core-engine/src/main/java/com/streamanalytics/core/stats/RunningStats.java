package com.streamanalytics.core.stats;

/**
 * Constant-space accumulator for count, sum, min, max, mean and variance
 * using Welford's online update.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe; callers synchronise externally.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunningStats {

    private long count;
    private double mean;
    private double m2;
    private double sum;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    public void add(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
        sum += value;
        min = Math.min(min, value);
        max = Math.max(max, value);
    }

    /**
     * Fold another accumulator into this one (Chan et al. parallel update).
     *
     * @param other accumulator to merge; left unchanged
     */
    public void merge(RunningStats other) {
        if (other.count == 0) {
            return;
        }
        if (count == 0) {
            copyFrom(other);
            return;
        }
        long total = count + other.count;
        double delta = other.mean - mean;
        mean += delta * other.count / total;
        m2 += other.m2 + delta * delta * ((double) count * other.count / total);
        count = total;
        sum += other.sum;
        min = Math.min(min, other.min);
        max = Math.max(max, other.max);
    }

    public RunningStats copy() {
        RunningStats copy = new RunningStats();
        copy.copyFrom(this);
        return copy;
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        return count > 0 ? mean : 0.0;
    }

    /**
     * @return population variance, {@code 0} for fewer than two samples
     */
    public double getVariance() {
        return count > 1 ? m2 / count : 0.0;
    }

    public double getStddev() {
        return Math.sqrt(getVariance());
    }

    public double getSum() {
        return sum;
    }

    public double getMin() {
        return count > 0 ? min : 0.0;
    }

    public double getMax() {
        return count > 0 ? max : 0.0;
    }

    private void copyFrom(RunningStats other) {
        this.count = other.count;
        this.mean = other.mean;
        this.m2 = other.m2;
        this.sum = other.sum;
        this.min = other.min;
        this.max = other.max;
    }

    @Override
    public String toString() {
        return "RunningStats{count=" + count + ", mean=" + getMean() + ", stddev=" + getStddev() + '}';
    }
}
