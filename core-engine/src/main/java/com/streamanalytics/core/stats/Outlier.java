package com.streamanalytics.core.stats;

/**
 * An outlying sample: its position, value, and how far out it lies in the
 * unit of the method that found it.
 *
 * @since 1.0.0
 */
public final class Outlier {

    private final int index;
    private final double value;
    private final double deviation;

    public Outlier(int index, double value, double deviation) {
        this.index = index;
        this.value = value;
        this.deviation = deviation;
    }

    public int getIndex() {
        return index;
    }

    public double getValue() {
        return value;
    }

    public double getDeviation() {
        return deviation;
    }

    @Override
    public String toString() {
        return "Outlier{index=" + index + ", value=" + value + ", deviation=" + deviation + '}';
    }
}
