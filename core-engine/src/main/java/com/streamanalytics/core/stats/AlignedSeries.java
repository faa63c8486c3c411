package com.streamanalytics.core.stats;

/**
 * Two value sequences paired element by element after timestamp alignment.
 *
 * @since 1.0.0
 */
public final class AlignedSeries {

    private final double[] first;
    private final double[] second;

    AlignedSeries(double[] first, double[] second) {
        this.first = first;
        this.second = second;
    }

    public double[] getFirst() {
        return first.clone();
    }

    public double[] getSecond() {
        return second.clone();
    }

    public int size() {
        return first.length;
    }
}
