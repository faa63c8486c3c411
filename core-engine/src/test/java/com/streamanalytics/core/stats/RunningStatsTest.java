package com.streamanalytics.core.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RunningStats}.
 */
class RunningStatsTest {

    private static final double[] SAMPLE = { 2, 4, 4, 4, 5, 5, 7, 9 };

    @Test
    @DisplayName("Should track count, mean and population variance incrementally")
    void shouldTrackMoments() {
        RunningStats stats = of(SAMPLE);

        assertThat(stats.getCount()).isEqualTo(8);
        assertThat(stats.getMean()).isCloseTo(5.0, within(1e-12));
        assertThat(stats.getVariance()).isCloseTo(4.0, within(1e-12));
        assertThat(stats.getStddev()).isCloseTo(2.0, within(1e-12));
        assertThat(stats.getSum()).isEqualTo(40.0);
        assertThat(stats.getMin()).isEqualTo(2.0);
        assertThat(stats.getMax()).isEqualTo(9.0);
    }

    @Test
    @DisplayName("Should report zero variance for fewer than two values")
    void shouldReportZeroVarianceForSingleValue() {
        assertThat(of(new double[] { 42 }).getVariance()).isZero();
    }

    @Test
    @DisplayName("Should merge partial results into the same moments as one pass")
    void shouldMergePartials() {
        RunningStats left = of(new double[] { 2, 4, 4 });
        RunningStats right = of(new double[] { 4, 5, 5, 7, 9 });

        left.merge(right);

        RunningStats whole = of(SAMPLE);
        assertThat(left.getCount()).isEqualTo(whole.getCount());
        assertThat(left.getMean()).isCloseTo(whole.getMean(), within(1e-12));
        assertThat(left.getVariance()).isCloseTo(whole.getVariance(), within(1e-12));
        assertThat(left.getMin()).isEqualTo(2.0);
        assertThat(left.getMax()).isEqualTo(9.0);
    }

    @Test
    @DisplayName("Should give an independent copy")
    void shouldCopyIndependently() {
        RunningStats original = of(new double[] { 1, 2 });
        RunningStats copy = original.copy();
        original.add(100);

        assertThat(copy.getCount()).isEqualTo(2);
        assertThat(copy.getMax()).isEqualTo(2.0);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static RunningStats of(double[] values) {
        RunningStats stats = new RunningStats();
        for (double v : values) {
            stats.add(v);
        }
        return stats;
    }
}
