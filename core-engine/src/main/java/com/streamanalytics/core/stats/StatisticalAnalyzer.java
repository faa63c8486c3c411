package com.streamanalytics.core.stats;

import com.streamanalytics.core.error.InsufficientDataException;
import com.streamanalytics.core.error.ValidationException;
import org.apache.commons.math3.distribution.TDistribution;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Pure statistical routines over {@code double[]} samples.
 *
 * <h3>Conventions</h3>
 * <ul>
 * <li>Variance is the population variance, accumulated with Welford's
 * update.</li>
 * <li>Percentiles interpolate linearly between order statistics at rank
 * {@code (n - 1) p}, so a percentile always lies within {@code [min, max]}.</li>
 * <li>Quartiles used for IQR outliers interpolate at rank {@code (n + 1) p},
 * clamped to the sample.</li>
 * <li>Empty input, and input too short for the requested statistic, raises
 * {@link InsufficientDataException}. Nothing here returns {@code NaN}.</li>
 * </ul>
 *
 * <p>
 * Input arrays are never modified.
 * </p>
 *
 * @since 1.0.0
 */
public final class StatisticalAnalyzer {

    /** Default z-score outlier threshold, in standard deviations. */
    public static final double DEFAULT_Z_THRESHOLD = 2.0;

    /** Default IQR fence multiplier. */
    public static final double DEFAULT_IQR_MULTIPLIER = 1.5;

    /** Default modified z-score threshold (Iglewicz and Hoaglin). */
    public static final double DEFAULT_MODIFIED_Z_THRESHOLD = 3.5;

    /** Default trend sensitivity, as a fraction of the sample range per step. */
    public static final double DEFAULT_TREND_SENSITIVITY = 0.01;

    private static final double MAD_SCALE = 0.6745;

    private StatisticalAnalyzer() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Descriptive statistics
    // ---------------------------------------------------------------

    public static double mean(double[] values) {
        requireAtLeast("mean", values, 1);
        RunningStats stats = new RunningStats();
        for (double v : values) {
            stats.add(v);
        }
        return stats.getMean();
    }

    public static double median(double[] values) {
        return percentile(values, 0.5);
    }

    /**
     * @return population variance; {@code 0} for a single sample
     */
    public static double variance(double[] values) {
        requireAtLeast("variance", values, 1);
        RunningStats stats = new RunningStats();
        for (double v : values) {
            stats.add(v);
        }
        return stats.getVariance();
    }

    public static double stddev(double[] values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Population skewness {@code m3 / m2^1.5}; {@code 0} for a constant sample.
     */
    public static double skewness(double[] values) {
        requireAtLeast("skewness", values, 1);
        double mean = mean(values);
        double m2 = centralMoment(values, mean, 2);
        if (m2 == 0.0) {
            return 0.0;
        }
        return centralMoment(values, mean, 3) / Math.pow(m2, 1.5);
    }

    /**
     * Excess kurtosis {@code m4 / m2^2 - 3}; {@code 0} for a constant sample.
     */
    public static double kurtosis(double[] values) {
        requireAtLeast("kurtosis", values, 1);
        double mean = mean(values);
        double m2 = centralMoment(values, mean, 2);
        if (m2 == 0.0) {
            return 0.0;
        }
        return centralMoment(values, mean, 4) / (m2 * m2) - 3.0;
    }

    /**
     * Linear-interpolation percentile at rank {@code (n - 1) p}.
     *
     * @param values sample; must not be empty
     * @param p      quantile in {@code [0, 1]}
     * @return the percentile, within {@code [min, max]}
     * @throws IllegalArgumentException   if {@code p} is outside {@code [0, 1]}
     * @throws InsufficientDataException if {@code values} is empty
     */
    public static double percentile(double[] values, double p) {
        requireAtLeast("percentile", values, 1);
        return percentileOfSorted(sortedCopy(values), p);
    }

    /**
     * Percentile of an already sorted sample; see {@link #percentile(double[], double)}.
     */
    public static double percentileOfSorted(double[] sorted, double p) {
        if (p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException("Percentile must be in [0, 1], got: " + p);
        }
        requireAtLeast("percentile", sorted, 1);
        double rank = (sorted.length - 1) * p;
        int lo = (int) Math.floor(rank);
        int hi = Math.min(lo + 1, sorted.length - 1);
        double result = sorted[lo] + (rank - lo) * (sorted[hi] - sorted[lo]);
        // Guard against rounding drift beyond the bracketing order statistics.
        return Math.max(sorted[lo], Math.min(sorted[hi], result));
    }

    /**
     * Quartile at rank {@code (n + 1) p}, clamped to the first and last order
     * statistics.
     */
    public static double quartile(double[] values, double p) {
        requireAtLeast("quartile", values, 1);
        return quartileOfSorted(sortedCopy(values), p);
    }

    /**
     * One-pass summary of the sample.
     *
     * @throws InsufficientDataException if {@code values} is empty
     */
    public static DescriptiveStats describe(double[] values) {
        requireAtLeast("describe", values, 1);
        RunningStats running = new RunningStats();
        for (double v : values) {
            running.add(v);
        }
        double mean = running.getMean();
        double m2 = running.getVariance();
        double skew = 0.0;
        double kurt = 0.0;
        if (m2 > 0.0) {
            skew = centralMoment(values, mean, 3) / Math.pow(m2, 1.5);
            kurt = centralMoment(values, mean, 4) / (m2 * m2) - 3.0;
        }
        double[] sorted = sortedCopy(values);
        return new DescriptiveStats(values.length, running.getSum(), sorted[0],
                sorted[sorted.length - 1], mean, percentileOfSorted(sorted, 0.5), m2, skew, kurt,
                quartileOfSorted(sorted, 0.25), quartileOfSorted(sorted, 0.75),
                percentileOfSorted(sorted, 0.95), percentileOfSorted(sorted, 0.99));
    }

    // ---------------------------------------------------------------
    // Correlation
    // ---------------------------------------------------------------

    /**
     * Pearson product-moment correlation with a two-sided p-value from the
     * Student t distribution on {@code n - 2} degrees of freedom.
     *
     * <p>
     * If either sequence is constant the coefficient is undefined; the result is
     * then reported as {@code r = 0, p = 1}.
     * </p>
     *
     * @throws ValidationException        if the sequences differ in length
     * @throws InsufficientDataException if fewer than 3 pairs are supplied
     */
    public static CorrelationResult pearson(double[] x, double[] y) {
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(y, "y must not be null");
        if (x.length != y.length) {
            throw new ValidationException(
                    "Correlation requires equal-length sequences, got: " + x.length + " and " + y.length);
        }
        requireAtLeast("correlation", x, 3);

        int n = x.length;
        double meanX = mean(x);
        double meanY = mean(y);
        double sxy = 0.0;
        double sxx = 0.0;
        double syy = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        if (sxx == 0.0 || syy == 0.0) {
            return new CorrelationResult(0.0, 1.0, n);
        }

        double r = Math.max(-1.0, Math.min(1.0, sxy / Math.sqrt(sxx * syy)));
        double pValue;
        if (Math.abs(r) >= 1.0) {
            pValue = 0.0;
        } else {
            int df = n - 2;
            double t = r * Math.sqrt(df / (1.0 - r * r));
            TDistribution distribution = new TDistribution(df);
            pValue = 2.0 * (1.0 - distribution.cumulativeProbability(Math.abs(t)));
        }
        return new CorrelationResult(r, Math.max(0.0, Math.min(1.0, pValue)), n);
    }

    /**
     * Correlation of {@code x[t]} with {@code y[t + lag]}.
     *
     * @throws IllegalArgumentException   if {@code lag} is negative
     * @throws InsufficientDataException if fewer than 3 pairs overlap
     */
    public static CorrelationResult laggedCorrelation(double[] x, double[] y, int lag) {
        if (lag < 0) {
            throw new IllegalArgumentException("lag must be >= 0, got: " + lag);
        }
        if (x.length != y.length) {
            throw new ValidationException(
                    "Correlation requires equal-length sequences, got: " + x.length + " and " + y.length);
        }
        int overlap = x.length - lag;
        if (overlap < 3) {
            throw new InsufficientDataException("lagged correlation", lag + 3, x.length);
        }
        return pearson(Arrays.copyOfRange(x, 0, overlap), Arrays.copyOfRange(y, lag, lag + overlap));
    }

    public static CorrelationResult autocorrelation(double[] values, int lag) {
        return laggedCorrelation(values, values, lag);
    }

    /**
     * Pair each point of {@code first} with the point of {@code second} closest
     * in time, provided the two lie within {@code tolerance}. Points with no
     * partner are dropped.
     */
    public static AlignedSeries alignByTimestamp(List<TimedValue> first, List<TimedValue> second,
            Duration tolerance) {
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(second, "second must not be null");
        Objects.requireNonNull(tolerance, "tolerance must not be null");

        List<TimedValue> candidates = new ArrayList<>(second);
        candidates.sort(Comparator.comparing(TimedValue::getTimestamp));
        long[] times = candidates.stream().mapToLong(tv -> tv.getTimestamp().toEpochMilli()).toArray();
        long toleranceMillis = tolerance.toMillis();

        List<double[]> pairs = new ArrayList<>();
        for (TimedValue point : first) {
            if (times.length == 0) {
                break;
            }
            long t = point.getTimestamp().toEpochMilli();
            int pos = Arrays.binarySearch(times, t);
            int best;
            if (pos >= 0) {
                best = pos;
            } else {
                int insertion = -pos - 1;
                if (insertion == 0) {
                    best = 0;
                } else if (insertion == times.length) {
                    best = times.length - 1;
                } else {
                    best = (t - times[insertion - 1]) <= (times[insertion] - t) ? insertion - 1 : insertion;
                }
            }
            if (Math.abs(times[best] - t) <= toleranceMillis) {
                pairs.add(new double[] { point.getValue(), candidates.get(best).getValue() });
            }
        }

        double[] a = new double[pairs.size()];
        double[] b = new double[pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            a[i] = pairs.get(i)[0];
            b[i] = pairs.get(i)[1];
        }
        return new AlignedSeries(a, b);
    }

    // ---------------------------------------------------------------
    // Trend
    // ---------------------------------------------------------------

    public static TrendResult trend(double[] values) {
        return trend(values, DEFAULT_TREND_SENSITIVITY);
    }

    /**
     * Ordinary least squares of value against index.
     *
     * <p>
     * The trend is {@code INCREASING} when the slope exceeds
     * {@code sensitivity × range}, {@code DECREASING} when it is below the
     * negation, and {@code STABLE} otherwise, including for a constant sample.
     * </p>
     *
     * @throws InsufficientDataException if fewer than 2 values are supplied
     */
    public static TrendResult trend(double[] values, double sensitivity) {
        requireAtLeast("trend", values, 2);
        int n = values.length;
        double meanX = (n - 1) / 2.0;
        double meanY = mean(values);
        double sxy = 0.0;
        double sxx = 0.0;
        double syy = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            double dy = values[i] - meanY;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
            min = Math.min(min, values[i]);
            max = Math.max(max, values[i]);
        }
        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;
        double rSquared = syy == 0.0 ? 0.0 : (sxy * sxy) / (sxx * syy);
        double range = max - min;

        if (range == 0.0) {
            return new TrendResult(slope, intercept, rSquared, 0.0, TrendDirection.STABLE);
        }
        double limit = sensitivity * range;
        TrendDirection direction = slope > limit
                ? TrendDirection.INCREASING
                : slope < -limit ? TrendDirection.DECREASING : TrendDirection.STABLE;
        double strength = Math.min(1.0, Math.abs(slope) * (n - 1) / range);
        return new TrendResult(slope, intercept, rSquared, strength, direction);
    }

    // ---------------------------------------------------------------
    // Outliers
    // ---------------------------------------------------------------

    /**
     * Values with {@code |v - mean| / stddev > threshold}. A constant sample has
     * no outliers.
     *
     * @return outliers with their z-score as deviation, in index order
     */
    public static List<Outlier> zScoreOutliers(double[] values, double threshold) {
        requireAtLeast("z-score outliers", values, 1);
        double mean = mean(values);
        double sd = stddev(values);
        List<Outlier> outliers = new ArrayList<>();
        if (sd == 0.0) {
            return outliers;
        }
        for (int i = 0; i < values.length; i++) {
            double z = Math.abs(values[i] - mean) / sd;
            if (z > threshold) {
                outliers.add(new Outlier(i, values[i], z));
            }
        }
        return outliers;
    }

    /**
     * Values outside {@code [Q1 - k·IQR, Q3 + k·IQR]}. A sample whose IQR is
     * zero has no outliers.
     *
     * @return outliers with their distance beyond the fence, in IQR units, as
     *         deviation
     */
    public static List<Outlier> iqrOutliers(double[] values, double multiplier) {
        requireAtLeast("IQR outliers", values, 1);
        double[] sorted = sortedCopy(values);
        double q1 = quartileOfSorted(sorted, 0.25);
        double q3 = quartileOfSorted(sorted, 0.75);
        double iqr = q3 - q1;
        List<Outlier> outliers = new ArrayList<>();
        if (iqr == 0.0) {
            return outliers;
        }
        double lower = q1 - multiplier * iqr;
        double upper = q3 + multiplier * iqr;
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            if (v < lower) {
                outliers.add(new Outlier(i, v, (lower - v) / iqr));
            } else if (v > upper) {
                outliers.add(new Outlier(i, v, (v - upper) / iqr));
            }
        }
        return outliers;
    }

    /**
     * Modified z-score {@code 0.6745 (v - median) / MAD} above
     * {@code threshold}. A sample whose MAD is zero has no outliers.
     */
    public static List<Outlier> modifiedZScoreOutliers(double[] values, double threshold) {
        requireAtLeast("modified z-score outliers", values, 1);
        double median = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        double mad = median(deviations);
        List<Outlier> outliers = new ArrayList<>();
        if (mad == 0.0) {
            return outliers;
        }
        for (int i = 0; i < values.length; i++) {
            double score = MAD_SCALE * Math.abs(values[i] - median) / mad;
            if (score > threshold) {
                outliers.add(new Outlier(i, values[i], score));
            }
        }
        return outliers;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static double quartileOfSorted(double[] sorted, double p) {
        int n = sorted.length;
        double rank = (n + 1) * p;
        if (rank <= 1.0) {
            return sorted[0];
        }
        if (rank >= n) {
            return sorted[n - 1];
        }
        int lo = (int) Math.floor(rank);
        double fraction = rank - lo;
        return sorted[lo - 1] + fraction * (sorted[lo] - sorted[lo - 1]);
    }

    private static double centralMoment(double[] values, double mean, int order) {
        double sum = 0.0;
        for (double v : values) {
            sum += Math.pow(v - mean, order);
        }
        return sum / values.length;
    }

    private static double[] sortedCopy(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return sorted;
    }

    private static void requireAtLeast(String operation, double[] values, int required) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length < required) {
            throw new InsufficientDataException(operation, required, values.length);
        }
    }
}
