/**
 * Statistical Analyzer: pure descriptive statistics, correlation, trend and
 * outlier routines, plus the {@link com.streamanalytics.core.stats.RunningStats}
 * accumulator shared with the collector.
 *
 * @since 1.0.0
 */
package com.streamanalytics.core.stats;
