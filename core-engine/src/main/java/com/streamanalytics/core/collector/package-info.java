/**
 * Metrics Collector: bounded observation buffer, per-series running
 * statistics, and batch and window aggregation to storage.
 *
 * @since 1.0.0
 */
package com.streamanalytics.core.collector;
