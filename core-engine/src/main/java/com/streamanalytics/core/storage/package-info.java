/**
 * Storage Layer: the {@link com.streamanalytics.core.storage.MetricStore}
 * contract with in-memory, JDBC (day-partitioned) and Caffeine-cached
 * implementations, plus retry and retention helpers.
 *
 * @since 1.0.0
 */
package com.streamanalytics.core.storage;
