/**
 * Engine facade: ingestion, queries, subscriptions and lifecycle of the
 * analytics pipeline.
 *
 * @since 1.0.0
 */
package com.streamanalytics.core.engine;
