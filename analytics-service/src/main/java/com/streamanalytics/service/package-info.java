/**
 * Runnable host for the analytics engine.
 *
 * <p>
 * This package wires the core engine into a standalone process that accepts
 * observations over HTTP, exposes health, readiness and meter endpoints, and
 * writes detected anomalies to a JSON alert log.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.streamanalytics.service.AnalyticsService}: main entry
 * point</li>
 * <li>{@link com.streamanalytics.service.ServiceConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.streamanalytics.service.ServiceHttpServer}: HTTP endpoints</li>
 * <li>{@link com.streamanalytics.service.EngineMetrics}: Micrometer
 * binding</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.streamanalytics.service;
