/**
 * Data model shared by every engine component.
 *
 * <ul>
 * <li>{@link com.streamanalytics.core.model.Observation}: a validated raw
 * measurement</li>
 * <li>{@link com.streamanalytics.core.model.Window}: a sealed stream
 * window</li>
 * <li>{@link com.streamanalytics.core.model.AggregateResult}: summary
 * statistics of a window or batch</li>
 * <li>{@link com.streamanalytics.core.model.AnomalyResult}: per-point
 * detection outcome with method evidence</li>
 * <li>{@link com.streamanalytics.core.model.Event}: bus envelope</li>
 * </ul>
 *
 * <p>
 * Persisted types ({@code Observation}, {@code AggregateResult},
 * {@code AnomalyResult}) are Jackson-serialisable through their builders.
 * </p>
 *
 * @since 1.0.0
 */
package com.streamanalytics.core.model;
