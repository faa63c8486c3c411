/**
 * Event Bus: asynchronous, deduplicating publish/subscribe dispatch on a
 * bounded worker pool.
 *
 * @since 1.0.0
 */
package com.streamanalytics.core.bus;
