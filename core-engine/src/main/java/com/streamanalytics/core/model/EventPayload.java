package com.streamanalytics.core.model;

/**
 * Marker for types that can travel as the payload of an {@link Event}.
 *
 * @since 1.0.0
 */
public interface EventPayload {
}
