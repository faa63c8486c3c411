package com.streamanalytics.core.model;

/**
 * Severity grade attached to a single method's evidence.
 *
 * @since 1.0.0
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
