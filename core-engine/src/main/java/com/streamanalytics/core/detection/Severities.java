package com.streamanalytics.core.detection;

import com.streamanalytics.core.model.Severity;

/**
 * Magnitude to severity mapping shared by the detection methods.
 */
final class Severities {

    private Severities() {
        // utility class — not instantiable
    }

    static Severity classify(double magnitude, double mediumFrom, double highFrom) {
        if (magnitude >= highFrom) {
            return Severity.HIGH;
        }
        return magnitude >= mediumFrom ? Severity.MEDIUM : Severity.LOW;
    }

    static double score(double magnitude, double saturation) {
        return Math.max(0.0, Math.min(magnitude / saturation, 1.0));
    }
}
