package com.streamanalytics.core.detection;

import com.streamanalytics.core.model.DetectionMethod;

import java.util.List;

/**
 * Contract for one independent anomaly detection method.
 * <p>
 * Implementations are <strong>stateless</strong>: every call evaluates the
 * given input on its own, so one instance may be shared across threads.
 * </p>
 */
public interface DetectionMethodStrategy {

    /**
     * @return the method this strategy implements
     */
    DetectionMethod method();

    /**
     * Whether the method can say anything about this input. A method that is
     * not applicable is left out of the vote entirely.
     *
     * @param input the series to evaluate
     * @return {@code false} when configuration or sample size rule the method out
     */
    default boolean isApplicable(DetectionInput input) {
        return !input.isEmpty();
    }

    /**
     * Evaluate the input.
     *
     * @param input the series to evaluate; {@link #isApplicable} must hold
     * @return flagged points, in index order; empty when nothing is flagged
     */
    List<MethodFinding> apply(DetectionInput input);
}
