/**
 * Ensemble anomaly detection.
 *
 * <p>
 * Every independent method implements
 * {@link com.streamanalytics.core.detection.DetectionMethodStrategy} and is
 * instantiated via
 * {@link com.streamanalytics.core.detection.DetectionMethodFactory}.
 * Built-in methods:
 * </p>
 * <ul>
 * <li>{@link com.streamanalytics.core.detection.ZScoreMethod}: distance from
 * the mean in standard deviations</li>
 * <li>{@link com.streamanalytics.core.detection.IqrMethod}: Tukey fences</li>
 * <li>{@link com.streamanalytics.core.detection.ChangePointMethod}: mean shift
 * between the two halves of a window</li>
 * <li>{@link com.streamanalytics.core.detection.ThresholdMethod}: static
 * bounds</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a method, add its constant to
 * {@link com.streamanalytics.core.model.DetectionMethod}, implement
 * {@code DetectionMethodStrategy} and register it in
 * {@code DetectionMethodFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.streamanalytics.core.detection;
