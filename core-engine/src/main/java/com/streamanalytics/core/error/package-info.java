/**
 * Unchecked exception hierarchy rooted at
 * {@link com.streamanalytics.core.error.AnalyticsException}.
 *
 * @since 1.0.0
 */
package com.streamanalytics.core.error;
