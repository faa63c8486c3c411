/**
 * Event-time windowing: window assignment, watermarks, grace-period
 * reopening and emission of sealed windows to {@link com.streamanalytics.core.stream.WindowListener}s.
 */
package com.streamanalytics.core.stream;
