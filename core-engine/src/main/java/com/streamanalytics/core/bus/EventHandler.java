package com.streamanalytics.core.bus;

import com.streamanalytics.core.model.Event;

/**
 * Callback invoked by the event bus on one of its worker threads.
 *
 * <p>
 * Exceptions thrown by a handler are caught, logged with the event id and
 * counted; they never reach the publisher or other handlers.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventHandler {

    void onEvent(Event event) throws Exception;
}
