package com.streamanalytics.core.bus;

import com.streamanalytics.core.model.Event;
import com.streamanalytics.core.model.EventType;

import java.util.UUID;

/**
 * Asynchronous publish/subscribe channel between engine components and
 * external listeners.
 *
 * <h3>Delivery</h3>
 * <ul>
 * <li>{@link #publish(Event)} never blocks the caller.</li>
 * <li>An event id is dispatched at most once within the deduplication
 * horizon.</li>
 * <li>Each matching subscriber is invoked independently; one failing
 * handler does not affect the others.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface EventBus extends AutoCloseable {

    /**
     * Enqueue an event for dispatch to every matching subscriber.
     *
     * @param event the event; must not be {@code null}
     * @return {@code true} if the event was accepted, {@code false} if it was
     *         a duplicate, the bus is closed, or the dispatch queue was full
     */
    boolean publish(Event event);

    /**
     * @return subscription id usable with {@link #unsubscribe(UUID)}
     */
    UUID subscribe(EventType type, EventHandler handler);

    /**
     * Subscribe to every event type.
     */
    UUID subscribeAll(EventHandler handler);

    /**
     * @return {@code true} if a subscription with that id existed
     */
    boolean unsubscribe(UUID subscriptionId);

    EventBusStats stats();

    @Override
    void close();
}
