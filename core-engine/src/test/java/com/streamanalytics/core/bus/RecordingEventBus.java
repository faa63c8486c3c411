package com.streamanalytics.core.bus;

import com.streamanalytics.core.model.Event;
import com.streamanalytics.core.model.EventType;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous test bus that keeps every published event.
 */
public class RecordingEventBus implements EventBus {

    private final List<Event> published = new CopyOnWriteArrayList<>();

    @Override
    public boolean publish(Event event) {
        published.add(event);
        return true;
    }

    @Override
    public UUID subscribe(EventType type, EventHandler handler) {
        return UUID.randomUUID();
    }

    @Override
    public UUID subscribeAll(EventHandler handler) {
        return UUID.randomUUID();
    }

    @Override
    public boolean unsubscribe(UUID subscriptionId) {
        return false;
    }

    @Override
    public EventBusStats stats() {
        return new EventBusStats(published.size(), 0, 0, 0, 0, 0, 0);
    }

    @Override
    public void close() {
        // nothing to release
    }

    public List<Event> published() {
        return published;
    }

    public List<Event> published(EventType type) {
        return published.stream().filter(e -> e.getType() == type).toList();
    }
}
