package com.streamanalytics.core.bus;

import com.streamanalytics.core.model.EventType;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A registered handler. A subscription with no event type receives every
 * event.
 *
 * @since 1.0.0
 */
final class Subscription {

    private final UUID id;
    private final EventType type;
    private final EventHandler handler;

    Subscription(UUID id, EventType type, EventHandler handler) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.type = type;
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
    }

    boolean matches(EventType eventType) {
        return type == null || type == eventType;
    }

    UUID getId() {
        return id;
    }

    Optional<EventType> getType() {
        return Optional.ofNullable(type);
    }

    EventHandler getHandler() {
        return handler;
    }
}
