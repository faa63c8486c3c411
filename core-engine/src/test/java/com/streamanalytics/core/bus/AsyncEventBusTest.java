package com.streamanalytics.core.bus;

import com.streamanalytics.core.config.EventBusConfig;
import com.streamanalytics.core.model.Event;
import com.streamanalytics.core.model.EventType;
import com.streamanalytics.core.model.FailureNotice;
import com.streamanalytics.core.model.Observation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Unit tests for {@link AsyncEventBus}.
 */
class AsyncEventBusTest {

    private AsyncEventBus bus;

    @BeforeEach
    void setUp() {
        bus = new AsyncEventBus(new EventBusConfig());
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    @DisplayName("Should deliver events only to matching typed subscribers")
    void shouldRouteByType() {
        List<Event> collected = new CopyOnWriteArrayList<>();
        List<Event> failures = new CopyOnWriteArrayList<>();
        bus.subscribe(EventType.METRIC_COLLECTED, collected::add);
        bus.subscribe(EventType.PROCESSING_FAILED, failures::add);

        bus.publish(observationEvent());

        await().atMost(Duration.ofSeconds(5)).until(() -> collected.size() == 1);
        assertThat(failures).isEmpty();
    }

    @Test
    @DisplayName("Should deliver every event to a catch-all subscriber")
    void shouldDeliverAllToCatchAll() {
        AtomicInteger count = new AtomicInteger();
        bus.subscribeAll(e -> count.incrementAndGet());

        bus.publish(observationEvent());
        bus.publish(Event.of(EventType.PROCESSING_FAILED, "test",
                new FailureNotice("test", "boom", Instant.now())));

        await().atMost(Duration.ofSeconds(5)).until(() -> count.get() == 2);
    }

    @Test
    @DisplayName("Should dispatch a repeated event id only once")
    void shouldDeduplicateById() {
        AtomicInteger count = new AtomicInteger();
        bus.subscribeAll(e -> count.incrementAndGet());
        Event event = observationEvent();

        assertThat(bus.publish(event)).isTrue();
        assertThat(bus.publish(event)).isFalse();

        await().atMost(Duration.ofSeconds(5)).until(() -> bus.stats().getDispatched() == 1);
        assertThat(count.get()).isEqualTo(1);
        assertThat(bus.stats().getDuplicates()).isEqualTo(1);
        assertThat(bus.stats().getPublished()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stop delivering after unsubscribe")
    void shouldStopAfterUnsubscribe() {
        AtomicInteger count = new AtomicInteger();
        UUID id = bus.subscribeAll(e -> count.incrementAndGet());

        assertThat(bus.unsubscribe(id)).isTrue();
        assertThat(bus.unsubscribe(id)).isFalse();
        bus.publish(observationEvent());

        assertThat(bus.stats().getActiveSubscriptions()).isZero();
        assertThat(count.get()).isZero();
    }

    @Test
    @DisplayName("Should isolate a failing handler from other subscribers")
    void shouldIsolateHandlerErrors() {
        AtomicInteger healthy = new AtomicInteger();
        bus.subscribeAll(e -> {
            throw new IllegalStateException("handler failure");
        });
        bus.subscribeAll(e -> healthy.incrementAndGet());

        bus.publish(observationEvent());

        await().atMost(Duration.ofSeconds(5)).until(() -> bus.stats().getHandlerErrors() == 1);
        await().atMost(Duration.ofSeconds(5)).until(() -> healthy.get() == 1);
    }

    @Test
    @DisplayName("Should reject deliveries when the dispatch queue is full")
    void shouldRejectWhenQueueFull() throws InterruptedException {
        EventBusConfig config = new EventBusConfig();
        config.setWorkerThreads(1);
        config.setQueueCapacity(1);
        CountDownLatch release = new CountDownLatch(1);
        try (AsyncEventBus small = new AsyncEventBus(config)) {
            small.subscribeAll(e -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            });

            assertThat(small.publish(observationEvent())).isTrue();
            assertThat(small.publish(observationEvent())).isTrue();
            assertThat(small.publish(observationEvent())).isFalse();
            assertThat(small.stats().getRejected()).isEqualTo(1);

            release.countDown();
        }
    }

    @Test
    @DisplayName("Should refuse events after close")
    void shouldRefuseAfterClose() {
        bus.close();

        assertThat(bus.publish(observationEvent())).isFalse();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Event observationEvent() {
        return Event.of(EventType.METRIC_COLLECTED, "test",
                Observation.of("cpu.usage", 42.0, Map.of("host", "a"), Instant.now()));
    }
}
