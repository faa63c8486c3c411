package com.streamanalytics.core.bus;

import com.streamanalytics.core.config.EventBusConfig;
import com.streamanalytics.core.model.Event;
import com.streamanalytics.core.model.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link EventBus} backed by a bounded worker pool.
 *
 * <h3>Dispatch</h3>
 * <p>
 * Every (event, subscriber) pair becomes one task on a fixed-size
 * {@link ThreadPoolExecutor} whose queue holds at most
 * {@code queueCapacity} tasks. When the queue is full the task is refused
 * immediately, counted as rejected and logged; the publisher is never
 * blocked.
 * </p>
 *
 * <h3>Deduplication</h3>
 * <p>
 * Event ids pass through a {@link DeduplicationWindow} before dispatch. A
 * repeated id is dropped and counted as a duplicate.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent use. The subscriber list and the deduplication window
 * are guarded independently.
 * </p>
 *
 * @since 1.0.0
 */
public class AsyncEventBus implements EventBus {

    private static final Logger LOG = LoggerFactory.getLogger(AsyncEventBus.class);

    private final EventBusConfig config;
    private final ThreadPoolExecutor executor;
    private final DeduplicationWindow dedup;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final AtomicLong published = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong dispatched = new AtomicLong();
    private final AtomicLong handlerErrors = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public AsyncEventBus(EventBusConfig config) {
        this(config, Clock.systemUTC());
    }

    public AsyncEventBus(EventBusConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "EventBusConfig must not be null");
        this.dedup = new DeduplicationWindow(config.getDedupMaxEntries(), config.dedupHorizon(), clock);
        this.executor = new ThreadPoolExecutor(
                config.getWorkerThreads(), config.getWorkerThreads(),
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(config.getQueueCapacity()),
                workerThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy());
        LOG.info("Event bus started with {}", config);
    }

    // ---------------------------------------------------------------
    // EventBus
    // ---------------------------------------------------------------

    @Override
    public boolean publish(Event event) {
        Objects.requireNonNull(event, "Event must not be null");
        if (closed.get()) {
            LOG.debug("Event bus closed, dropping event {}", event.getId());
            return false;
        }
        if (!dedup.markSeen(event.getId())) {
            duplicates.incrementAndGet();
            LOG.trace("Duplicate event {} ignored", event.getId());
            return false;
        }
        published.incrementAndGet();

        boolean accepted = true;
        for (Subscription subscription : subscriptions) {
            if (!subscription.matches(event.getType())) {
                continue;
            }
            try {
                executor.execute(() -> dispatch(subscription, event));
            } catch (RejectedExecutionException e) {
                rejected.incrementAndGet();
                accepted = false;
                LOG.warn("Dispatch queue full, event {} ({}) not delivered to subscription {}",
                        event.getId(), event.getType(), subscription.getId());
            }
        }
        return accepted;
    }

    @Override
    public UUID subscribe(EventType type, EventHandler handler) {
        Objects.requireNonNull(type, "EventType must not be null");
        return register(type, handler);
    }

    @Override
    public UUID subscribeAll(EventHandler handler) {
        return register(null, handler);
    }

    @Override
    public boolean unsubscribe(UUID subscriptionId) {
        boolean removed = subscriptions.removeIf(s -> s.getId().equals(subscriptionId));
        if (removed) {
            LOG.debug("Removed subscription {}", subscriptionId);
        }
        return removed;
    }

    @Override
    public EventBusStats stats() {
        return new EventBusStats(published.get(), duplicates.get(), dispatched.get(),
                handlerErrors.get(), rejected.get(), subscriptions.size(), executor.getQueue().size());
    }

    /**
     * Stop accepting events and wait up to the configured shutdown timeout for
     * queued deliveries to finish.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        executor.shutdown();
        try {
            long timeoutMillis = config.shutdownTimeout().toMillis();
            if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                List<Runnable> abandoned = executor.shutdownNow();
                LOG.warn("Event bus shutdown timed out, {} delivery task(s) abandoned", abandoned.size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Event bus closed: {}", stats());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private UUID register(EventType type, EventHandler handler) {
        Objects.requireNonNull(handler, "EventHandler must not be null");
        Subscription subscription = new Subscription(UUID.randomUUID(), type, handler);
        subscriptions.add(subscription);
        LOG.debug("Registered subscription {} for {}", subscription.getId(),
                subscription.getType().map(Enum::name).orElse("all events"));
        return subscription.getId();
    }

    private void dispatch(Subscription subscription, Event event) {
        try {
            subscription.getHandler().onEvent(event);
            dispatched.incrementAndGet();
        } catch (Exception e) {
            handlerErrors.incrementAndGet();
            LOG.error("Handler of subscription {} failed on event {} ({}): {}",
                    subscription.getId(), event.getId(), event.getType(), e.getMessage(), e);
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "event-bus-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
