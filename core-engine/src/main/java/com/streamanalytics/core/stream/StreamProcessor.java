package com.streamanalytics.core.stream;

import com.streamanalytics.core.bus.EventBus;
import com.streamanalytics.core.config.WindowConfig;
import com.streamanalytics.core.model.Event;
import com.streamanalytics.core.model.EventType;
import com.streamanalytics.core.model.FailureNotice;
import com.streamanalytics.core.model.MetricKey;
import com.streamanalytics.core.model.Observation;
import com.streamanalytics.core.model.Window;
import com.streamanalytics.core.model.WindowType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event-time windowing over the observation stream.
 *
 * <h3>Watermarks</h3>
 * <p>
 * Each series key tracks the largest event time it has seen. A global
 * watermark is advanced by {@link #advanceTo(Instant)}, and by a ticker on
 * the engine clock once {@link #start()} is called, so that idle series
 * still close their windows. A window of a key is due once
 * {@code max(keyWatermark, globalWatermark) >= end}; for session windows
 * {@code end} is the last event time plus the session gap.
 * </p>
 *
 * <h3>Late data</h3>
 * <p>
 * A closed window is remembered until {@code end + gracePeriod}. An
 * observation that belongs to it within that period reopens it with the next
 * revision, and the window is emitted again when the watermark passes the end
 * of the grace period. Observations that arrive later are dropped and
 * counted.
 * </p>
 *
 * <h3>Emission</h3>
 * <p>
 * The open-window table is guarded by a single lock. Sealed windows are
 * appended to a pending queue while that lock is held, so the queue keeps the
 * order in which windows were sealed. The queue is drained after the table
 * lock is released, by one thread at a time: listeners are called and the
 * window is published as {@link EventType#WINDOW_CLOSED}. An ingesting thread
 * that finds another thread draining leaves its windows to that thread and
 * returns; {@link #advanceTo(Instant)} and {@link #closeAll()} wait until
 * their windows have been emitted. A failing listener is logged, counted and
 * reported as {@link EventType#PROCESSING_FAILED}; the other listeners and
 * the bus still see the window.
 * </p>
 *
 * <h3>Backpressure</h3>
 * <p>
 * When more than {@code maxOpenWindows} windows are open, the one opened
 * earliest is sealed immediately.
 * </p>
 *
 * @since 1.0.0
 */
public class StreamProcessor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(StreamProcessor.class);
    private static final String SOURCE = "stream-processor";

    private final WindowConfig config;
    private final EventBus bus;
    private final Clock clock;
    private final WindowAssigner assigner;
    private final long gapMillis;
    private final long graceMillis;
    private final List<WindowListener> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock tableLock = new ReentrantLock();
    private final ReentrantLock emitLock = new ReentrantLock();
    private final Queue<Window> pending = new ConcurrentLinkedQueue<>();

    // guarded by tableLock
    private final Map<MetricKey, Map<String, OpenWindow>> open = new HashMap<>();
    private final Map<MetricKey, Map<String, ClosedWindow>> closed = new HashMap<>();
    private final Map<MetricKey, Instant> keyWatermarks = new HashMap<>();
    private Instant globalWatermark = Instant.EPOCH;
    private int openCount;
    private long openSequence;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong windowsOpened = new AtomicLong();
    private final AtomicLong windowsClosed = new AtomicLong();
    private final AtomicLong lateAccepted = new AtomicLong();
    private final AtomicLong lateDropped = new AtomicLong();
    private final AtomicLong forcedCloses = new AtomicLong();
    private final AtomicLong listenerErrors = new AtomicLong();

    private final ScheduledExecutorService ticker;
    private volatile boolean started;

    public StreamProcessor(WindowConfig config, EventBus bus, Clock clock, List<WindowListener> listeners) {
        this.config = Objects.requireNonNull(config, "WindowConfig must not be null");
        this.bus = Objects.requireNonNull(bus, "EventBus must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.listeners.addAll(Objects.requireNonNull(listeners, "listeners must not be null"));
        this.assigner = switch (config.getType()) {
            case TUMBLING -> new TumblingWindowAssigner(config.size());
            case SLIDING -> new SlidingWindowAssigner(config.size(), config.slide());
            case SESSION -> null;
        };
        this.gapMillis = config.sessionGap().toMillis();
        this.graceMillis = config.gracePeriod().toMillis();
        this.ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stream-watermark-ticker");
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(WindowListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Start advancing the global watermark from the clock at the configured
     * tick interval.
     */
    public void start() {
        if (started) {
            return;
        }
        started = true;
        long interval = config.tickInterval().toMillis();
        ticker.scheduleAtFixedRate(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        LOG.info("Stream processor started: {}", config);
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Route one observation to its windows, closing whatever became due.
     */
    public void process(Observation observation) {
        Objects.requireNonNull(observation, "observation must not be null");
        processed.incrementAndGet();
        MetricKey key = observation.seriesKey();
        Instant ts = observation.getTimestamp();

        List<Window> sealed = new ArrayList<>();
        tableLock.lock();
        try {
            keyWatermarks.merge(key, ts, (a, b) -> a.isAfter(b) ? a : b);
            Instant watermark = watermarkOf(key);
            sealDue(key, watermark, sealed);

            if (config.getType() == WindowType.SESSION) {
                assignSession(key, observation, watermark);
            } else {
                assignFixed(key, observation, watermark);
            }
            enforceLimit(sealed);
            pending.addAll(sealed);
        } finally {
            tableLock.unlock();
        }
        drain(false);
    }

    /**
     * Advance the global watermark and seal every window it makes due.
     * The watermark never moves backwards.
     */
    public void advanceTo(Instant watermark) {
        Objects.requireNonNull(watermark, "watermark must not be null");
        List<Window> sealed = new ArrayList<>();
        tableLock.lock();
        try {
            if (watermark.isAfter(globalWatermark)) {
                globalWatermark = watermark;
            }
            for (MetricKey key : keys()) {
                sealDue(key, watermarkOf(key), sealed);
            }
            pending.addAll(sealed);
        } finally {
            tableLock.unlock();
        }
        drain(true);
    }

    /**
     * Seal and emit every open window regardless of watermarks.
     *
     * @return number of windows emitted
     */
    public int closeAll() {
        List<Window> sealed = new ArrayList<>();
        tableLock.lock();
        try {
            for (Map<String, OpenWindow> windows : open.values()) {
                windows.values().stream()
                        .sorted(Comparator.comparingLong(w -> w.sequence))
                        .forEach(w -> sealed.add(seal(w)));
                windows.clear();
            }
            open.clear();
            openCount = 0;
            pending.addAll(sealed);
        } finally {
            tableLock.unlock();
        }
        drain(true);
        return sealed.size();
    }

    public StreamStats stats() {
        int openNow;
        tableLock.lock();
        try {
            openNow = openCount;
        } finally {
            tableLock.unlock();
        }
        return new StreamStats(processed.get(), windowsOpened.get(), windowsClosed.get(), lateAccepted.get(),
                lateDropped.get(), forcedCloses.get(), listenerErrors.get(), openNow);
    }

    /**
     * Stop the ticker and emit whatever is still open.
     */
    @Override
    public void close() {
        ticker.shutdownNow();
        int flushed = closeAll();
        LOG.info("Stream processor closed, {} open window(s) flushed. {}", flushed, stats());
    }

    // ---------------------------------------------------------------
    // Assignment (tableLock held)
    // ---------------------------------------------------------------

    private void assignFixed(MetricKey key, Observation observation, Instant watermark) {
        boolean placed = false;
        boolean late = false;
        for (WindowBounds bounds : assigner.assign(observation.getTimestamp())) {
            String id = Window.idFor(assigner.type(), key, bounds.getStart());
            Map<String, OpenWindow> windows = open.computeIfAbsent(key, k -> new LinkedHashMap<>());
            OpenWindow window = windows.get(id);
            if (window != null) {
                window.add(observation);
                placed = true;
                continue;
            }
            Instant graceEnd = bounds.getEnd().plusMillis(graceMillis);
            if (!watermark.isBefore(graceEnd)) {
                continue;
            }
            ClosedWindow previous = removeClosed(key, id);
            if (previous != null) {
                window = reopen(previous, graceEnd);
                late = true;
            } else {
                boolean due = !watermark.isBefore(bounds.getEnd());
                window = new OpenWindow(assigner.type(), key, bounds.getStart(), bounds.getEnd(), 0,
                        due ? graceEnd : bounds.getEnd(), nextSequence());
                late |= due;
                windowsOpened.incrementAndGet();
            }
            window.add(observation);
            windows.put(id, window);
            openCount++;
            placed = true;
        }
        countPlacement(observation, placed, late);
    }

    private void assignSession(MetricKey key, Observation observation, Instant watermark) {
        Instant ts = observation.getTimestamp();
        Map<String, OpenWindow> windows = open.computeIfAbsent(key, k -> new LinkedHashMap<>());

        OpenWindow current = windows.values().stream()
                .filter(w -> ts.isAfter(w.start.minusMillis(gapMillis)) && ts.isBefore(w.end))
                .findFirst()
                .orElse(null);
        if (current != null) {
            current.add(observation);
            current.extendSession(gapMillis);
            countPlacement(observation, true, false);
            return;
        }

        // late data for a session that was already sealed
        Map<String, ClosedWindow> recent = closed.get(key);
        if (recent != null) {
            for (Iterator<ClosedWindow> it = recent.values().iterator(); it.hasNext();) {
                ClosedWindow previous = it.next();
                Window w = previous.window;
                boolean inside = !ts.isBefore(w.getStart().minusMillis(gapMillis)) && ts.isBefore(w.getEnd());
                if (inside && watermark.isBefore(previous.forgetAt)) {
                    it.remove();
                    OpenWindow reopened = reopen(previous, previous.forgetAt);
                    reopened.add(observation);
                    windows.put(w.getId(), reopened);
                    openCount++;
                    countPlacement(observation, true, true);
                    return;
                }
            }
        }

        Instant end = ts.plusMillis(gapMillis);
        if (!watermark.isBefore(end.plusMillis(graceMillis))) {
            countPlacement(observation, false, false);
            return;
        }
        if (!windows.isEmpty()) {
            LOG.debug("Observation for {} at {} opens a separate session", key, ts);
        }
        boolean due = !watermark.isBefore(end);
        OpenWindow session = new OpenWindow(WindowType.SESSION, key, ts, end, 0,
                due ? end.plusMillis(graceMillis) : end, nextSequence());
        session.add(observation);
        windows.put(Window.idFor(WindowType.SESSION, key, ts), session);
        openCount++;
        windowsOpened.incrementAndGet();
        countPlacement(observation, true, due);
    }

    private void countPlacement(Observation observation, boolean placed, boolean late) {
        if (!placed) {
            lateDropped.incrementAndGet();
            LOG.debug("Dropped observation past grace period: {}", observation);
        } else if (late) {
            lateAccepted.incrementAndGet();
        }
    }

    private OpenWindow reopen(ClosedWindow previous, Instant dueAt) {
        Window w = previous.window;
        OpenWindow window = new OpenWindow(w.getType(), w.getKey(), w.getStart(), w.getEnd(),
                w.getRevision() + 1, dueAt, nextSequence());
        window.elements.addAll(w.getElements());
        window.last = w.getElements().stream()
                .map(Observation::getTimestamp)
                .max(Comparator.naturalOrder())
                .orElse(w.getStart());
        LOG.debug("Reopened window {} as revision {}", w.getId(), window.revision);
        return window;
    }

    // ---------------------------------------------------------------
    // Sealing (tableLock held)
    // ---------------------------------------------------------------

    private void sealDue(MetricKey key, Instant watermark, List<Window> sealed) {
        Map<String, OpenWindow> windows = open.get(key);
        if (windows != null) {
            for (Iterator<OpenWindow> it = windows.values().iterator(); it.hasNext();) {
                OpenWindow window = it.next();
                if (!watermark.isBefore(window.dueAt)) {
                    it.remove();
                    openCount--;
                    sealed.add(seal(window));
                }
            }
            if (windows.isEmpty()) {
                open.remove(key);
            }
        }
        Map<String, ClosedWindow> recent = closed.get(key);
        if (recent != null) {
            recent.values().removeIf(c -> !watermark.isBefore(c.forgetAt));
            if (recent.isEmpty()) {
                closed.remove(key);
            }
        }
    }

    private void enforceLimit(List<Window> sealed) {
        while (openCount > config.getMaxOpenWindows()) {
            OpenWindow oldest = null;
            for (Map<String, OpenWindow> windows : open.values()) {
                for (OpenWindow window : windows.values()) {
                    if (oldest == null || window.sequence < oldest.sequence) {
                        oldest = window;
                    }
                }
            }
            if (oldest == null) {
                return;
            }
            Map<String, OpenWindow> windows = open.get(oldest.key);
            windows.values().remove(oldest);
            if (windows.isEmpty()) {
                open.remove(oldest.key);
            }
            openCount--;
            forcedCloses.incrementAndGet();
            LOG.warn("Open window limit {} reached, force-closing {}", config.getMaxOpenWindows(), oldest.id());
            sealed.add(seal(oldest));
        }
    }

    private Window seal(OpenWindow window) {
        Window snapshot = window.snapshot();
        Instant forgetAt = window.end.plusMillis(graceMillis);
        if (window.dueAt.isAfter(forgetAt)) {
            forgetAt = window.dueAt;
        }
        closed.computeIfAbsent(window.key, k -> new LinkedHashMap<>())
                .put(snapshot.getId(), new ClosedWindow(snapshot, forgetAt));
        return snapshot;
    }

    private ClosedWindow removeClosed(MetricKey key, String id) {
        Map<String, ClosedWindow> recent = closed.get(key);
        return recent == null ? null : recent.remove(id);
    }

    private List<MetricKey> keys() {
        List<MetricKey> keys = new ArrayList<>(open.keySet());
        for (MetricKey key : closed.keySet()) {
            if (!open.containsKey(key)) {
                keys.add(key);
            }
        }
        return keys;
    }

    private Instant watermarkOf(MetricKey key) {
        Instant keyWatermark = keyWatermarks.getOrDefault(key, Instant.EPOCH);
        return keyWatermark.isAfter(globalWatermark) ? keyWatermark : globalWatermark;
    }

    private long nextSequence() {
        return openSequence++;
    }

    // ---------------------------------------------------------------
    // Emission (tableLock released)
    // ---------------------------------------------------------------

    /**
     * Emit queued windows in seal order. Without {@code wait} the call returns
     * at once when another thread is draining; that thread also takes the
     * windows queued by this one.
     */
    private void drain(boolean wait) {
        if (wait) {
            emitLock.lock();
        } else if (!emitLock.tryLock()) {
            return;
        }
        do {
            try {
                Window window;
                while ((window = pending.poll()) != null) {
                    emit(window);
                }
            } finally {
                emitLock.unlock();
            }
            // a window queued between the last poll and the unlock
        } while (!pending.isEmpty() && emitLock.tryLock());
    }

    private void emit(Window window) {
        for (WindowListener listener : listeners) {
            try {
                listener.onWindowClosed(window);
            } catch (RuntimeException e) {
                listenerErrors.incrementAndGet();
                LOG.error("Window listener {} failed for window {}: {}",
                        listener.getClass().getSimpleName(), window.getId(), e.getMessage(), e);
                bus.publish(Event.of(EventType.PROCESSING_FAILED, SOURCE, new FailureNotice(
                        listener.getClass().getSimpleName(), window.getId() + ": " + e.getMessage(),
                        clock.instant())));
            }
        }
        bus.publish(Event.of(EventType.WINDOW_CLOSED, SOURCE, window));
        windowsClosed.incrementAndGet();
        LOG.debug("Closed window {} revision {} with {} element(s)",
                window.getId(), window.getRevision(), window.size());
    }

    private void tick() {
        try {
            advanceTo(clock.instant());
        } catch (RuntimeException e) {
            LOG.error("Watermark tick failed: {}", e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Window state
    // ---------------------------------------------------------------

    private static final class OpenWindow {
        final WindowType type;
        final MetricKey key;
        final int revision;
        final long sequence;
        final List<Observation> elements = new ArrayList<>();
        Instant start;
        Instant end;
        Instant dueAt;
        Instant last;

        OpenWindow(WindowType type, MetricKey key, Instant start, Instant end, int revision,
                Instant dueAt, long sequence) {
            this.type = type;
            this.key = key;
            this.start = start;
            this.end = end;
            this.revision = revision;
            this.dueAt = dueAt;
            this.sequence = sequence;
            this.last = start;
        }

        void add(Observation observation) {
            elements.add(observation);
            if (observation.getTimestamp().isAfter(last)) {
                last = observation.getTimestamp();
            }
        }

        // the start, and so the id, only moves before the first emission
        void extendSession(long gapMillis) {
            Instant latest = elements.get(elements.size() - 1).getTimestamp();
            if (revision == 0 && latest.isBefore(start)) {
                start = latest;
            }
            Instant candidate = last.plusMillis(gapMillis);
            if (candidate.isAfter(end)) {
                end = candidate;
                if (revision == 0) {
                    dueAt = end;
                }
            }
        }

        String id() {
            return Window.idFor(type, key, start);
        }

        Window snapshot() {
            return new Window(type, key, start, end, revision, elements);
        }
    }

    private static final class ClosedWindow {
        final Window window;
        final Instant forgetAt;

        ClosedWindow(Window window, Instant forgetAt) {
            this.window = window;
            this.forgetAt = forgetAt;
        }
    }
}
