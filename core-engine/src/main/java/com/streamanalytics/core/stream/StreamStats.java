package com.streamanalytics.core.stream;

/**
 * Point-in-time snapshot of stream processor counters.
 *
 * @since 1.0.0
 */
public final class StreamStats {

    private final long processed;
    private final long windowsOpened;
    private final long windowsClosed;
    private final long lateAccepted;
    private final long lateDropped;
    private final long forcedCloses;
    private final long listenerErrors;
    private final int openWindows;

    StreamStats(long processed, long windowsOpened, long windowsClosed, long lateAccepted,
            long lateDropped, long forcedCloses, long listenerErrors, int openWindows) {
        this.processed = processed;
        this.windowsOpened = windowsOpened;
        this.windowsClosed = windowsClosed;
        this.lateAccepted = lateAccepted;
        this.lateDropped = lateDropped;
        this.forcedCloses = forcedCloses;
        this.listenerErrors = listenerErrors;
        this.openWindows = openWindows;
    }

    public long getProcessed() {
        return processed;
    }

    public long getWindowsOpened() {
        return windowsOpened;
    }

    public long getWindowsClosed() {
        return windowsClosed;
    }

    /** Late observations that landed in a window still within its grace period. */
    public long getLateAccepted() {
        return lateAccepted;
    }

    /** Observations that arrived after the grace period of every window they belong to. */
    public long getLateDropped() {
        return lateDropped;
    }

    /** Windows closed early because the open-window limit was reached. */
    public long getForcedCloses() {
        return forcedCloses;
    }

    public long getListenerErrors() {
        return listenerErrors;
    }

    public int getOpenWindows() {
        return openWindows;
    }

    @Override
    public String toString() {
        return "StreamStats{processed=" + processed
                + ", windowsOpened=" + windowsOpened
                + ", windowsClosed=" + windowsClosed
                + ", lateAccepted=" + lateAccepted
                + ", lateDropped=" + lateDropped
                + ", forcedCloses=" + forcedCloses
                + ", listenerErrors=" + listenerErrors
                + ", openWindows=" + openWindows + '}';
    }
}
