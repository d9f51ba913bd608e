package qamonitor.monitor;

import qamonitor.buffer.FrameBuffer;
import qamonitor.model.MonitoringSnapshot;
import qamonitor.model.OverlayError;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The single mutable unit shared by ingestion, playback, subtitle overlay and the
 * session lifecycle.
 *
 * <p>Every transition runs inside {@link #withLock(Supplier)}, so one writer at a
 * time applies a complete change and readers only ever see whole transitions
 * through {@link #snapshot()}. The package-private mutators must only be called
 * while the lock is held.
 *
 * <p>{@code epoch} is bumped whenever a session starts or stops. Work that
 * captured an older epoch before a network call is stale and must be dropped; see
 * {@link #isCurrent(long)}.
 */
public class MonitoringState {

    private final ReentrantLock lock = new ReentrantLock();
    private final FrameBuffer buffer;

    private boolean active;
    private boolean processing;
    private boolean playing;
    private String error;
    private long lastProcessedFrame;
    private OverlayError overlayError;
    private long epoch;

    public MonitoringState(int maxFrames) {
        this.buffer = new FrameBuffer(maxFrames);
    }

    // ── Critical section ──────────────────────────────────────────────────

    public <T> T withLock(Supplier<T> transition) {
        lock.lock();
        try {
            return transition.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(Runnable transition) {
        lock.lock();
        try {
            transition.run();
        } finally {
            lock.unlock();
        }
    }

    /** Consistent copy of every field. */
    public MonitoringSnapshot snapshot() {
        return withLock(() -> new MonitoringSnapshot(
                active,
                processing,
                playing,
                buffer.isPinned(),
                buffer.frames(),
                buffer.cursor(),
                buffer.size(),
                buffer.maxFrames(),
                error,
                lastProcessedFrame,
                overlayError));
    }

    // ── Locked readers (convenience) ──────────────────────────────────────

    public boolean isActive() {
        return withLock(() -> active);
    }

    public String error() {
        return withLock(() -> error);
    }

    public long lastProcessedFrame() {
        return withLock(() -> lastProcessedFrame);
    }

    // ── Mutators; caller holds the lock ───────────────────────────────────

    FrameBuffer buffer() {
        assertLocked();
        return buffer;
    }

    /** Empties the window and opens a new session epoch. */
    void reset(boolean nowActive) {
        assertLocked();
        buffer.clear();
        active = nowActive;
        processing = false;
        playing = false;
        error = null;
        overlayError = null;
        lastProcessedFrame = 0;
        epoch++;
    }

    /**
     * Ends the session: frames are discarded, flags cleared, epoch bumped.
     * No-op when already inactive, so repeated stops have no further effect.
     *
     * @param reason error text to publish, or {@code null} to leave {@code error} as is
     * @return {@code false} if the state was already inactive
     */
    boolean deactivate(String reason) {
        assertLocked();
        if (!active) return false;
        buffer.clear();
        active = false;
        processing = false;
        playing = false;
        if (reason != null) error = reason;
        epoch++;
        return true;
    }

    long epoch() {
        assertLocked();
        return epoch;
    }

    /** True if the session that captured {@code capturedEpoch} is still the running one. */
    boolean isCurrent(long capturedEpoch) {
        assertLocked();
        return active && epoch == capturedEpoch;
    }

    boolean activeLocked() {
        assertLocked();
        return active;
    }

    boolean playingLocked() {
        assertLocked();
        return playing;
    }

    long lastProcessedFrameLocked() {
        assertLocked();
        return lastProcessedFrame;
    }

    void setProcessing(boolean processing) {
        assertLocked();
        this.processing = processing;
    }

    void setPlaying(boolean playing) {
        assertLocked();
        this.playing = playing;
    }

    void setError(String error) {
        assertLocked();
        this.error = error;
    }

    void setOverlayError(OverlayError overlayError) {
        assertLocked();
        this.overlayError = overlayError;
    }

    /** Raises the low-water mark; never lowers it. */
    void advanceLastProcessed(long frameNumber) {
        assertLocked();
        if (frameNumber > lastProcessedFrame) {
            lastProcessedFrame = frameNumber;
        }
    }

    private void assertLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("MonitoringState mutated outside withLock()");
        }
    }
}
