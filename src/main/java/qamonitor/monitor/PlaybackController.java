package qamonitor.monitor;

import qamonitor.buffer.FrameBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledFuture;

/**
 * Independent read cursor over the frame window.
 *
 * <p>While playing, a timer advances the cursor by one frame per interval. When the
 * cursor already sits on the last frame the next tick stops playback instead of
 * advancing (no wraparound). Manual navigation clamps to the window and works
 * whether or not playback is running.
 *
 * <p>Lock order: this controller's monitor, then the monitoring state lock.
 */
public class PlaybackController {

    private static final Logger log = LoggerFactory.getLogger(PlaybackController.class);

    private final MonitoringState state;
    private final long intervalMs;

    private SessionScheduler scheduler;
    private ScheduledFuture<?> timer;

    public PlaybackController(MonitoringState state, long intervalMs) {
        this.state      = state;
        this.intervalMs = intervalMs;
    }

    // ── Session binding ───────────────────────────────────────────────────

    /** Binds playback to the timers of a newly started session. */
    public synchronized void attach(SessionScheduler sessionScheduler) {
        this.scheduler = sessionScheduler;
    }

    /** Cancels the playback timer, clears {@code isPlaying}, and unbinds. Idempotent. */
    public synchronized void detach() {
        cancelTimer();
        state.withLock(() -> state.setPlaying(false));
        scheduler = null;
    }

    // ── Play / pause ──────────────────────────────────────────────────────

    /**
     * Starts advancing the cursor. No-op when no session is running, the window is
     * empty, or playback is already running.
     *
     * @return whether playback is running after the call
     * @throws IllegalArgumentException if the executor rejects the playback interval
     */
    public synchronized boolean play() {
        if (scheduler == null) {
            log.debug("play() ignored — no active session");
            return false;
        }
        Boolean started = state.withLock(() -> {
            if (state.playingLocked()) return Boolean.FALSE;
            if (!state.activeLocked() || state.buffer().isEmpty()) return null;
            state.setPlaying(true);
            return Boolean.TRUE;
        });
        if (started == null) {
            log.debug("play() ignored — nothing to play");
            return false;
        }
        if (started) {
            try {
                timer = scheduler.repeat("playback", this::tick, intervalMs, intervalMs);
            } catch (RuntimeException e) {
                state.withLock(() -> state.setPlaying(false));
                throw e;
            }
            log.info("Playback started");
        }
        return true;
    }

    /** Stops advancing the cursor. Safe to call when already paused. */
    public synchronized void pause() {
        boolean wasPlaying = state.withLock(() -> {
            boolean p = state.playingLocked();
            state.setPlaying(false);
            return p;
        });
        cancelTimer();
        if (wasPlaying) log.info("Playback paused");
    }

    public synchronized boolean togglePlayback() {
        boolean playing = state.withLock(state::playingLocked);
        if (playing) {
            pause();
            return false;
        }
        return play();
    }

    /**
     * Advances the cursor by one frame, or stops playback if it is on the last frame.
     *
     * @return {@code true} if the cursor moved
     */
    public synchronized boolean tick() {
        boolean moved = state.withLock(() -> {
            if (!state.playingLocked()) return false;
            FrameBuffer buffer = state.buffer();
            if (buffer.isEmpty() || buffer.cursor() >= buffer.size() - 1) {
                state.setPlaying(false);
                return false;
            }
            buffer.moveTo(buffer.cursor() + 1);
            return true;
        });
        if (!moved && timer != null) {
            cancelTimer();
            log.info("Playback reached the last frame — paused");
        }
        return moved;
    }

    // ── Manual navigation ─────────────────────────────────────────────────

    /** Jumps to {@code index} (clamped) and pins the frame. */
    public int goToFrame(int index) {
        return state.withLock(() -> {
            FrameBuffer buffer = state.buffer();
            buffer.pin();
            return buffer.moveTo(index);
        });
    }

    public int nextFrame() {
        return state.withLock(() -> {
            FrameBuffer buffer = state.buffer();
            buffer.pin();
            return buffer.moveTo(buffer.cursor() + 1);
        });
    }

    public int previousFrame() {
        return state.withLock(() -> {
            FrameBuffer buffer = state.buffer();
            buffer.pin();
            return buffer.moveTo(buffer.cursor() - 1);
        });
    }

    public int goToFirst() {
        return goToFrame(0);
    }

    /** Jumps to the newest frame and resumes following new frames as they arrive. */
    public int goToLast() {
        return state.withLock(() -> {
            FrameBuffer buffer = state.buffer();
            buffer.unpin();
            return buffer.moveTo(buffer.size() - 1);
        });
    }

    public boolean isPlaying() {
        return state.withLock(state::playingLocked);
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }
}
