package qamonitor.monitor;

import qamonitor.backend.AnalysisBackend;
import qamonitor.backend.FrameSource;
import qamonitor.model.Analysis;
import qamonitor.model.CapturedFrame;
import qamonitor.model.DeviceTarget;
import qamonitor.model.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic poller that pulls newly captured frames, analyzes them one at a time in
 * ascending order, and appends the results to the frame window.
 *
 * <p>Ticks are serialized: a tick that fires while the previous one is still
 * fetching or analyzing is skipped. The low-water mark ({@code lastProcessedFrame})
 * advances to the newest frame of each batch even when some of its analyses failed;
 * those frames are dropped and never retried. Errors are recorded in the monitoring
 * state and the loop keeps going.
 */
public class FrameIngestionScheduler {

    private static final Logger log = LoggerFactory.getLogger(FrameIngestionScheduler.class);

    /** What a single tick ended up doing. */
    public enum TickResult {
        /** A previous tick was still in flight. */
        SKIPPED,
        /** No session is running. */
        INACTIVE,
        /** Device control was gone; the session was stopped. */
        CONTROL_LOST,
        FETCH_FAILED,
        NO_FRAMES,
        APPENDED,
        /** The session stopped or restarted while this tick was waiting on the network. */
        DISCARDED
    }

    private final MonitoringState state;
    private final FrameSource source;
    private final AnalysisBackend backend;
    private final DeviceTarget target;
    private final ControlSignal control;
    private final long intervalMs;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    private ScheduledFuture<?> task;
    private volatile Runnable onControlLost = () -> {};

    public FrameIngestionScheduler(MonitoringState state, FrameSource source, AnalysisBackend backend,
                                   DeviceTarget target, ControlSignal control, long intervalMs) {
        this.state      = state;
        this.source     = source;
        this.backend    = backend;
        this.target     = target;
        this.control    = control;
        this.intervalMs = intervalMs;
    }

    /** Action to run when a tick finds device control released. */
    void setOnControlLost(Runnable onControlLost) {
        this.onControlLost = onControlLost;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    /** Starts ticking on the session's scheduler; a second call is ignored. */
    public synchronized void start(SessionScheduler scheduler) {
        if (task != null) {
            log.warn("FrameIngestionScheduler already started — ignoring duplicate start()");
            return;
        }
        task = scheduler.repeat("frame-ingestion", this::tick, 0, intervalMs);
        log.info("Frame ingestion started for {} (every {} ms)", target, intervalMs);
    }

    /** Cancels the timer. Safe to call when not started. */
    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("Frame ingestion stopped for {}", target);
        }
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    // ── Tick ──────────────────────────────────────────────────────────────

    /**
     * Runs one fetch → analyze → append cycle. Called by the timer; tests may call it
     * directly.
     */
    public TickResult tick() {
        if (!inFlight.compareAndSet(false, true)) {
            log.debug("Ingestion tick skipped — previous tick still in flight");
            return TickResult.SKIPPED;
        }
        long epoch = -1;
        try {
            long[] start = state.withLock(() -> {
                if (!state.activeLocked()) return null;
                state.setProcessing(true);
                return new long[] { state.epoch(), state.lastProcessedFrameLocked() };
            });
            if (start == null) return TickResult.INACTIVE;
            epoch = start[0];
            long since = start[1];

            if (!control.isActive()) {
                log.warn("Device control no longer active — stopping monitoring of {}", target);
                onControlLost.run();
                return TickResult.CONTROL_LOST;
            }

            List<CapturedFrame> fetched;
            try {
                fetched = source.fetchNewFrames(target, since);
            } catch (IOException | RuntimeException e) {
                log.warn("Frame fetch from {} failed: {}", target, e.getMessage());
                recordError(epoch, "Failed to fetch frames: " + e.getMessage());
                return TickResult.FETCH_FAILED;
            }

            List<CapturedFrame> batch = newerThan(fetched, since);
            if (batch.isEmpty()) {
                recordError(epoch, null);
                return TickResult.NO_FRAMES;
            }

            List<Frame> analyzed = new ArrayList<>(batch.size());
            String lastFailure = null;
            for (CapturedFrame captured : batch) {
                long capturedEpoch = epoch;
                if (!state.withLock(() -> state.isCurrent(capturedEpoch))) {
                    log.debug("Session ended mid-batch — discarding {} analyzed frame(s)", analyzed.size());
                    return TickResult.DISCARDED;
                }
                try {
                    Analysis analysis = backend.analyzeFrame(captured.path(), captured.frameNumber(), target);
                    analyzed.add(Frame.analyzed(captured, analysis));
                } catch (IOException | RuntimeException e) {
                    lastFailure = e.getMessage();
                    log.warn("Analysis of frame #{} failed, dropping it: {}", captured.frameNumber(), lastFailure);
                }
            }

            long newest = batch.get(batch.size() - 1).frameNumber();
            String failure = lastFailure;
            long appendEpoch = epoch;
            boolean applied = state.withLock(() -> {
                if (!state.isCurrent(appendEpoch)) return false;
                int evicted = state.buffer().append(analyzed);
                state.advanceLastProcessed(newest);
                state.setError(analyzed.isEmpty()
                        ? "Analysis failed for all " + batch.size() + " frame(s): " + failure
                        : null);
                if (evicted > 0) {
                    log.debug("Appended {} frame(s), evicted {}", analyzed.size(), evicted);
                }
                return true;
            });
            if (!applied) {
                log.debug("Session ended before append — discarding {} frame(s)", analyzed.size());
                return TickResult.DISCARDED;
            }
            log.debug("Ingested frames up to #{} ({} of {} analyzed)", newest, analyzed.size(), batch.size());
            return TickResult.APPENDED;
        } finally {
            long finalEpoch = epoch;
            if (finalEpoch >= 0) {
                state.withLock(() -> {
                    if (state.isCurrent(finalEpoch)) state.setProcessing(false);
                });
            }
            inFlight.set(false);
        }
    }

    private void recordError(long epoch, String error) {
        state.withLock(() -> {
            if (state.isCurrent(epoch)) state.setError(error);
        });
    }

    /** Sorted ascending, only frames above the low-water mark, duplicates removed. */
    private static List<CapturedFrame> newerThan(List<CapturedFrame> fetched, long since) {
        if (fetched == null || fetched.isEmpty()) return List.of();
        List<CapturedFrame> sorted = new ArrayList<>(fetched);
        sorted.sort(Comparator.comparingLong(CapturedFrame::frameNumber));

        List<CapturedFrame> out = new ArrayList<>(sorted.size());
        long previous = since;
        for (CapturedFrame f : sorted) {
            if (f.frameNumber() <= previous) {
                log.debug("Ignoring stale or duplicate frame #{} (low-water mark #{})", f.frameNumber(), previous);
                continue;
            }
            out.add(f);
            previous = f.frameNumber();
        }
        return out;
    }
}
