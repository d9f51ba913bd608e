package qamonitor.monitor;

import qamonitor.backend.AnalysisBackend;
import qamonitor.buffer.FrameBuffer;
import qamonitor.model.Analysis;
import qamonitor.model.DetectorVariant;
import qamonitor.model.DeviceTarget;
import qamonitor.model.Frame;
import qamonitor.model.OverlayError;
import qamonitor.model.SubtitleDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * On-demand subtitle detection for the frame under the playback cursor.
 *
 * <p>Before the request goes out, playback is paused and the frame is pinned so the
 * cursor cannot drift while the backend works. The detector's answer replaces only
 * the subtitle and language parts of that frame's analysis. Failures are published
 * as a frame-scoped {@link OverlayError}; the rest of the monitoring state is left
 * alone.
 *
 * <p>At most one request per {@link DetectorVariant} is in flight; further requests
 * of the same variant are skipped until it resolves.
 */
public class SubtitleOverlayService {

    private static final Logger log = LoggerFactory.getLogger(SubtitleOverlayService.class);

    /** How an overlay request ended. */
    public enum OverlayOutcome {
        APPLIED,
        /** Another request of the same variant was still pending. */
        SKIPPED_IN_FLIGHT,
        /** No session running or nothing buffered. */
        NO_FRAME,
        FAILED,
        /** The frame was evicted before the answer arrived. */
        FRAME_EVICTED,
        /** The session stopped before the answer arrived. */
        DISCARDED
    }

    private final MonitoringState state;
    private final PlaybackController playback;
    private final AnalysisBackend backend;
    private final DeviceTarget target;
    private final Executor executor;
    private final Map<DetectorVariant, AtomicBoolean> inFlight = new EnumMap<>(DetectorVariant.class);

    public SubtitleOverlayService(MonitoringState state, PlaybackController playback,
                                  AnalysisBackend backend, DeviceTarget target, Executor executor) {
        this.state    = state;
        this.playback = playback;
        this.backend  = backend;
        this.target   = target;
        this.executor = executor;
        for (DetectorVariant v : DetectorVariant.values()) {
            inFlight.put(v, new AtomicBoolean(false));
        }
    }

    /**
     * Requests subtitle detection for the current frame.
     *
     * @return completes with the outcome once the merge (or failure) has been applied;
     *         never completes exceptionally
     */
    public CompletableFuture<OverlayOutcome> detectSubtitles(DetectorVariant variant) {
        AtomicBoolean guard = inFlight.get(variant);
        if (!guard.compareAndSet(false, true)) {
            log.debug("{} subtitle detection already in flight — ignoring request", variant);
            return CompletableFuture.completedFuture(OverlayOutcome.SKIPPED_IN_FLIGHT);
        }

        playback.pause();
        Pending pending = state.withLock(() -> {
            if (!state.activeLocked()) return null;
            FrameBuffer buffer = state.buffer();
            Frame frame = buffer.current();
            if (frame == null) return null;
            buffer.pin();
            return new Pending(frame.frameNumber(), frame.imagePath(), state.epoch());
        });
        if (pending == null) {
            guard.set(false);
            return CompletableFuture.completedFuture(OverlayOutcome.NO_FRAME);
        }

        log.info("{} subtitle detection requested for frame #{}", variant, pending.frameNumber());
        CompletableFuture<SubtitleDetection> call;
        try {
            call = CompletableFuture.supplyAsync(() -> invoke(variant, pending), executor);
        } catch (RejectedExecutionException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call
                .handle((detection, failure) -> apply(variant, pending, detection, failure))
                .whenComplete((outcome, t) -> guard.set(false));
    }

    /** Whether a request of the given variant is pending. */
    public boolean isDetecting(DetectorVariant variant) {
        return inFlight.get(variant).get();
    }

    /** Whether the frame under the cursor already carries an overlay result. */
    public boolean hasOverlayResult() {
        return state.snapshot().hasOverlayResult();
    }

    // ── Internals ─────────────────────────────────────────────────────────

    private SubtitleDetection invoke(DetectorVariant variant, Pending pending) {
        try {
            return backend.detectSubtitles(variant, target, pending.imagePath(), true);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private OverlayOutcome apply(DetectorVariant variant, Pending pending,
                                 SubtitleDetection detection, Throwable failure) {
        String problem = null;
        if (failure != null) {
            problem = rootMessage(failure);
        } else if (detection == null || !detection.success()) {
            problem = detection != null && detection.error() != null
                    ? detection.error()
                    : "subtitle detector reported failure";
        }
        String error = problem;

        OverlayOutcome outcome = state.withLock(() -> {
            if (!state.isCurrent(pending.epoch())) return OverlayOutcome.DISCARDED;
            if (error != null) {
                state.setOverlayError(new OverlayError(pending.frameNumber(), variant, error, Instant.now()));
                return OverlayOutcome.FAILED;
            }
            FrameBuffer buffer = state.buffer();
            int idx = buffer.indexOf(pending.frameNumber());
            if (idx < 0) {
                state.setOverlayError(new OverlayError(pending.frameNumber(), variant,
                        "frame was evicted before subtitle detection completed", Instant.now()));
                return OverlayOutcome.FRAME_EVICTED;
            }
            Analysis merged = merge(buffer.get(idx).analysis(), detection);
            buffer.overwriteAnalysis(pending.frameNumber(), merged);
            state.setOverlayError(null);
            return OverlayOutcome.APPLIED;
        });

        switch (outcome) {
            case APPLIED -> log.info("{} subtitles merged into frame #{}", variant, pending.frameNumber());
            case FAILED, FRAME_EVICTED -> log.warn("{} subtitle detection for frame #{} failed: {}",
                    variant, pending.frameNumber(), error != null ? error : "frame evicted");
            case DISCARDED -> log.debug("{} subtitle result for frame #{} discarded — session ended",
                    variant, pending.frameNumber());
            default -> { }
        }
        return outcome;
    }

    /**
     * Copies the detector's subtitle and language findings onto {@code base}; status,
     * blackscreen, freeze and error results are kept.
     */
    static Analysis merge(Analysis base, SubtitleDetection detection) {
        return base
                .withSubtitles(Analysis.Subtitles.of(detection.subtitlesDetected(), detection.effectiveText()))
                .withLanguage(new Analysis.Language(detection.effectiveLanguage(), detection.effectiveConfidence()));
    }

    private static String rootMessage(Throwable t) {
        Throwable cause = t;
        while ((cause instanceof CompletionException || cause instanceof UncheckedIOException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private record Pending(long frameNumber, String imagePath, long epoch) {
    }
}
