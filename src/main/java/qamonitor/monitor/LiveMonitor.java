package qamonitor.monitor;

import qamonitor.backend.AnalysisBackend;
import qamonitor.backend.BackendFactory;
import qamonitor.backend.FrameSource;
import qamonitor.model.DetectorVariant;
import qamonitor.model.DeviceTarget;
import qamonitor.model.MonitoringSnapshot;
import qamonitor.trend.ErrorTrend;
import qamonitor.trend.SubtitleTrend;
import qamonitor.trend.TrendAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Wires the monitoring pipeline for one device and exposes it as a single object.
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * DeviceControlSignal control = new DeviceControlSignal();
 * try (LiveMonitor monitor = LiveMonitor.fromConfig(new MonitorConfig(), control)) {
 *     control.set(true);            // operator took control
 *     monitor.start();
 *     // ...
 *     monitor.playback().goToFirst();
 *     monitor.playback().togglePlayback();
 *     monitor.detectSubtitles(DetectorVariant.AI).join();
 *     MonitoringSnapshot s = monitor.snapshot();
 * }
 * }</pre>
 */
public class LiveMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LiveMonitor.class);

    private final MonitoringState state;
    private final FrameIngestionScheduler ingestion;
    private final PlaybackController playback;
    private final SubtitleOverlayService overlay;
    private final SessionLifecycle lifecycle;
    private final ExecutorService ownedOverlayExecutor;

    /**
     * Full wiring; the overlay executor is owned (and shut down on {@link #close()})
     * only when {@code overlayExecutor} is {@code null}.
     */
    public LiveMonitor(MonitorConfig config, DeviceTarget target, FrameSource source,
                       AnalysisBackend backend, ControlSignal control,
                       Supplier<SessionScheduler> schedulerFactory, ExecutorService overlayExecutor) {
        this.state     = new MonitoringState(config.getMaxFrames());
        this.ingestion = new FrameIngestionScheduler(state, source, backend, target, control,
                config.getIngestIntervalMs());
        this.playback  = new PlaybackController(state, config.getPlaybackIntervalMs());
        this.lifecycle = new SessionLifecycle(state, control, ingestion, playback, schedulerFactory);

        this.ownedOverlayExecutor = overlayExecutor == null ? newOverlayExecutor() : null;
        this.overlay = new SubtitleOverlayService(state, playback, backend, target,
                overlayExecutor != null ? overlayExecutor : ownedOverlayExecutor);
    }

    /** Builds a monitor for the configured device, backed by {@link BackendFactory}. */
    public static LiveMonitor fromConfig(MonitorConfig config, ControlSignal control) {
        BackendFactory.Backend backend = BackendFactory.create(config);
        DeviceTarget target = config.getTarget();
        log.info("LiveMonitor configured: target={}, maxFrames={}, ingest={}ms, playback={}ms",
                target, config.getMaxFrames(), config.getIngestIntervalMs(), config.getPlaybackIntervalMs());
        return new LiveMonitor(config, target, backend.frameSource(), backend.analysis(), control,
                () -> SessionScheduler.create("monitor-" + target.deviceId()), null);
    }

    // ── Session ───────────────────────────────────────────────────────────

    public boolean start() {
        return lifecycle.start();
    }

    public void stop() {
        lifecycle.stop();
    }

    public boolean isActive() {
        return lifecycle.isActive();
    }

    // ── Components ────────────────────────────────────────────────────────

    public PlaybackController playback() {
        return playback;
    }

    public FrameIngestionScheduler ingestion() {
        return ingestion;
    }

    public SubtitleOverlayService overlay() {
        return overlay;
    }

    public CompletableFuture<SubtitleOverlayService.OverlayOutcome> detectSubtitles(DetectorVariant variant) {
        return overlay.detectSubtitles(variant);
    }

    // ── Views ─────────────────────────────────────────────────────────────

    public MonitoringSnapshot snapshot() {
        return state.snapshot();
    }

    public ErrorTrend errorTrend() {
        return TrendAnalyzer.errorTrend(state.snapshot().frames());
    }

    public SubtitleTrend subtitleTrend() {
        return TrendAnalyzer.subtitleTrend(state.snapshot().frames());
    }

    @Override
    public void close() {
        lifecycle.stop();
        if (ownedOverlayExecutor != null) {
            ownedOverlayExecutor.shutdown();
        }
    }

    private static ExecutorService newOverlayExecutor() {
        AtomicInteger n = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "subtitle-overlay-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
