package qamonitor.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Binds ingestion and playback to the external device-control signal.
 *
 * <p>{@link #start()} refuses to run without device control and otherwise opens a
 * fresh {@link SessionScheduler}. {@link #stop()} releases it again; it is idempotent
 * and never throws. If control is released while a session runs, the same stop
 * sequence runs on the thread that reported the change.
 */
public class SessionLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycle.class);

    static final String NO_CONTROL_ERROR =
            "Device control is not active — take control of the device before starting monitoring";
    static final String CONTROL_LOST_ERROR =
            "Device control was released — monitoring stopped";

    private final MonitoringState state;
    private final ControlSignal control;
    private final FrameIngestionScheduler ingestion;
    private final PlaybackController playback;
    private final Supplier<SessionScheduler> schedulerFactory;
    private final ControlSignal.Listener controlListener = this::onControlChanged;

    private SessionScheduler scheduler;

    public SessionLifecycle(MonitoringState state, ControlSignal control,
                            FrameIngestionScheduler ingestion, PlaybackController playback,
                            Supplier<SessionScheduler> schedulerFactory) {
        this.state            = state;
        this.control          = control;
        this.ingestion        = ingestion;
        this.playback         = playback;
        this.schedulerFactory = schedulerFactory;
        ingestion.setOnControlLost(() -> stop(CONTROL_LOST_ERROR));
    }

    /**
     * Starts a monitoring session.
     *
     * @return {@code true} if a session is running after the call
     * @throws MonitoringException if the session timers could not be set up
     */
    public synchronized boolean start() {
        if (scheduler != null) {
            log.debug("Monitoring already active — ignoring duplicate start()");
            return true;
        }
        if (!control.isActive()) {
            state.withLock(() -> state.setError(NO_CONTROL_ERROR));
            log.warn("Monitoring not started: device control is not active");
            return false;
        }

        state.withLock(() -> state.reset(true));
        scheduler = schedulerFactory.get();
        try {
            control.addListener(controlListener);
            ingestion.start(scheduler);
            playback.attach(scheduler);
        } catch (RuntimeException e) {
            stop(null);
            throw new MonitoringException("Failed to start monitoring session", e);
        }
        log.info("Monitoring session started");

        // control may have dropped before the listener was registered
        if (!control.isActive()) {
            stop(CONTROL_LOST_ERROR);
            return false;
        }
        return true;
    }

    /** Stops the session. Safe to call at any time, any number of times. */
    public void stop() {
        stop(null);
    }

    public boolean isActive() {
        return state.isActive();
    }

    private synchronized void stop(String reason) {
        SessionScheduler owned = scheduler;
        scheduler = null;
        control.removeListener(controlListener);
        try {
            ingestion.stop();
            playback.detach();
        } catch (RuntimeException e) {
            log.error("Error while stopping monitoring timers", e);
        } finally {
            boolean wasActive = state.withLock(() -> state.deactivate(reason));
            if (owned != null) {
                owned.close();
            }
            if (wasActive) {
                log.info("Monitoring session stopped{}", reason != null ? ": " + reason : "");
            }
        }
    }

    private void onControlChanged(boolean nowActive) {
        if (!nowActive && isActive()) {
            log.warn("Device control released while monitoring — stopping session");
            stop(CONTROL_LOST_ERROR);
        }
    }
}
