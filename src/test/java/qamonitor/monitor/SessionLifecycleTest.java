package qamonitor.monitor;

import qamonitor.backend.AnalysisBackend;
import qamonitor.backend.FrameSource;
import qamonitor.model.DeviceTarget;
import qamonitor.model.MonitoringSnapshot;
import qamonitor.monitor.FrameIngestionScheduler.TickResult;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static qamonitor.model.FrameFixtures.frames;

/**
 * Unit tests for {@link SessionLifecycle}: the control gate on start, teardown of
 * both timers on stop, and the stop triggered by losing device control.
 */
public class SessionLifecycleTest {

    private static final DeviceTarget TARGET = new DeviceTarget("localhost", "device1");
    private static final long INGEST_MS = 500;
    private static final long PLAYBACK_MS = 1000;

    private MonitoringState state;
    private FrameSource source;
    private DeviceControlSignal control;
    private FrameIngestionScheduler ingestion;
    private PlaybackController playback;

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> ingestionTimer;
    private ScheduledFuture<?> playbackTimer;
    private AtomicInteger schedulersCreated;
    private Supplier<SessionScheduler> schedulerFactory;

    @BeforeMethod
    public void setUp() throws IOException {
        state   = new MonitoringState(180);
        source  = mock(FrameSource.class);
        when(source.fetchNewFrames(any(), anyLong())).thenReturn(List.of());
        control = new DeviceControlSignal(false);

        ingestion = new FrameIngestionScheduler(state, source, mock(AnalysisBackend.class),
                TARGET, control, INGEST_MS);
        playback = new PlaybackController(state, PLAYBACK_MS);

        executor       = mock(ScheduledExecutorService.class);
        ingestionTimer = mock(ScheduledFuture.class);
        playbackTimer  = mock(ScheduledFuture.class);
        doReturn(ingestionTimer).when(executor)
                .scheduleWithFixedDelay(any(Runnable.class), eq(0L), eq(INGEST_MS), eq(TimeUnit.MILLISECONDS));
        doReturn(playbackTimer).when(executor)
                .scheduleWithFixedDelay(any(Runnable.class), eq(PLAYBACK_MS), eq(PLAYBACK_MS), eq(TimeUnit.MILLISECONDS));

        schedulersCreated = new AtomicInteger();
        schedulerFactory = () -> {
            schedulersCreated.incrementAndGet();
            return new SessionScheduler(executor);
        };
    }

    private SessionLifecycle lifecycle(ControlSignal signal) {
        return new SessionLifecycle(state, signal, ingestion, playback, schedulerFactory);
    }

    // ── Start ─────────────────────────────────────────────────────────────

    @Test(description = "Without device control no session and no timer is created")
    public void start_withoutControl_staysInactiveWithError() {
        SessionLifecycle lifecycle = lifecycle(control);

        assertThat(lifecycle.start()).isFalse();

        MonitoringSnapshot s = state.snapshot();
        assertThat(s.active()).isFalse();
        assertThat(s.error()).isEqualTo(SessionLifecycle.NO_CONTROL_ERROR);
        assertThat(schedulersCreated.get()).isZero();
        assertThat(ingestion.isRunning()).isFalse();
    }

    @Test
    public void start_withControl_startsIngestion() {
        control.set(true);
        SessionLifecycle lifecycle = lifecycle(control);

        assertThat(lifecycle.start()).isTrue();

        assertThat(lifecycle.isActive()).isTrue();
        assertThat(ingestion.isRunning()).isTrue();
        assertThat(state.snapshot().error()).isNull();
        verify(executor).scheduleWithFixedDelay(any(Runnable.class), eq(0L), eq(INGEST_MS), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    public void start_afterFailedAttempt_clearsPreviousError() {
        SessionLifecycle lifecycle = lifecycle(control);
        lifecycle.start();
        control.set(true);

        assertThat(lifecycle.start()).isTrue();
        assertThat(state.error()).isNull();
    }

    @Test
    public void start_twice_createsOneScheduler() {
        control.set(true);
        SessionLifecycle lifecycle = lifecycle(control);

        lifecycle.start();
        assertThat(lifecycle.start()).isTrue();

        assertThat(schedulersCreated.get()).isEqualTo(1);
    }

    @Test
    public void start_timerSetupFails_throwsAndLeavesSessionStopped() {
        control.set(true);
        doThrow(new RejectedExecutionException("pool closed")).when(executor)
                .scheduleWithFixedDelay(any(Runnable.class), eq(0L), eq(INGEST_MS), eq(TimeUnit.MILLISECONDS));
        SessionLifecycle lifecycle = lifecycle(control);

        assertThatThrownBy(lifecycle::start)
                .isInstanceOf(MonitoringException.class)
                .hasRootCauseInstanceOf(RejectedExecutionException.class);
        assertThat(lifecycle.isActive()).isFalse();
        verify(executor).shutdown();
    }

    // ── Stop ──────────────────────────────────────────────────────────────

    @Test(description = "Releasing control while playing cancels both timers and clears the window")
    public void controlReleased_whilePlaying_tearsDownBothTimers() {
        control.set(true);
        SessionLifecycle lifecycle = lifecycle(control);
        lifecycle.start();
        state.withLock(() -> {
            state.buffer().append(frames(1, 10));
        });
        playback.goToFirst();
        assertThat(playback.play()).isTrue();

        control.set(false);

        verify(ingestionTimer, atLeastOnce()).cancel(false);
        verify(playbackTimer, atLeastOnce()).cancel(false);
        verify(executor).shutdown();

        MonitoringSnapshot s = state.snapshot();
        assertThat(s.active()).isFalse();
        assertThat(s.playing()).isFalse();
        assertThat(s.processing()).isFalse();
        assertThat(s.totalFrames()).isZero();
        assertThat(s.error()).isEqualTo(SessionLifecycle.CONTROL_LOST_ERROR);
        assertThat(ingestion.isRunning()).isFalse();
        assertThat(playback.play()).as("playback is unbound after stop").isFalse();
    }

    @Test
    public void stop_isIdempotent() {
        control.set(true);
        SessionLifecycle lifecycle = lifecycle(control);
        lifecycle.start();

        lifecycle.stop();
        assertThatCode(lifecycle::stop).doesNotThrowAnyException();

        verify(executor, times(1)).shutdown();
        assertThat(lifecycle.isActive()).isFalse();
        assertThat(state.error()).as("manual stop sets no error").isNull();
    }

    @Test
    public void stop_beforeStart_isNoOp() {
        assertThatCode(() -> lifecycle(control).stop()).doesNotThrowAnyException();
        assertThat(state.isActive()).isFalse();
    }

    @Test
    public void tick_afterStop_isInactive() {
        control.set(true);
        SessionLifecycle lifecycle = lifecycle(control);
        lifecycle.start();
        lifecycle.stop();

        assertThat(ingestion.tick()).isEqualTo(TickResult.INACTIVE);
    }

    @Test
    public void restart_opensFreshSession() {
        control.set(true);
        SessionLifecycle lifecycle = lifecycle(control);
        lifecycle.start();
        state.withLock(() -> {
            state.buffer().append(frames(1, 3));
            state.advanceLastProcessed(3);
        });
        lifecycle.stop();

        assertThat(lifecycle.start()).isTrue();

        MonitoringSnapshot s = state.snapshot();
        assertThat(s.totalFrames()).isZero();
        assertThat(s.lastProcessedFrame()).isZero();
        assertThat(schedulersCreated.get()).isEqualTo(2);
    }

    @Test(description = "A tick that finds control gone stops the session even without a notification")
    public void tick_detectsLostControl_stopsSession() {
        ControlSignal silent = mock(ControlSignal.class);
        when(silent.isActive()).thenReturn(true, true, false);
        SessionLifecycle lifecycle = lifecycle(silent);
        assertThat(lifecycle.start()).isTrue();

        assertThat(ingestion.tick()).isEqualTo(TickResult.CONTROL_LOST);

        assertThat(lifecycle.isActive()).isFalse();
        assertThat(state.error()).isEqualTo(SessionLifecycle.CONTROL_LOST_ERROR);
        verify(silent).removeListener(any());
    }

    @Test
    public void controlReacquired_doesNotAutoStart() {
        control.set(true);
        SessionLifecycle lifecycle = lifecycle(control);
        lifecycle.start();
        control.set(false);

        control.set(true);

        assertThat(lifecycle.isActive()).isFalse();
    }
}
