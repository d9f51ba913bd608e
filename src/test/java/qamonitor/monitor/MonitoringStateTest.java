package qamonitor.monitor;

import qamonitor.model.DetectorVariant;
import qamonitor.model.MonitoringSnapshot;
import qamonitor.model.OverlayError;
import org.testng.annotations.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static qamonitor.model.FrameFixtures.frames;

/**
 * Unit tests for {@link MonitoringState}.
 */
public class MonitoringStateTest {

    @Test
    public void mutatorOutsideLock_isRejected() {
        MonitoringState state = new MonitoringState(10);

        assertThatThrownBy(() -> state.setError("x"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(state::buffer)
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void reset_opensNewEpochAndClearsEverything() {
        MonitoringState state = new MonitoringState(10);
        long before = state.withLock(state::epoch);
        state.withLock(() -> {
            state.buffer().append(frames(1, 3));
            state.setError("old");
            state.setOverlayError(new OverlayError(2, DetectorVariant.AI, "bad", Instant.now()));
            state.advanceLastProcessed(3);
        });

        state.withLock(() -> state.reset(true));

        MonitoringSnapshot s = state.snapshot();
        assertThat(s.active()).isTrue();
        assertThat(s.totalFrames()).isZero();
        assertThat(s.error()).isNull();
        assertThat(s.overlayError()).isNull();
        assertThat(s.lastProcessedFrame()).isZero();
        assertThat(state.withLock(state::epoch)).isGreaterThan(before);
    }

    @Test
    public void deactivate_onlyOnce() {
        MonitoringState state = new MonitoringState(10);
        state.withLock(() -> state.reset(true));
        long epoch = state.withLock(state::epoch);

        assertThat(state.withLock(() -> state.deactivate("gone"))).isTrue();
        assertThat(state.withLock(() -> state.deactivate("again"))).isFalse();

        assertThat(state.error()).isEqualTo("gone");
        assertThat(state.withLock(() -> state.isCurrent(epoch))).isFalse();
    }

    @Test
    public void advanceLastProcessed_neverMovesBackwards() {
        MonitoringState state = new MonitoringState(10);
        state.withLock(() -> {
            state.advanceLastProcessed(8);
            state.advanceLastProcessed(5);
        });

        assertThat(state.lastProcessedFrame()).isEqualTo(8);
    }

    @Test
    public void snapshot_isDetachedFromLaterChanges() {
        MonitoringState state = new MonitoringState(10);
        state.withLock(() -> state.reset(true));
        state.withLock(() -> {
            state.buffer().append(frames(1, 2));
        });

        MonitoringSnapshot s = state.snapshot();
        state.withLock(() -> {
            state.buffer().append(frames(3, 4));
        });

        assertThat(s.totalFrames()).isEqualTo(2);
        assertThat(s.frames()).hasSize(2);
        assertThat(s.maxFrames()).isEqualTo(10);
    }
}
