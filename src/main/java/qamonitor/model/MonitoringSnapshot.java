package qamonitor.model;

import java.util.List;

/**
 * Immutable, internally consistent view of the monitoring state at one instant.
 * Every field was read inside the same critical section.
 */
public record MonitoringSnapshot(
        boolean active,
        boolean processing,
        boolean playing,
        boolean userSelectedFrame,
        List<Frame> frames,
        int currentFrameIndex,
        int totalFrames,
        int maxFrames,
        String error,
        long lastProcessedFrame,
        OverlayError overlayError) {

    public MonitoringSnapshot {
        frames = List.copyOf(frames);
    }

    /** Frame under the playback cursor, or {@code null} when nothing is buffered. */
    public Frame currentFrame() {
        return frames.isEmpty() ? null : frames.get(currentFrameIndex);
    }

    /** Whether the frame under the cursor already carries an overlay result. */
    public boolean hasOverlayResult() {
        Frame f = currentFrame();
        return f != null && f.subtitleOverlayPerformed();
    }

    public String summary() {
        return String.format("Monitoring{active=%s, frames=%d/%d, cursor=%d, playing=%s, last=%d, error=%s}",
                active, totalFrames, maxFrames, currentFrameIndex, playing, lastProcessedFrame, error);
    }
}
