package qamonitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One captured device-screen image together with its analysis.
 *
 * <p>Immutable. {@link #withOverlay(Analysis)} produces the copy stored after an
 * on-demand subtitle overlay replaced the analysis.
 */
public record Frame(
        @JsonProperty("frameNumber") long frameNumber,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("imagePath") String imagePath,
        @JsonProperty("analysis") Analysis analysis,
        @JsonProperty("processed") boolean processed,
        @JsonProperty("subtitleOverlayPerformed") boolean subtitleOverlayPerformed) {

    public Frame {
        Objects.requireNonNull(imagePath, "imagePath");
        Objects.requireNonNull(analysis, "analysis");
    }

    /** A freshly ingested, fully analyzed frame. */
    public static Frame analyzed(CapturedFrame captured, Analysis analysis) {
        return new Frame(captured.frameNumber(), captured.timestamp(), captured.path(),
                analysis, true, false);
    }

    /** Same frame with {@code analysis} replaced and the overlay marker set. */
    public Frame withOverlay(Analysis replacement) {
        return new Frame(frameNumber, timestamp, imagePath, replacement, processed, true);
    }

    @Override
    public String toString() {
        return String.format("Frame{#%d, status=%s, overlay=%s}",
                frameNumber, analysis.status().wire(), subtitleOverlayPerformed);
    }
}
