package qamonitor.model;

import java.time.Instant;

/**
 * A failed subtitle overlay, scoped to the frame it was requested for.
 */
public record OverlayError(long frameNumber, DetectorVariant variant, String message, Instant timestamp) {

    @Override
    public String toString() {
        return String.format("[%s] frame #%d: %s", variant, frameNumber, message);
    }
}
