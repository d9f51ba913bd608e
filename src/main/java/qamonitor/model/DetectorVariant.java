package qamonitor.model;

/**
 * The two interchangeable subtitle detectors offered by the analysis backend.
 * Both accept the same request and return the same response shape.
 */
public enum DetectorVariant {
    /** OCR-style detector. */
    STANDARD("detectSubtitles"),
    /** Vision-model detector. */
    AI("detectSubtitlesAI");

    private final String endpoint;

    DetectorVariant(String endpoint) {
        this.endpoint = endpoint;
    }

    /** Path segment of the backend route serving this detector. */
    public String endpoint() {
        return endpoint;
    }
}
