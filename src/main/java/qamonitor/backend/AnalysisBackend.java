package qamonitor.backend;

import qamonitor.model.Analysis;
import qamonitor.model.DetectorVariant;
import qamonitor.model.DeviceTarget;
import qamonitor.model.SubtitleDetection;

import java.io.IOException;

/**
 * External frame classifier. Detection itself happens on the backend; this
 * interface only describes the request/response exchange.
 */
public interface AnalysisBackend {

    /**
     * Runs blackscreen, freeze, subtitle, error and language detection on one frame.
     *
     * @return a validated analysis
     * @throws MalformedPayloadException if the backend answered with an unusable payload
     * @throws IOException on transport failure or a backend-reported error
     */
    Analysis analyzeFrame(String framePath, long frameNumber, DeviceTarget target) throws IOException;

    /**
     * Runs the subtitle-only detector of the given variant on one image.
     *
     * @throws IOException on transport failure
     */
    SubtitleDetection detectSubtitles(DetectorVariant variant, DeviceTarget target,
                                      String imageSourceUrl, boolean extractText) throws IOException;

    /** Whether the backend answers its health probe. */
    default boolean isHealthy() {
        return true;
    }
}
