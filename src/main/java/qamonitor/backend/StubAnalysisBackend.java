package qamonitor.backend;

import qamonitor.model.Analysis;
import qamonitor.model.AnalysisStatus;
import qamonitor.model.CapturedFrame;
import qamonitor.model.DetectorVariant;
import qamonitor.model.DeviceTarget;
import qamonitor.model.SubtitleDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * No-op backend used when monitor.backend.enabled=false (the default).
 * Never produces frames and classifies everything as {@code ok}, so a monitoring
 * session can run without a capture host.
 */
public class StubAnalysisBackend implements AnalysisBackend, FrameSource {
    private static final Logger log = LoggerFactory.getLogger(StubAnalysisBackend.class);

    @Override
    public List<CapturedFrame> fetchNewFrames(DeviceTarget target, long sinceFrameNumber) {
        log.debug("FrameSource: stub, no frames after #{}", sinceFrameNumber);
        return List.of();
    }

    @Override
    public Analysis analyzeFrame(String framePath, long frameNumber, DeviceTarget target) {
        log.debug("AnalysisBackend: stub, frame #{} is ok", frameNumber);
        return Analysis.empty(AnalysisStatus.OK);
    }

    @Override
    public SubtitleDetection detectSubtitles(DetectorVariant variant, DeviceTarget target,
                                             String imageSourceUrl, boolean extractText) {
        log.debug("AnalysisBackend: stub, no subtitles ({})", variant);
        return new SubtitleDetection(true, false, "", null, List.of(), null);
    }
}
