package qamonitor.backend;

import qamonitor.model.CapturedFrame;
import qamonitor.model.DeviceTarget;

import java.io.IOException;
import java.util.List;

/**
 * External producer of captured device-screen frames.
 */
public interface FrameSource {

    /**
     * Lists frames captured after the given low-water mark.
     *
     * @param target            capture host and device
     * @param sinceFrameNumber  highest frame number already ingested
     * @return frames newer than {@code sinceFrameNumber}; empty if none
     * @throws IOException if the capture host cannot be reached or reports a failure
     */
    List<CapturedFrame> fetchNewFrames(DeviceTarget target, long sinceFrameNumber) throws IOException;
}
