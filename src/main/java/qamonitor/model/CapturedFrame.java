package qamonitor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A frame reported by the capture host but not yet analyzed.
 *
 * @param path        image location on the capture host
 * @param frameNumber capture sequence number
 * @param timestamp   capture time in epoch seconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CapturedFrame(
        @JsonProperty("path") String path,
        @JsonProperty("frame_number") long frameNumber,
        @JsonProperty("timestamp") long timestamp) {
}
