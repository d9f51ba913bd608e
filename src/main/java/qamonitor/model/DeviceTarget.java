package qamonitor.model;

import java.util.Objects;

/**
 * Identifies the capture host and the device on it whose screen is being monitored.
 */
public record DeviceTarget(String host, String deviceId) {

    public DeviceTarget {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(deviceId, "deviceId");
    }

    @Override
    public String toString() {
        return host + "/" + deviceId;
    }
}
