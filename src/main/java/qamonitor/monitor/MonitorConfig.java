package qamonitor.monitor;

import qamonitor.buffer.FrameBuffer;
import qamonitor.model.DeviceTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed monitoring
 * configuration values with sensible defaults.
 *
 * <p>All values can be overridden by placing a {@code config.local.properties}
 * file on the classpath (higher priority, not committed to VCS).
 */
public class MonitorConfig {

    private static final Logger log = LoggerFactory.getLogger(MonitorConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    private static final String KEY_MAX_FRAMES        = "monitor.max.frames";
    private static final String KEY_INGEST_INTERVAL   = "monitor.ingest.interval.ms";
    private static final String KEY_PLAYBACK_INTERVAL = "monitor.playback.interval.ms";
    private static final String KEY_BACKEND_ENABLED   = "monitor.backend.enabled";
    private static final String KEY_BACKEND_URL       = "monitor.backend.base.url";
    private static final String KEY_SUBTITLE_URL      = "monitor.subtitle.base.url";
    private static final String KEY_BACKEND_TIMEOUT   = "monitor.backend.timeout.sec";
    private static final String KEY_HOST_NAME         = "monitor.host.name";
    private static final String KEY_DEVICE_ID         = "monitor.device.id";

    // Defaults
    private static final int     DEFAULT_MAX_FRAMES        = FrameBuffer.DEFAULT_MAX_FRAMES;
    private static final long    DEFAULT_INGEST_INTERVAL   = 1000L;
    private static final long    DEFAULT_PLAYBACK_INTERVAL = 1000L;
    private static final boolean DEFAULT_BACKEND_ENABLED   = false;
    private static final String  DEFAULT_BACKEND_URL       = "http://localhost:5109/server/ai-monitoring";
    private static final String  DEFAULT_SUBTITLE_URL      = "http://localhost:5109/server/verification/video";
    private static final int     DEFAULT_BACKEND_TIMEOUT   = 30;
    private static final String  DEFAULT_HOST_NAME         = "localhost";
    private static final String  DEFAULT_DEVICE_ID         = "device1";

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code config.local.properties} values override {@code config.properties}.
     *
     * @throws MonitoringException if the base config.properties cannot be loaded
     */
    public MonitorConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new MonitoringException("Cannot load " + CONFIG_FILE, e);
        }

        try (InputStream local = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {} — using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /**
     * Builds a configuration from an already-populated {@link Properties}
     * instance (tests, or a host application that owns its own settings).
     */
    public MonitorConfig(Properties props) {
        this.props = props;
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    /** Capacity of the frame window (default: 180). Values below 1 fall back to the default. */
    public int getMaxFrames() {
        int v = getInt(KEY_MAX_FRAMES, DEFAULT_MAX_FRAMES);
        if (v < 1) {
            log.warn("'{}' must be positive, got {} — using default {}", KEY_MAX_FRAMES, v, DEFAULT_MAX_FRAMES);
            return DEFAULT_MAX_FRAMES;
        }
        return v;
    }

    /** Period between ingestion ticks in milliseconds (default: 1000). Values below 1 fall back to the default. */
    public long getIngestIntervalMs() {
        return getPositiveLong(KEY_INGEST_INTERVAL, DEFAULT_INGEST_INTERVAL);
    }

    /** Period between playback cursor advances in milliseconds (default: 1000). Values below 1 fall back to the default. */
    public long getPlaybackIntervalMs() {
        return getPositiveLong(KEY_PLAYBACK_INTERVAL, DEFAULT_PLAYBACK_INTERVAL);
    }

    /** Whether to talk to a real capture/analysis host (default: false → stub backend). */
    public boolean isBackendEnabled() {
        return getBool(KEY_BACKEND_ENABLED, DEFAULT_BACKEND_ENABLED);
    }

    /** Base URL of the monitoring routes on the capture host. */
    public String getBackendBaseUrl() {
        return props.getProperty(KEY_BACKEND_URL, DEFAULT_BACKEND_URL).trim();
    }

    /** Base URL of the video verification routes serving both subtitle detectors. */
    public String getSubtitleBaseUrl() {
        return props.getProperty(KEY_SUBTITLE_URL, DEFAULT_SUBTITLE_URL).trim();
    }

    /** HTTP read timeout for backend calls in seconds (default: 30). */
    public int getBackendTimeoutSec() {
        return getInt(KEY_BACKEND_TIMEOUT, DEFAULT_BACKEND_TIMEOUT);
    }

    /** The capture host and device to monitor. */
    public DeviceTarget getTarget() {
        return new DeviceTarget(
                props.getProperty(KEY_HOST_NAME, DEFAULT_HOST_NAME).trim(),
                props.getProperty(KEY_DEVICE_ID, DEFAULT_DEVICE_ID).trim());
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}' — using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}' — using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getPositiveLong(String key, long defaultValue) {
        long v = getLong(key, defaultValue);
        if (v < 1) {
            log.warn("'{}' must be positive, got {} — using default {}", key, v, defaultValue);
            return defaultValue;
        }
        return v;
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
