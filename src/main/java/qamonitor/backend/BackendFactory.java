package qamonitor.backend;

import qamonitor.monitor.MonitorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the frame source and analysis backend based on config.
 */
public class BackendFactory {
    private static final Logger log = LoggerFactory.getLogger(BackendFactory.class);

    private BackendFactory() {}

    /** The HTTP client when monitor.backend.enabled=true, otherwise the stub. */
    public static Backend create(MonitorConfig config) {
        if (!config.isBackendEnabled()) {
            log.info("Monitoring backend disabled (monitor.backend.enabled=false) — using StubAnalysisBackend");
            StubAnalysisBackend stub = new StubAnalysisBackend();
            return new Backend(stub, stub);
        }

        log.info("Monitoring backend enabled — creating HttpMonitoringClient for {}", config.getBackendBaseUrl());
        HttpMonitoringClient client = new HttpMonitoringClient(
                config.getBackendBaseUrl(), config.getSubtitleBaseUrl(), config.getBackendTimeoutSec());
        return new Backend(client, client);
    }

    /** The pair of collaborators a monitoring session consumes. */
    public record Backend(FrameSource frameSource, AnalysisBackend analysis) {
    }
}
