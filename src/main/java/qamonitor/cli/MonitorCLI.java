package qamonitor.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import qamonitor.backend.BackendFactory;
import qamonitor.model.Frame;
import qamonitor.model.MonitoringSnapshot;
import qamonitor.monitor.DeviceControlSignal;
import qamonitor.monitor.LiveMonitor;
import qamonitor.monitor.MonitorConfig;
import qamonitor.trend.ErrorTrend;
import qamonitor.trend.TrendAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Properties;
import java.util.concurrent.Callable;

/**
 * Command-line entry point for headless monitoring runs.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code qamonitor run}: monitor a device for a fixed duration and print the frame window</li>
 *   <li>{@code qamonitor health}: probe the configured analysis backend</li>
 *   <li>{@code qamonitor version}: print build version</li>
 * </ul>
 */
@Command(
        name        = "qamonitor",
        description = "Live frame monitoring for remotely controlled test devices",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                MonitorCLI.RunCommand.class,
                MonitorCLI.HealthCommand.class,
                MonitorCLI.VersionCommand.class
        }
)
public class MonitorCLI implements Callable<Integer> {

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(String[] args) {
        int exit = new CommandLine(new MonitorCLI()).execute(args);
        System.exit(exit);
    }

    /** Config from the classpath with command-line overrides applied on top. */
    static MonitorConfig configWithOverrides(String backendUrl, String host, String device) {
        MonitorConfig base = new MonitorConfig();
        if (backendUrl == null && host == null && device == null) {
            return base;
        }
        Properties p = new Properties();
        p.setProperty("monitor.max.frames", String.valueOf(base.getMaxFrames()));
        p.setProperty("monitor.ingest.interval.ms", String.valueOf(base.getIngestIntervalMs()));
        p.setProperty("monitor.playback.interval.ms", String.valueOf(base.getPlaybackIntervalMs()));
        p.setProperty("monitor.backend.timeout.sec", String.valueOf(base.getBackendTimeoutSec()));
        p.setProperty("monitor.backend.enabled", String.valueOf(backendUrl != null || base.isBackendEnabled()));
        p.setProperty("monitor.backend.base.url", backendUrl != null ? backendUrl : base.getBackendBaseUrl());
        p.setProperty("monitor.subtitle.base.url", base.getSubtitleBaseUrl());
        p.setProperty("monitor.host.name", host != null ? host : base.getTarget().host());
        p.setProperty("monitor.device.id", device != null ? device : base.getTarget().deviceId());
        return new MonitorConfig(p);
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /**
     * Takes device control, monitors for {@code --duration} seconds, then prints the
     * buffered frames and the error trend.
     */
    @Command(
            name        = "run",
            description = "Monitor a device for a fixed duration",
            mixinStandardHelpOptions = true
    )
    static class RunCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

        @Option(
                names       = {"-d", "--duration"},
                description = "Seconds to monitor (default: 30)",
                defaultValue = "30"
        )
        int durationSec;

        @Option(
                names       = {"-u", "--backend-url"},
                description = "Base URL of the monitoring routes (enables the HTTP backend)"
        )
        String backendUrl;

        @Option(names = {"--host"}, description = "Capture host name")
        String host;

        @Option(names = {"--device"}, description = "Device id on the capture host")
        String device;

        @Option(names = {"--play"}, description = "Rewind to the first frame and play once frames arrive")
        boolean play;

        @Option(names = {"--json"}, description = "Print the final monitoring snapshot as JSON")
        boolean json;

        @Override
        public Integer call() throws Exception {
            MonitorConfig config = configWithOverrides(backendUrl, host, device);
            DeviceControlSignal control = new DeviceControlSignal(true);

            try (LiveMonitor monitor = LiveMonitor.fromConfig(config, control)) {
                if (!monitor.start()) {
                    System.err.println("Monitoring did not start: " + monitor.snapshot().error());
                    return 1;
                }
                System.out.printf("Monitoring %s for %d s...%n", config.getTarget(), durationSec);

                boolean playbackStarted = false;
                for (int i = 0; i < durationSec; i++) {
                    try {
                        Thread.sleep(1000);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                    MonitoringSnapshot s = monitor.snapshot();
                    if (play && !playbackStarted && s.totalFrames() > 1) {
                        monitor.playback().goToFirst();
                        playbackStarted = monitor.playback().play();
                    }
                    log.info(s.summary());
                }

                MonitoringSnapshot last = monitor.snapshot();
                control.set(false);

                if (json) {
                    ObjectMapper mapper = new ObjectMapper()
                            .registerModule(new JavaTimeModule())
                            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
                    System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(last));
                    return 0;
                }

                System.out.printf("%nBuffered %d frame(s), last processed #%d%n",
                        last.totalFrames(), last.lastProcessedFrame());
                for (Frame f : last.frames()) {
                    System.out.printf("  #%-6d %-10s black=%-5s freeze=%-5s subs=%s%n",
                            f.frameNumber(), f.analysis().status().wire(),
                            f.analysis().blackscreen().detected(),
                            f.analysis().freeze().detected(),
                            f.analysis().subtitles().truncatedText());
                }
                ErrorTrend trend = TrendAnalyzer.errorTrend(last.frames());
                if (trend != null) {
                    System.out.printf("Error trend: blackscreen=%d freeze=%d warning=%s error=%s%n",
                            trend.blackscreenConsecutive(), trend.freezeConsecutive(),
                            trend.hasWarning(), trend.hasError());
                }
                if (last.error() != null) {
                    System.out.println("Last error: " + last.error());
                }
                return 0;
            }
        }
    }

    /** Probes {@code GET /health} on the configured backend. */
    @Command(
            name        = "health",
            description = "Check that the analysis backend is reachable",
            mixinStandardHelpOptions = true
    )
    static class HealthCommand implements Callable<Integer> {

        @Option(
                names       = {"-u", "--backend-url"},
                description = "Base URL of the monitoring routes"
        )
        String backendUrl;

        @Override
        public Integer call() {
            MonitorConfig config = configWithOverrides(backendUrl, null, null);
            boolean healthy = BackendFactory.create(config).analysis().isHealthy();
            System.out.println(healthy ? "Backend healthy" : "Backend NOT reachable");
            return healthy ? 0 : 1;
        }
    }

    @Command(
            name        = "version",
            description = "Print build version",
            mixinStandardHelpOptions = true
    )
    static class VersionCommand implements Callable<Integer> {

        @Override
        public Integer call() {
            System.out.println("QA Frame Monitor 1.0.0-SNAPSHOT");
            System.out.println("OkHttp 4.12 | Jackson 2.16 | picocli 4.7");
            return 0;
        }
    }
}
