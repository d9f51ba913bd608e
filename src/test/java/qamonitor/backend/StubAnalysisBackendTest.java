package qamonitor.backend;

import qamonitor.model.Analysis;
import qamonitor.model.AnalysisStatus;
import qamonitor.model.DetectorVariant;
import qamonitor.model.DeviceTarget;
import qamonitor.model.SubtitleDetection;
import qamonitor.monitor.MonitorConfig;
import org.testng.annotations.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link StubAnalysisBackend} and {@link BackendFactory}.
 */
public class StubAnalysisBackendTest {

    private static final DeviceTarget TARGET = new DeviceTarget("localhost", "device1");

    @Test
    public void stub_producesNoFrames() {
        assertThat(new StubAnalysisBackend().fetchNewFrames(TARGET, 0)).isEmpty();
    }

    @Test
    public void stub_classifiesEverythingOk() {
        Analysis a = new StubAnalysisBackend().analyzeFrame("/tmp/f.jpg", 1, TARGET);
        assertThat(a.status()).isEqualTo(AnalysisStatus.OK);
        assertThat(a.hasIssues()).isFalse();
    }

    @Test
    public void stub_detectsNoSubtitles() {
        SubtitleDetection d = new StubAnalysisBackend().detectSubtitles(DetectorVariant.AI, TARGET, "/tmp/f.jpg", true);
        assertThat(d.success()).isTrue();
        assertThat(d.subtitlesDetected()).isFalse();
    }

    @Test
    public void stub_isHealthy() {
        assertThat(new StubAnalysisBackend().isHealthy()).isTrue();
    }

    // ── BackendFactory ────────────────────────────────────────────────────

    @Test
    public void factory_disabled_returnsStubForBothRoles() {
        BackendFactory.Backend backend = BackendFactory.create(new MonitorConfig(new Properties()));

        assertThat(backend.frameSource()).isInstanceOf(StubAnalysisBackend.class);
        assertThat(backend.analysis()).isSameAs(backend.frameSource());
    }

    @Test
    public void factory_enabled_returnsHttpClient() {
        Properties p = new Properties();
        p.setProperty("monitor.backend.enabled", "true");
        p.setProperty("monitor.backend.base.url", "http://capture-host:5109/server/ai-monitoring");

        BackendFactory.Backend backend = BackendFactory.create(new MonitorConfig(p));

        assertThat(backend.frameSource()).isInstanceOf(HttpMonitoringClient.class);
        assertThat(backend.analysis()).isSameAs(backend.frameSource());
    }
}
