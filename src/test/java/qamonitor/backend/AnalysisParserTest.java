package qamonitor.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import qamonitor.model.Analysis;
import qamonitor.model.AnalysisStatus;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisParser}.
 */
public class AnalysisParserTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String s) throws Exception {
        return MAPPER.readTree(s);
    }

    @Test
    public void parse_fullPayload() throws Exception {
        Analysis a = AnalysisParser.parse(json("{"
                + "\"status\":\"issue\","
                + "\"blackscreen\":{\"detected\":true,\"consecutiveFrames\":3,\"confidence\":0.98},"
                + "\"freeze\":{\"detected\":false,\"consecutiveFrames\":0},"
                + "\"subtitles\":{\"detected\":true,\"text\":\"Welcome back, viewer\"},"
                + "\"errors\":{\"detected\":false,\"errorType\":\"\",\"errorText\":\"\"},"
                + "\"language\":{\"language\":\"en\",\"confidence\":0.88}"
                + "}"));

        assertThat(a.status()).isEqualTo(AnalysisStatus.ISSUE);
        assertThat(a.blackscreen().consecutiveFrames()).isEqualTo(3);
        assertThat(a.blackscreen().confidence()).isEqualTo(0.98);
        assertThat(a.subtitles().text()).isEqualTo("Welcome back, viewer");
        assertThat(a.subtitles().truncatedText()).isEqualTo("Welcome ba...");
        assertThat(a.language().language()).isEqualTo("en");
        assertThat(a.hasIssues()).isTrue();
    }

    @Test
    public void parse_missingSections_defaultToNotDetected() throws Exception {
        Analysis a = AnalysisParser.parse(json("{\"status\":\"ok\"}"));

        assertThat(a.status()).isEqualTo(AnalysisStatus.OK);
        assertThat(a.freeze().detected()).isFalse();
        assertThat(a.subtitles()).isEqualTo(Analysis.Subtitles.NONE);
        assertThat(a.language()).isEqualTo(Analysis.Language.UNKNOWN);
    }

    @Test
    public void parse_backendTruncatedText_isKept() throws Exception {
        Analysis a = AnalysisParser.parse(json(
                "{\"status\":\"ok\",\"subtitles\":{\"detected\":true,\"text\":\"abc\",\"truncatedText\":\"a...\"}}"));

        assertThat(a.subtitles().truncatedText()).isEqualTo("a...");
    }

    @Test
    public void parse_missingStatus_isRejected() {
        assertThatThrownBy(() -> AnalysisParser.parse(json("{\"freeze\":{\"detected\":true}}")))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("status");
    }

    @Test
    public void parse_unknownStatus_isRejected() {
        assertThatThrownBy(() -> AnalysisParser.parse(json("{\"status\":\"great\"}")))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("great");
    }

    @Test
    public void parse_wronglyTypedField_isRejected() {
        assertThatThrownBy(() -> AnalysisParser.parse(json(
                "{\"status\":\"ok\",\"blackscreen\":{\"detected\":\"yes\"}}")))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("blackscreen.detected");
    }

    @Test
    public void parse_consecutiveFramesBeyondIntRange_isRejected() {
        assertThatThrownBy(() -> AnalysisParser.parse(json(
                "{\"status\":\"error\",\"freeze\":{\"detected\":true,\"consecutiveFrames\":4294967296}}")))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("freeze.consecutiveFrames");
    }

    @Test
    public void parse_sectionNotAnObject_isRejected() {
        assertThatThrownBy(() -> AnalysisParser.parse(json("{\"status\":\"ok\",\"freeze\":true}")))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("freeze");
    }

    @Test
    public void parse_null_isRejected() {
        assertThatThrownBy(() -> AnalysisParser.parse(null))
                .isInstanceOf(MalformedPayloadException.class);
    }
}
