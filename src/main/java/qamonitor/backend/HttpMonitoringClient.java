package qamonitor.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import qamonitor.model.Analysis;
import qamonitor.model.CapturedFrame;
import qamonitor.model.DetectorVariant;
import qamonitor.model.DeviceTarget;
import qamonitor.model.SubtitleDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * JSON-over-HTTP client for the capture host's monitoring routes.
 *
 * <p>Serves as both the {@link FrameSource} ({@code POST /get-latest-frames}) and the
 * {@link AnalysisBackend} ({@code POST /analyze-frame}, {@code GET /health}). The
 * subtitle detectors ({@code POST /detectSubtitles}, {@code POST /detectSubtitlesAI})
 * live under the host's video verification routes, so they are resolved against a
 * separate base URL. Every response carries a
 * {@code success} flag; {@code false} is turned into an {@link IOException} carrying
 * the backend's {@code error} text.
 */
public class HttpMonitoringClient implements FrameSource, AnalysisBackend {
    private static final Logger log = LoggerFactory.getLogger(HttpMonitoringClient.class);
    private static final MediaType JSON_MT = MediaType.get("application/json; charset=utf-8");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String subtitleBaseUrl;
    private final OkHttpClient http;

    public HttpMonitoringClient(String baseUrl, String subtitleBaseUrl, int timeoutSec) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.subtitleBaseUrl = stripTrailingSlash(subtitleBaseUrl);
        this.http = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(timeoutSec, TimeUnit.SECONDS)
            .writeTimeout(10, TimeUnit.SECONDS)
            .build();
    }

    // ── FrameSource ───────────────────────────────────────────────────────

    @Override
    public List<CapturedFrame> fetchNewFrames(DeviceTarget target, long sinceFrameNumber) throws IOException {
        ObjectNode body = baseBody(target);
        body.put("last_processed_frame", sinceFrameNumber);

        JsonNode resp = post(baseUrl, "get-latest-frames", body);
        JsonNode framesNode = resp.path("frames");
        if (framesNode.isMissingNode() || framesNode.isNull()) {
            return List.of();
        }
        if (!framesNode.isArray()) {
            throw new MalformedPayloadException("'frames' must be an array, got: " + framesNode);
        }

        List<CapturedFrame> frames = new ArrayList<>(framesNode.size());
        for (JsonNode n : framesNode) {
            if (!n.hasNonNull("path") || !n.path("frame_number").isIntegralNumber()) {
                log.warn("Skipping malformed frame entry from {}: {}", target, n);
                continue;
            }
            frames.add(MAPPER.treeToValue(n, CapturedFrame.class));
        }
        log.debug("Fetched {} new frame(s) after #{} from {}", frames.size(), sinceFrameNumber, target);
        return frames;
    }

    // ── AnalysisBackend ───────────────────────────────────────────────────

    @Override
    public Analysis analyzeFrame(String framePath, long frameNumber, DeviceTarget target) throws IOException {
        ObjectNode body = baseBody(target);
        body.put("frame_path", framePath);
        body.put("frame_number", frameNumber);

        JsonNode resp = post(baseUrl, "analyze-frame", body);
        return AnalysisParser.parse(resp.get("analysis"));
    }

    @Override
    public SubtitleDetection detectSubtitles(DetectorVariant variant, DeviceTarget target,
                                             String imageSourceUrl, boolean extractText) throws IOException {
        ObjectNode body = baseBody(target);
        body.put("image_source_url", imageSourceUrl);
        body.put("extract_text", extractText);

        JsonNode resp = post(subtitleBaseUrl, variant.endpoint(), body);
        return MAPPER.treeToValue(resp, SubtitleDetection.class);
    }

    @Override
    public boolean isHealthy() {
        Request request = new Request.Builder().url(baseUrl + "/health").get().build();
        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) return false;
            return MAPPER.readTree(response.body().string()).path("success").asBoolean(false);
        } catch (IOException e) {
            log.warn("Health probe to {} failed: {}", baseUrl, e.getMessage());
            return false;
        }
    }

    // ── HTTP plumbing ─────────────────────────────────────────────────────

    private ObjectNode baseBody(DeviceTarget target) {
        ObjectNode body = MAPPER.createObjectNode();
        body.putObject("host").put("host_id", target.host());
        body.put("device_id", target.deviceId());
        return body;
    }

    private JsonNode post(String base, String route, ObjectNode body) throws IOException {
        Request request = new Request.Builder()
            .url(base + "/" + route)
            .header("Content-Type", "application/json")
            .post(RequestBody.create(MAPPER.writeValueAsString(body), JSON_MT))
            .build();

        try (Response response = http.newCall(request).execute()) {
            String text = response.body() != null ? response.body().string() : "";
            JsonNode node = parseOrNull(text);

            if (!response.isSuccessful()) {
                String detail = node != null && node.hasNonNull("error") ? node.get("error").asText() : text;
                throw new IOException("Monitoring backend /" + route + " returned HTTP "
                        + response.code() + ": " + detail);
            }
            if (node == null || !node.isObject()) {
                throw new MalformedPayloadException("Monitoring backend /" + route + " returned non-JSON body: " + text);
            }
            if (!node.path("success").asBoolean(false)) {
                throw new IOException("Monitoring backend /" + route + " reported failure: "
                        + node.path("error").asText("unknown error"));
            }
            return node;
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static JsonNode parseOrNull(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return MAPPER.readTree(text);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            return null;
        }
    }
}
