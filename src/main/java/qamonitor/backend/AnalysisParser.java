package qamonitor.backend;

import com.fasterxml.jackson.databind.JsonNode;
import qamonitor.model.Analysis;
import qamonitor.model.AnalysisStatus;

/**
 * Validates the backend's {@code analysis} object and turns it into an {@link Analysis}.
 *
 * <p>{@code status} is mandatory. Each sub-result may be absent (it then defaults to
 * "not detected"), but when present it must be an object whose fields have the
 * expected JSON types. Anything else is rejected with a
 * {@link MalformedPayloadException} instead of being passed on half-typed.
 */
public final class AnalysisParser {

    private AnalysisParser() {}

    public static Analysis parse(JsonNode node) throws MalformedPayloadException {
        if (node == null || !node.isObject()) {
            throw new MalformedPayloadException("analysis must be a JSON object, got: " + node);
        }

        JsonNode statusNode = node.get("status");
        if (statusNode == null || !statusNode.isTextual()) {
            throw new MalformedPayloadException("analysis.status missing or not a string");
        }
        AnalysisStatus status;
        try {
            status = AnalysisStatus.fromWire(statusNode.asText());
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException(e.getMessage(), e);
        }

        Analysis.Blackscreen blackscreen = Analysis.Blackscreen.NONE;
        JsonNode b = section(node, "blackscreen");
        if (b != null) {
            blackscreen = new Analysis.Blackscreen(
                    bool(b, "blackscreen.detected"),
                    integer(b, "blackscreen.consecutiveFrames"),
                    number(b, "blackscreen.confidence"));
        }

        Analysis.Freeze freeze = Analysis.Freeze.NONE;
        JsonNode f = section(node, "freeze");
        if (f != null) {
            freeze = new Analysis.Freeze(
                    bool(f, "freeze.detected"),
                    integer(f, "freeze.consecutiveFrames"));
        }

        Analysis.Subtitles subtitles = Analysis.Subtitles.NONE;
        JsonNode s = section(node, "subtitles");
        if (s != null) {
            String text = text(s, "subtitles.text");
            String truncated = s.hasNonNull("truncatedText") ? text(s, "subtitles.truncatedText") : null;
            subtitles = new Analysis.Subtitles(bool(s, "subtitles.detected"), text, truncated);
        }

        Analysis.Errors errors = Analysis.Errors.NONE;
        JsonNode e = section(node, "errors");
        if (e != null) {
            errors = new Analysis.Errors(
                    bool(e, "errors.detected"),
                    text(e, "errors.errorType"),
                    text(e, "errors.errorText"));
        }

        Analysis.Language language = Analysis.Language.UNKNOWN;
        JsonNode l = section(node, "language");
        if (l != null) {
            language = new Analysis.Language(text(l, "language.language"), number(l, "language.confidence"));
        }

        return new Analysis(status, blackscreen, freeze, subtitles, errors, language);
    }

    // ── Field helpers ─────────────────────────────────────────────────────

    private static JsonNode section(JsonNode parent, String name) throws MalformedPayloadException {
        JsonNode n = parent.get(name);
        if (n == null || n.isNull()) return null;
        if (!n.isObject()) {
            throw new MalformedPayloadException("analysis." + name + " must be an object");
        }
        return n;
    }

    private static boolean bool(JsonNode parent, String path) throws MalformedPayloadException {
        JsonNode n = parent.get(leaf(path));
        if (n == null || n.isNull()) return false;
        if (!n.isBoolean()) {
            throw new MalformedPayloadException("analysis." + path + " must be a boolean, got: " + n);
        }
        return n.booleanValue();
    }

    private static int integer(JsonNode parent, String path) throws MalformedPayloadException {
        JsonNode n = parent.get(leaf(path));
        if (n == null || n.isNull()) return 0;
        if (!n.isIntegralNumber()) {
            throw new MalformedPayloadException("analysis." + path + " must be an integer, got: " + n);
        }
        if (!n.canConvertToInt()) {
            throw new MalformedPayloadException("analysis." + path + " is out of int range: " + n);
        }
        return n.intValue();
    }

    private static double number(JsonNode parent, String path) throws MalformedPayloadException {
        JsonNode n = parent.get(leaf(path));
        if (n == null || n.isNull()) return 0.0;
        if (!n.isNumber()) {
            throw new MalformedPayloadException("analysis." + path + " must be a number, got: " + n);
        }
        return n.doubleValue();
    }

    private static String text(JsonNode parent, String path) throws MalformedPayloadException {
        JsonNode n = parent.get(leaf(path));
        if (n == null || n.isNull()) return "";
        if (!n.isTextual()) {
            throw new MalformedPayloadException("analysis." + path + " must be a string, got: " + n);
        }
        return n.asText();
    }

    private static String leaf(String path) {
        return path.substring(path.indexOf('.') + 1);
    }
}
