package qamonitor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of analyzing one captured frame.
 *
 * <p>The structure is closed: every sub-result is always present. Payloads coming
 * from the backend are validated by {@code qamonitor.backend.AnalysisParser} before
 * an instance is built, so nothing loosely typed reaches the frame buffer.
 *
 * <p>Instances are immutable; the {@code with*} methods return copies.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Analysis(
        @JsonProperty("status") AnalysisStatus status,
        @JsonProperty("blackscreen") Blackscreen blackscreen,
        @JsonProperty("freeze") Freeze freeze,
        @JsonProperty("subtitles") Subtitles subtitles,
        @JsonProperty("errors") Errors errors,
        @JsonProperty("language") Language language) {

    /** Subtitle text longer than this is shortened for display. */
    public static final int MAX_SUBTITLE_DISPLAY_LENGTH = 10;

    public Analysis {
        if (status == null)      status      = AnalysisStatus.PROCESSING;
        if (blackscreen == null) blackscreen = Blackscreen.NONE;
        if (freeze == null)      freeze      = Freeze.NONE;
        if (subtitles == null)   subtitles   = Subtitles.NONE;
        if (errors == null)      errors      = Errors.NONE;
        if (language == null)    language    = Language.UNKNOWN;
    }

    /** An analysis with every detector negative and the given status. */
    public static Analysis empty(AnalysisStatus status) {
        return new Analysis(status, null, null, null, null, null);
    }

    /** True if any detector that flags the frame as an issue fired. */
    public boolean hasIssues() {
        return blackscreen.detected() || freeze.detected() || errors.detected();
    }

    public Analysis withSubtitles(Subtitles s) {
        return new Analysis(status, blackscreen, freeze, s, errors, language);
    }

    public Analysis withLanguage(Language l) {
        return new Analysis(status, blackscreen, freeze, subtitles, errors, l);
    }

    public Analysis withStatus(AnalysisStatus s) {
        return new Analysis(s, blackscreen, freeze, subtitles, errors, language);
    }

    // ── Sub-results ───────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Blackscreen(
            @JsonProperty("detected") boolean detected,
            @JsonProperty("consecutiveFrames") int consecutiveFrames,
            @JsonProperty("confidence") double confidence) {
        public static final Blackscreen NONE = new Blackscreen(false, 0, 0.0);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Freeze(
            @JsonProperty("detected") boolean detected,
            @JsonProperty("consecutiveFrames") int consecutiveFrames) {
        public static final Freeze NONE = new Freeze(false, 0);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Subtitles(
            @JsonProperty("detected") boolean detected,
            @JsonProperty("text") String text,
            @JsonProperty("truncatedText") String truncatedText) {

        public static final Subtitles NONE = new Subtitles(false, "", "None");

        public Subtitles {
            if (text == null) text = "";
            if (truncatedText == null) truncatedText = truncate(text);
        }

        /** Builds a subtitle result whose display text is derived from {@code text}. */
        public static Subtitles of(boolean detected, String text) {
            String t = text == null ? "" : text.trim();
            return new Subtitles(detected, t, truncate(t));
        }

        /** "None" for empty text, otherwise at most ten characters followed by "...". */
        public static String truncate(String text) {
            if (text == null || text.isEmpty()) return "None";
            if (text.length() > MAX_SUBTITLE_DISPLAY_LENGTH) {
                return text.substring(0, MAX_SUBTITLE_DISPLAY_LENGTH) + "...";
            }
            return text;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Errors(
            @JsonProperty("detected") boolean detected,
            @JsonProperty("errorType") String errorType,
            @JsonProperty("errorText") String errorText) {

        public static final Errors NONE = new Errors(false, "", "");

        public Errors {
            if (errorType == null) errorType = "";
            if (errorText == null) errorText = "";
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Language(
            @JsonProperty("language") String language,
            @JsonProperty("confidence") double confidence) {

        public static final String UNKNOWN_CODE = "unknown";
        public static final Language UNKNOWN = new Language(UNKNOWN_CODE, 0.0);

        public Language {
            if (language == null || language.isBlank()) language = UNKNOWN_CODE;
        }

        public boolean isKnown() {
            return !UNKNOWN_CODE.equals(language);
        }
    }
}
