package qamonitor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response of the backend's subtitle detectors (both variants share it).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubtitleDetection(
        @JsonProperty("success") boolean success,
        @JsonProperty("subtitles_detected") boolean subtitlesDetected,
        @JsonProperty("combined_extracted_text") String combinedExtractedText,
        @JsonProperty("detected_language") String detectedLanguage,
        @JsonProperty("results") List<Result> results,
        @JsonProperty("error") String error) {

    public SubtitleDetection {
        results = results == null ? List.of() : List.copyOf(results);
    }

    /** Per-region detector output; only the first entry is consulted. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(
            @JsonProperty("confidence") Double confidence,
            @JsonProperty("extracted_text") String extractedText,
            @JsonProperty("detected_language") String detectedLanguage) {
    }

    private Result first() {
        return results.isEmpty() ? null : results.get(0);
    }

    /** Combined text, falling back to the first result's text, then to "". */
    public String effectiveText() {
        if (combinedExtractedText != null && !combinedExtractedText.isEmpty()) {
            return combinedExtractedText;
        }
        Result r = first();
        return r != null && r.extractedText() != null ? r.extractedText() : "";
    }

    /** Detected language, falling back to the first result's, then to "unknown". */
    public String effectiveLanguage() {
        if (detectedLanguage != null && !detectedLanguage.isBlank()) {
            return detectedLanguage;
        }
        Result r = first();
        if (r != null && r.detectedLanguage() != null && !r.detectedLanguage().isBlank()) {
            return r.detectedLanguage();
        }
        return Analysis.Language.UNKNOWN_CODE;
    }

    /** First result's confidence when reported and non-zero, otherwise 0.9 / 0.1 by outcome. */
    public double effectiveConfidence() {
        Result r = first();
        if (r != null && r.confidence() != null && r.confidence() != 0.0) {
            return r.confidence();
        }
        return subtitlesDetected ? 0.9 : 0.1;
    }
}
