package qamonitor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall verdict of one frame analysis as reported by the analysis backend.
 */
public enum AnalysisStatus {
    OK("ok"),
    ISSUE("issue"),
    PROCESSING("processing"),
    ERROR("error");

    private final String wire;

    AnalysisStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /**
     * Parses the backend's lowercase status token.
     *
     * @throws IllegalArgumentException for anything outside the four known values
     */
    @JsonCreator
    public static AnalysisStatus fromWire(String s) {
        if (s == null) {
            throw new IllegalArgumentException("Analysis status is missing");
        }
        return switch (s.trim().toLowerCase()) {
            case "ok"         -> OK;
            case "issue"      -> ISSUE;
            case "processing" -> PROCESSING;
            case "error"      -> ERROR;
            default -> throw new IllegalArgumentException("Unknown analysis status: '" + s + "'");
        };
    }
}
