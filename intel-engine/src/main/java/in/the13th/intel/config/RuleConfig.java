package in.the13th.intel.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rules controlling the trigger decision.
 *
 * Replaced wholesale on update, never mutated field by field. New parameters are added
 * here together with a bump of {@link #SCHEMA_VERSION} and a migration step in
 * {@code RuleConfigService}.
 */
public record RuleConfig(
    @JsonProperty("score_threshold")
    double scoreThreshold          // trigger when score >= threshold, within [0, 1]
) {
    public static final int SCHEMA_VERSION = 1;

    public static final String SCORE_THRESHOLD = "score_threshold";

    public boolean isValid() {
        return !Double.isNaN(scoreThreshold)
            && scoreThreshold >= 0.0
            && scoreThreshold <= 1.0;
    }
}
