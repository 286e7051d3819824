package org.pharmaguard.tools.pgx.confidence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.pharmaguard.utils.Utils;

/**
 * A scored confidence with every intermediate value kept for audit.
 *
 * @param raw             weighted sum of the components, capped on the fallback path
 * @param penalty         phenoconversion penalty subtracted from {@code raw}
 * @param calibrated      calibrated score reported to the user
 * @param fallbackCapped  true when no rule matched and the fallback cap applied
 */
@JsonPropertyOrder({"components", "raw_score", "phenoconversion_penalty", "calibrated_score", "fallback_capped", "confidence_level"})
public record ConfidenceScore(@JsonProperty("components") ConfidenceComponents components,
                              @JsonProperty("raw_score") double raw,
                              @JsonProperty("phenoconversion_penalty") double penalty,
                              @JsonProperty("calibrated_score") double calibrated,
                              @JsonProperty("fallback_capped") boolean fallbackCapped) {

    public static final double HIGH_CONFIDENCE_THRESHOLD = 0.85;
    public static final double MEDIUM_CONFIDENCE_THRESHOLD = 0.70;

    public ConfidenceScore {
        Utils.nonNull(components, "components");
        Utils.validateArg(raw >= 0.0 && raw <= 1.0, () -> "raw score outside [0,1]: " + raw);
        Utils.validateArg(calibrated >= 0.0 && calibrated <= 1.0, () -> "calibrated score outside [0,1]: " + calibrated);
    }

    /**
     * @return {@code high}, {@code medium} or {@code low} from the calibrated score
     */
    @JsonProperty("confidence_level")
    public String confidenceLevel() {
        return levelOf(calibrated);
    }

    public static String levelOf(final double score) {
        if (score >= HIGH_CONFIDENCE_THRESHOLD) {
            return "high";
        }
        return score >= MEDIUM_CONFIDENCE_THRESHOLD ? "medium" : "low";
    }
}
