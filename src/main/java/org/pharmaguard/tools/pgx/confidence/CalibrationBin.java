package org.pharmaguard.tools.pgx.confidence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.pharmaguard.utils.Utils;

/**
 * One bin of a piecewise-constant calibration map: raw scores in {@code [lower, upper)} map to {@code calibrated}.
 * The last bin of a map also includes its upper bound.
 */
@JsonPropertyOrder({"lower", "upper", "calibrated"})
public record CalibrationBin(@JsonProperty("lower") double lower,
                             @JsonProperty("upper") double upper,
                             @JsonProperty("calibrated") double calibrated) {

    public CalibrationBin {
        Utils.validateArg(lower >= 0.0 && upper <= 1.0 && lower < upper,
                () -> String.format("calibration bin [%s, %s) must be a non-empty interval inside [0, 1]", lower, upper));
        Utils.validateArg(calibrated >= 0.0 && calibrated <= 1.0,
                () -> String.format("calibrated value %s must lie in [0, 1]", calibrated));
    }

    public boolean contains(final double score, final boolean includeUpper) {
        return score >= lower && (score < upper || (includeUpper && score <= upper));
    }
}
