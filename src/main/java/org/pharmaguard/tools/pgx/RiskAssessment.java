package org.pharmaguard.tools.pgx;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.pharmaguard.utils.Utils;

/**
 * Risk label, calibrated confidence and severity for one drug.
 */
@JsonPropertyOrder({"risk_label", "confidence_score", "severity"})
public record RiskAssessment(@JsonProperty("risk_label") RiskLabel riskLabel,
                             @JsonProperty("confidence_score") double confidenceScore,
                             @JsonProperty("severity") Severity severity) {

    public RiskAssessment {
        Utils.nonNull(riskLabel, "risk label");
        Utils.nonNull(severity, "severity");
        Utils.validateArg(confidenceScore >= 0.0 && confidenceScore <= 1.0, () -> "confidence outside [0,1]: " + confidenceScore);
    }
}
