package org.pharmaguard.tools.pgx.confidence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.pharmaguard.utils.Utils;

/**
 * The four bounded inputs of the confidence score, each in [0,1].
 */
@JsonPropertyOrder({"evidence", "genotype", "phenotype", "rule_coverage"})
public record ConfidenceComponents(@JsonProperty("evidence") double evidence,
                                   @JsonProperty("genotype") double genotype,
                                   @JsonProperty("phenotype") double phenotype,
                                   @JsonProperty("rule_coverage") double ruleCoverage) {

    public ConfidenceComponents {
        checkBounded("evidence", evidence);
        checkBounded("genotype", genotype);
        checkBounded("phenotype", phenotype);
        checkBounded("rule_coverage", ruleCoverage);
    }

    private static void checkBounded(final String name, final double value) {
        Utils.validateArg(value >= 0.0 && value <= 1.0, () -> name + " component outside [0,1]: " + value);
    }
}
