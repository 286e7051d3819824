package org.pharmaguard.tools.pgx.catalog;

/**
 * Weights and fixed component values used to score confidence. Weights are non-negative and sum to 1; the
 * loader enforces this.
 */
public record ConfidenceModel(double evidenceWeight,
                              double genotypeWeight,
                              double phenotypeWeight,
                              double ruleCoverageWeight,
                              double noEvidenceScore,
                              double unknownPhenotypeScore,
                              double calledPhenotypeScore,
                              double defaultPhenotypeScore,
                              double noRuleCoverageScore,
                              double fallbackCap) {

    public static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    /**
     * Ceiling on the confidence of a result no risk rule covers, whatever the catalog configures.
     */
    public static final double MAX_FALLBACK_CAP = 0.69;

    /**
     * The configured fallback cap, never above {@link #MAX_FALLBACK_CAP}.
     */
    public double effectiveFallbackCap() {
        return Math.min(fallbackCap, MAX_FALLBACK_CAP);
    }

    public double weightSum() {
        return evidenceWeight + genotypeWeight + phenotypeWeight + ruleCoverageWeight;
    }
}
