package org.pharmaguard.tools.pgx;

import org.pharmaguard.utils.Utils;

import java.util.OptionalDouble;

/**
 * The genetic phenotype called from a diplotype.
 *
 * @param activityScore summed activity score; {@code NaN} when the phenotype is Unknown
 * @param defaulted     true when the diplotype was the wild-type default (no supporting variant)
 */
public record PhenotypeCall(String gene, Diplotype diplotype, Phenotype phenotype, double activityScore, boolean defaulted) {

    public PhenotypeCall {
        Utils.nonNull(gene, "gene");
        Utils.nonNull(phenotype, "phenotype");
    }

    public static PhenotypeCall unknown(final String gene, final Diplotype diplotype) {
        return new PhenotypeCall(gene, diplotype, Phenotype.UNKNOWN, Double.NaN, false);
    }

    public boolean isUnknown() {
        return phenotype == Phenotype.UNKNOWN;
    }

    public OptionalDouble getActivityScore() {
        return Double.isNaN(activityScore) ? OptionalDouble.empty() : OptionalDouble.of(activityScore);
    }
}
