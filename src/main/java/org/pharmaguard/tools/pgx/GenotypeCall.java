package org.pharmaguard.tools.pgx;

import htsjdk.variant.variantcontext.Genotype;

import java.util.Optional;

/**
 * The genotype classes the pipeline can reason about. Anything else (no-call, mixed, polyploid oddities) is
 * unclassifiable and the record is discarded.
 */
public enum GenotypeCall {
    HOM_REF,
    HET,
    HOM_VAR;

    /**
     * @return the classification of a diploid genotype, or empty when it cannot be classified.
     */
    public static Optional<GenotypeCall> classify(final Genotype genotype) {
        if (genotype == null || genotype.getPloidy() != 2) {
            return Optional.empty();
        }
        switch (genotype.getType()) {
            case HOM_REF:
                return Optional.of(HOM_REF);
            case HET:
                return Optional.of(HET);
            case HOM_VAR:
                return Optional.of(HOM_VAR);
            default:
                return Optional.empty();
        }
    }

    public boolean carriesAlternate() {
        return this != HOM_REF;
    }
}
