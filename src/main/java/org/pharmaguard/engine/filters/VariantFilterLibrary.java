package org.pharmaguard.engine.filters;

import htsjdk.variant.variantcontext.Genotype;
import htsjdk.variant.variantcontext.VariantContext;
import org.pharmaguard.tools.pgx.GenotypeCall;
import org.pharmaguard.utils.Utils;

/**
 * Standard filters for pharmacogenomic VCF records.
 */
public final class VariantFilterLibrary {

    private VariantFilterLibrary() {}

    public static final VariantFilter CLASSIFIABLE_GENOTYPE = new ClassifiableGenotypeVariantFilter();

    /**
     * Keeps records whose QUAL is at least the threshold. A missing QUAL counts as 0.
     */
    public static final class MinimumQualityVariantFilter implements VariantFilter {
        private final double minimumQuality;

        public MinimumQualityVariantFilter(final double minimumQuality) {
            Utils.validateArg(minimumQuality >= 0, "minimum quality must be non-negative");
            this.minimumQuality = minimumQuality;
        }

        public double getMinimumQuality() {
            return minimumQuality;
        }

        @Override
        public boolean test(final VariantContext variant) {
            return qualityOf(variant) >= minimumQuality;
        }
    }

    /**
     * Keeps records whose first sample is a diploid hom-ref, het or hom-var call.
     */
    public static final class ClassifiableGenotypeVariantFilter implements VariantFilter {
        @Override
        public boolean test(final VariantContext variant) {
            return firstSampleGenotype(variant) != null
                    && GenotypeCall.classify(firstSampleGenotype(variant)).isPresent();
        }
    }

    public static double qualityOf(final VariantContext variant) {
        return variant.hasLog10PError() ? variant.getPhredScaledQual() : 0.0;
    }

    /**
     * @return the genotype of the first sample, or {@code null} for sites-only records.
     */
    public static Genotype firstSampleGenotype(final VariantContext variant) {
        return variant.getNSamples() == 0 ? null : variant.getGenotype(0);
    }
}
