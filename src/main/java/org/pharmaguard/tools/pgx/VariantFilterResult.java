package org.pharmaguard.tools.pgx;

import org.pharmaguard.utils.Utils;

import java.util.List;

/**
 * Variants retained by {@link VariantQualityFilter} together with the counts of records it discarded.
 */
public final class VariantFilterResult {

    private final List<PgxVariant> variants;
    private final String sampleName;
    private final boolean parsingSuccess;
    private final long totalRecords;
    private final long malformedRecords;
    private final long lowQualityRecords;
    private final long unclassifiableRecords;
    private final long offTargetRecords;

    public VariantFilterResult(final List<PgxVariant> variants, final String sampleName, final boolean parsingSuccess,
                               final long totalRecords, final long malformedRecords, final long lowQualityRecords,
                               final long unclassifiableRecords, final long offTargetRecords) {
        this.variants = List.copyOf(Utils.nonNull(variants));
        this.sampleName = sampleName;
        this.parsingSuccess = parsingSuccess;
        this.totalRecords = totalRecords;
        this.malformedRecords = malformedRecords;
        this.lowQualityRecords = lowQualityRecords;
        this.unclassifiableRecords = unclassifiableRecords;
        this.offTargetRecords = offTargetRecords;
        Utils.validateArg(totalRecords == variants.size() + getSkippedRecordCount(),
                "record counts do not add up to the number of records read");
    }

    /**
     * Result for input with no usable VCF header: nothing retained and every data line counted as malformed.
     */
    public static VariantFilterResult unparseable(final long dataLines) {
        return new VariantFilterResult(List.of(), null, false, dataLines, dataLines, 0, 0, 0);
    }

    public List<PgxVariant> getVariants() {
        return variants;
    }

    /**
     * @return the first sample named in the VCF header, or {@code null} for sites-only or unparseable input.
     */
    public String getSampleName() {
        return sampleName;
    }

    public boolean isParsingSuccess() {
        return parsingSuccess;
    }

    public long getTotalRecords() {
        return totalRecords;
    }

    public long getMalformedRecords() {
        return malformedRecords;
    }

    public long getLowQualityRecords() {
        return lowQualityRecords;
    }

    public long getUnclassifiableRecords() {
        return unclassifiableRecords;
    }

    public long getOffTargetRecords() {
        return offTargetRecords;
    }

    public long getSkippedRecordCount() {
        return malformedRecords + lowQualityRecords + unclassifiableRecords + offTargetRecords;
    }

    /**
     * Fraction of retained variants with both a gene and a star allele; 1.0 when nothing was retained.
     */
    public double getAnnotationCompleteness() {
        if (variants.isEmpty()) {
            return 1.0;
        }
        final long annotated = variants.stream().filter(PgxVariant::isAnnotated).count();
        return Utils.round((double) annotated / variants.size(), 2);
    }

    /**
     * Overall input quality in [0, 100]: 70% from mean QUAL (capped at 100) and 30% from the annotation rate of the
     * retained variants. 0 when nothing was retained.
     */
    public double getVcfQualityScore() {
        if (variants.isEmpty()) {
            return 0.0;
        }
        final double meanQuality = variants.stream().mapToDouble(PgxVariant::quality).average().orElse(0.0);
        final double annotationRate = (double) variants.stream().filter(PgxVariant::isAnnotated).count() / variants.size();
        return Utils.round(Math.min(100.0, meanQuality) * 0.7 + annotationRate * 30.0, 1);
    }

    @Override
    public String toString() {
        return String.format("%d of %d record(s) retained (%d malformed, %d below quality, %d unclassifiable genotype, %d off-target)",
                variants.size(), totalRecords, malformedRecords, lowQualityRecords, unclassifiableRecords, offTargetRecords);
    }
}
