package org.pharmaguard.tools.pgx.confidence;

import com.google.common.annotations.VisibleForTesting;
import org.pharmaguard.tools.pgx.PhenotypeCall;
import org.pharmaguard.tools.pgx.catalog.ConfidenceModel;
import org.pharmaguard.tools.pgx.catalog.RuleCatalog;
import org.pharmaguard.tools.pgx.evidence.EvidenceAnnotation;
import org.pharmaguard.utils.Utils;

/**
 * Scores confidence from four bounded components.
 * <p>
 * The raw score is the catalog-weighted sum of the components. Without a matched rule it is capped at the catalog's
 * fallback cap, and the cap is applied again after calibration. The phenoconversion penalty is subtracted before
 * calibration and the result floored at 0.
 * </p>
 */
public final class ConfidenceScorer {

    private static final double QUALITY_WEIGHT = 0.5;
    private static final double COMPLETENESS_WEIGHT = 0.3;
    private static final double SUPPORT_WEIGHT = 0.2;
    private static final double BASE_SUPPORT = 0.7;
    private static final double SUPPORT_PER_VARIANT = 0.15;
    private static final int SCORE_PRECISION = 4;

    private final ConfidenceModel model;
    private final RuleCatalog catalog;
    private final PostHocCalibrator calibrator;

    public ConfidenceScorer(final RuleCatalog catalog) {
        this(catalog, PostHocCalibrator.fromCatalog(catalog));
    }

    public ConfidenceScorer(final RuleCatalog catalog, final PostHocCalibrator calibrator) {
        this.catalog = Utils.nonNull(catalog, "catalog");
        this.model = catalog.getConfidenceModel();
        this.calibrator = Utils.nonNull(calibrator, "calibrator");
    }

    public ConfidenceComponents components(final EvidenceAnnotation evidence,
                                           final double vcfQualityScore,
                                           final double annotationCompleteness,
                                           final int supportingVariantCount,
                                           final PhenotypeCall phenotypeCall,
                                           final boolean ruleCovered) {
        Utils.nonNull(evidence, "evidence");
        Utils.nonNull(phenotypeCall, "phenotype call");
        return new ConfidenceComponents(
                evidenceComponent(evidence),
                genotypeComponent(vcfQualityScore, annotationCompleteness, supportingVariantCount),
                phenotypeComponent(phenotypeCall),
                ruleCovered ? 1.0 : Utils.clampToUnitInterval(model.noRuleCoverageScore()));
    }

    public ConfidenceScore score(final ConfidenceComponents components, final boolean ruleCovered, final double phenoconversionPenalty) {
        Utils.nonNull(components, "components");
        Utils.validateArg(phenoconversionPenalty >= 0.0, "the penalty must not be negative");
        double raw = Utils.clampToUnitInterval(
                model.evidenceWeight() * components.evidence()
                        + model.genotypeWeight() * components.genotype()
                        + model.phenotypeWeight() * components.phenotype()
                        + model.ruleCoverageWeight() * components.ruleCoverage());
        if (!ruleCovered) {
            raw = Math.min(raw, model.effectiveFallbackCap());
        }
        raw = Utils.round(raw, SCORE_PRECISION);
        final double penalized = Math.max(0.0, raw - phenoconversionPenalty);
        double calibrated = calibrator.calibrate(penalized);
        if (!ruleCovered) {
            calibrated = Math.min(calibrated, model.effectiveFallbackCap());
        }
        return new ConfidenceScore(components, raw, phenoconversionPenalty, calibrated, !ruleCovered);
    }

    @VisibleForTesting
    double evidenceComponent(final EvidenceAnnotation evidence) {
        if (!evidence.hasEvidence()) {
            return model.noEvidenceScore();
        }
        return catalog.evidenceTierScore(evidence.getEvidenceLevel()).orElse(model.noEvidenceScore());
    }

    /**
     * @param vcfQualityScore        file quality on a 0-100 scale
     * @param annotationCompleteness fraction of retained records with a gene annotation
     * @param supportingVariantCount detected variants for the gene; each adds support up to a cap of 1
     */
    @VisibleForTesting
    static double genotypeComponent(final double vcfQualityScore, final double annotationCompleteness, final int supportingVariantCount) {
        final double support = Math.min(1.0, BASE_SUPPORT + SUPPORT_PER_VARIANT * Math.max(0, supportingVariantCount));
        return Utils.round(Utils.clampToUnitInterval(
                QUALITY_WEIGHT * Utils.clampToUnitInterval(vcfQualityScore / 100.0)
                        + COMPLETENESS_WEIGHT * Utils.clampToUnitInterval(annotationCompleteness)
                        + SUPPORT_WEIGHT * support), SCORE_PRECISION);
    }

    @VisibleForTesting
    double phenotypeComponent(final PhenotypeCall call) {
        if (call.isUnknown()) {
            return model.unknownPhenotypeScore();
        }
        return call.defaulted() ? model.defaultPhenotypeScore() : model.calledPhenotypeScore();
    }

    public PostHocCalibrator getCalibrator() {
        return calibrator;
    }
}
