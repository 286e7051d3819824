package org.pharmaguard.tools.pgx;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pharmaguard.exceptions.PharmaGuardException;
import org.pharmaguard.tools.pgx.catalog.ConfidenceModel;
import org.pharmaguard.tools.pgx.catalog.RuleCatalog;
import org.pharmaguard.tools.pgx.confidence.ConfidenceComponents;
import org.pharmaguard.tools.pgx.confidence.ConfidenceScore;
import org.pharmaguard.tools.pgx.confidence.ConfidenceScorer;
import org.pharmaguard.tools.pgx.confidence.PostHocCalibrator;
import org.pharmaguard.tools.pgx.evidence.EvidenceAnnotation;
import org.pharmaguard.tools.pgx.evidence.EvidenceAnnotationSource;
import org.pharmaguard.tools.pgx.evidence.EvidenceResolver;
import org.pharmaguard.utils.Utils;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Runs the deterministic pharmacogenomic pipeline for one patient: diplotype assembly, phenotype calling,
 * phenoconversion, evidence resolution, rule matching, confidence scoring and calibration, once per requested drug.
 * <p>
 * The engine holds no mutable state. Every coverage gap is reported as data (an Unknown label, a "no evidence"
 * annotation, a capped confidence), so a result is always fully shaped. With a fixed {@link Clock} the output is
 * identical across runs on the same input and catalog.
 * </p>
 */
public final class PgxAnalysisEngine {

    private static final Logger logger = LogManager.getLogger(PgxAnalysisEngine.class);

    public static final String UNKNOWN_PATIENT_ID = "PATIENT_UNKNOWN";

    private final RuleCatalog catalog;
    private final Clock clock;
    private final String analysisVersion;
    private final DrugNameNormalizer drugNameNormalizer;
    private final DiplotypeAssembler diplotypeAssembler;
    private final PhenotypeCaller phenotypeCaller;
    private final PhenoconversionAdjuster phenoconversionAdjuster;
    private final EvidenceResolver evidenceResolver;
    private final RiskRuleMatcher riskRuleMatcher;
    private final ConfidenceScorer confidenceScorer;

    public PgxAnalysisEngine(final RuleCatalog catalog, final EvidenceAnnotationSource evidenceSource,
                             final Clock clock, final String analysisVersion) {
        this.catalog = Utils.nonNull(catalog, "catalog");
        this.clock = Utils.nonNull(clock, "clock");
        this.analysisVersion = Utils.nonEmpty(analysisVersion, "analysis version");
        this.drugNameNormalizer = new DrugNameNormalizer(catalog);
        this.diplotypeAssembler = new DiplotypeAssembler(catalog);
        this.phenotypeCaller = new PhenotypeCaller(catalog);
        this.phenoconversionAdjuster = new PhenoconversionAdjuster(catalog);
        this.evidenceResolver = new EvidenceResolver(catalog, evidenceSource);
        this.riskRuleMatcher = new RiskRuleMatcher(catalog);
        this.confidenceScorer = new ConfidenceScorer(catalog, PostHocCalibrator.fromCatalog(catalog));
    }

    public RuleCatalog getCatalog() {
        return catalog;
    }

    /**
     * @return one result per distinct canonical drug of the request, in request order
     */
    public List<AnalysisResult> analyze(final VariantFilterResult variants, final AnalysisRequest request) {
        Utils.nonNull(variants, "variants");
        Utils.nonNull(request, "request");

        final String patientId = resolvePatientId(request.patientId(), variants.getSampleName());
        final String timestamp = DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock).truncatedTo(ChronoUnit.SECONDS));
        final Map<String, Diplotype> diplotypes = diplotypeAssembler.assemble(variants.getVariants());
        // Without a single data record there is nothing to default from: phenotypes stay Unknown.
        final boolean genotypeInformative = variants.isParsingSuccess() && variants.getTotalRecords() > 0;

        final List<AnalysisResult> results = new ArrayList<>();
        for (final String requested : request.drugs()) {
            final String drug = drugNameNormalizer.normalize(requested);
            if (results.stream().anyMatch(r -> r.getDrug().equals(drug))) {
                continue;
            }
            final DecisionTrace trace = (request.traceEnabled() ? DecisionTrace.empty() : DecisionTrace.disabled())
                    .append("variant_quality_filter",
                            variants.getTotalRecords() + " record(s)",
                            variants.getVariants().size() + " retained, " + variants.getSkippedRecordCount() + " skipped",
                            "QUAL threshold and genotype classification")
                    .append("drug_normalization", requested, drug, "catalog drug aliases " + catalog.getVersion());
            results.add(analyzeDrug(patientId, timestamp, drug, variants, diplotypes, genotypeInformative,
                    request.concurrentMedications(), trace));
        }
        logger.info(String.format("Analyzed %d drug(s) for %s with catalog %s", results.size(), patientId, catalog.getVersion()));
        return Collections.unmodifiableList(results);
    }

    private AnalysisResult analyzeDrug(final String patientId,
                                       final String timestamp,
                                       final String drug,
                                       final VariantFilterResult variants,
                                       final Map<String, Diplotype> diplotypes,
                                       final boolean genotypeInformative,
                                       final List<String> concurrentMedications,
                                       final DecisionTrace initialTrace) {
        DecisionTrace trace = initialTrace;
        final String gene = catalog.primaryGene(drug).orElse(null);
        if (gene == null) {
            logger.warn("Drug " + drug + " is not supported by catalog " + catalog.getVersion());
            return unsupportedDrugResult(patientId, timestamp, drug, variants, trace);
        }

        final Diplotype diplotype = diplotypes.getOrDefault(gene, Diplotype.wildType(gene, catalog.getWildTypeAllele()));
        trace = trace.append("diplotype_assembly", gene + ": " + diplotype.getSupportingVariants().size() + " detected variant(s)",
                diplotype.toDiplotypeString(), "star allele table");

        final PhenotypeCall phenotypeCall = genotypeInformative ? phenotypeCaller.call(diplotype) : PhenotypeCall.unknown(gene, diplotype);
        trace = trace.append("phenotype_calling", diplotype.toDiplotypeString(), describe(phenotypeCall),
                !genotypeInformative ? "no genotype data" : phenotypeCall.defaulted() ? "default phenotype" : "activity score table");

        final PhenoconversionResult phenoconversion = phenoconversionAdjuster.adjust(gene, phenotypeCall.phenotype(), concurrentMedications);
        final Phenotype effectivePhenotype = phenoconversion.getFunctionalPhenotype();
        trace = trace.append("phenoconversion", phenotypeCall.phenotype().getLabel() + " with " + concurrentMedications,
                effectivePhenotype.getLabel() + " (" + phenoconversion.getStrongestInhibitor().getLabel() + ")", "inhibitor rule table");

        final EvidenceAnnotation evidence = evidenceResolver.resolve(gene, drug);
        trace = trace.append("evidence_resolution", gene + "/" + drug, evidence.getEvidenceLevel(), evidence.getSource().getLabel());

        final RiskRuleMatch match = riskRuleMatcher.match(gene, effectivePhenotype, drug);
        trace = trace.append("risk_rule_matching", RiskRule.key(gene, effectivePhenotype, drug),
                match.riskLabel().getLabel() + "/" + match.severity().getLabel(),
                match.isRuleCovered() ? "rule catalog " + catalog.getVersion() : "unknown fallback");

        final ConfidenceComponents components = confidenceScorer.components(evidence, variants.getVcfQualityScore(),
                variants.getAnnotationCompleteness(), diplotype.getSupportingVariants().size(), phenotypeCall, match.isRuleCovered());
        final ConfidenceScore confidence = confidenceScorer.score(components, match.isRuleCovered(), phenoconversion.getConfidencePenalty());
        if (!match.isRuleCovered() && confidence.calibrated() > ConfidenceModel.MAX_FALLBACK_CAP) {
            throw new PharmaGuardException.PipelineInvariantViolation("calibration",
                    "uncovered " + gene + "/" + drug + " scored " + confidence.calibrated() + " above the fallback cap");
        }
        trace = trace.append("confidence_scoring", components.toString(), String.valueOf(confidence.raw()),
                        "catalog confidence model")
                .append("calibration", String.valueOf(Math.max(0.0, confidence.raw() - confidence.penalty())),
                        String.valueOf(confidence.calibrated()),
                        confidenceScorer.getCalibrator().isIdentity() ? "identity" : "calibration bins");

        final PharmacogenomicProfile profile = new PharmacogenomicProfile(gene, diplotype.toDiplotypeString(),
                phenotypeCall.phenotype(), effectivePhenotype,
                phenotypeCall.getActivityScore().isPresent() ? phenotypeCall.getActivityScore().getAsDouble() : null,
                diplotype.getSupportingVariants());
        return new AnalysisResult(patientId, drug, timestamp,
                new RiskAssessment(match.riskLabel(), confidence.calibrated(), match.severity()),
                profile,
                ClinicalRecommendation.build(gene, drug, match, evidence, phenoconversion),
                confidence,
                phenoconversion,
                qualityMetrics(variants, match.isRuleCovered(), confidence),
                trace);
    }

    private AnalysisResult unsupportedDrugResult(final String patientId, final String timestamp, final String drug,
                                                 final VariantFilterResult variants, final DecisionTrace trace) {
        final String gene = PharmacogenomicProfile.NO_GENE;
        final RiskRuleMatch match = RiskRuleMatcher.fallback(gene, Phenotype.UNKNOWN, drug);
        final EvidenceAnnotation evidence = EvidenceAnnotation.none(gene, drug);
        final ConfidenceComponents components = confidenceScorer.components(evidence, variants.getVcfQualityScore(),
                variants.getAnnotationCompleteness(), 0, PhenotypeCall.unknown(gene, null), false);
        final ConfidenceScore confidence = confidenceScorer.score(components, false, 0.0);
        return new AnalysisResult(patientId, drug, timestamp,
                new RiskAssessment(match.riskLabel(), confidence.calibrated(), match.severity()),
                PharmacogenomicProfile.unsupportedDrug(),
                ClinicalRecommendation.build(gene, drug, match, evidence, null),
                confidence,
                null,
                qualityMetrics(variants, false, confidence),
                trace.append("risk_rule_matching", drug, match.riskLabel().getLabel(), "unsupported drug"));
    }

    private QualityMetrics qualityMetrics(final VariantFilterResult variants, final boolean ruleCovered, final ConfidenceScore confidence) {
        return new QualityMetrics(variants.isParsingSuccess(),
                variants.getVcfQualityScore(),
                variants.getVariants().size(),
                Math.toIntExact(variants.getSkippedRecordCount()),
                variants.getAnnotationCompleteness(),
                ruleCovered,
                confidence.confidenceLevel(),
                analysisVersion,
                catalog.getVersion());
    }

    private static String describe(final PhenotypeCall call) {
        return call.getActivityScore().isPresent()
                ? call.phenotype().getLabel() + " (activity " + call.getActivityScore().getAsDouble() + ")"
                : call.phenotype().getLabel();
    }

    static String resolvePatientId(final String requested, final String sampleName) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        return sampleName == null || sampleName.isBlank() ? UNKNOWN_PATIENT_ID : sampleName;
    }
}
