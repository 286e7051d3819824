package org.pharmaguard.tools.pgx;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.pharmaguard.cmdline.CommandLineProgram;
import org.pharmaguard.cmdline.StandardArgumentDefinitions;
import org.pharmaguard.cmdline.programgroups.PharmacogenomicsProgramGroup;
import org.pharmaguard.tools.pgx.catalog.RuleCatalog;
import org.pharmaguard.tools.pgx.catalog.RuleCatalogLoader;
import org.pharmaguard.tools.pgx.evidence.EvidenceAnnotationSource;
import org.pharmaguard.tools.pgx.evidence.PharmGkbClinicalAnnotationSource;
import org.pharmaguard.utils.Utils;
import org.pharmaguard.utils.config.ConfigFactory;
import org.pharmaguard.utils.config.PharmaGuardConfig;
import org.pharmaguard.utils.json.JsonUtils;

import java.io.File;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Infers per-drug pharmacogenomic risk for one patient from a VCF of pharmacogene calls.
 *
 * <h3>Input</h3>
 * <p>
 * A VCF whose records carry {@code GENE}, {@code STAR} and {@code RS} INFO annotations and a {@code GT} call
 * for the first sample, plus the drugs to assess and, optionally, the other medications the patient takes.
 * </p>
 *
 * <h3>Output</h3>
 * <p>
 * A JSON array with one result per distinct drug, in the order the drugs were given.
 * </p>
 *
 * <h3>Usage example</h3>
 * <pre>
 *   pharmaguard AnalyzePharmacogenomics \
 *     -V patient.vcf \
 *     -D codeine -D clopidogrel \
 *     --concurrent-medication fluoxetine \
 *     -O results.json
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Infers per-drug risk labels, recommendations and calibrated confidence from pharmacogene variant calls",
        oneLineSummary = "Infer pharmacogenomic drug risk for one patient",
        programGroup = PharmacogenomicsProgramGroup.class
)
public final class AnalyzePharmacogenomics extends CommandLineProgram {

    @Argument(fullName = StandardArgumentDefinitions.VARIANT_LONG_NAME, shortName = StandardArgumentDefinitions.VARIANT_SHORT_NAME,
            doc = "VCF file with pharmacogene variant calls")
    public File VARIANT;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME, shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Where to write the JSON results")
    public File OUTPUT;

    @Argument(fullName = StandardArgumentDefinitions.DRUG_LONG_NAME, shortName = StandardArgumentDefinitions.DRUG_SHORT_NAME,
            doc = "Drug to assess; may be given more than once, and each value may be a comma-separated list")
    public List<String> DRUGS = new ArrayList<>();

    @Argument(fullName = StandardArgumentDefinitions.CONCURRENT_MEDICATION_LONG_NAME,
            doc = "Other medication the patient takes; may be given more than once", optional = true)
    public List<String> CONCURRENT_MEDICATIONS = new ArrayList<>();

    @Argument(fullName = StandardArgumentDefinitions.PATIENT_ID_LONG_NAME,
            doc = "Patient identifier; defaults to the VCF sample name", optional = true)
    public String PATIENT_ID = null;

    @Argument(fullName = StandardArgumentDefinitions.RULES_CATALOG_LONG_NAME,
            doc = "Rule catalog JSON to use instead of the configured or bundled one", optional = true)
    public File RULES_CATALOG = null;

    @Argument(fullName = StandardArgumentDefinitions.PHARMGKB_ANNOTATIONS_LONG_NAME,
            doc = "PharmGKB clinical_annotations.tsv to consult before the curated references", optional = true)
    public File PHARMGKB_ANNOTATIONS = null;

    @Argument(fullName = StandardArgumentDefinitions.MIN_VARIANT_QUALITY_LONG_NAME,
            doc = "Records with a lower QUAL are skipped; defaults to the configured value", optional = true)
    public Double MIN_VARIANT_QUALITY = null;

    @Argument(fullName = StandardArgumentDefinitions.DECISION_TRACE_LONG_NAME,
            doc = "Attach the per-stage decision trace to every result", optional = true)
    public boolean DECISION_TRACE = false;

    private PharmaGuardConfig config;

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>();
        if (expandedDrugs().isEmpty()) {
            errors.add("at least one non-blank --" + StandardArgumentDefinitions.DRUG_LONG_NAME + " is required");
        }
        if (MIN_VARIANT_QUALITY != null && (MIN_VARIANT_QUALITY < 0 || MIN_VARIANT_QUALITY.isNaN())) {
            errors.add("--" + StandardArgumentDefinitions.MIN_VARIANT_QUALITY_LONG_NAME + " must be non-negative");
        }
        return errors.isEmpty() ? null : errors.toArray(new String[0]);
    }

    @Override
    protected void onStartup() {
        config = ConfigFactory.getInstance().getPharmaGuardConfig();
    }

    @Override
    protected Object doWork() {
        final RuleCatalog catalog = RuleCatalogLoader.load(catalogFile() == null ? null : catalogFile().toPath());
        final double minimumQuality = MIN_VARIANT_QUALITY != null ? MIN_VARIANT_QUALITY : config.pgx_min_variant_quality();

        final VariantFilterResult variants = new VariantQualityFilter(catalog, minimumQuality).filter(VARIANT.toPath());
        logger.info(String.format("Kept %d of %d records from %s (%d malformed, %d below QUAL %.1f, %d unclassifiable)",
                variants.getVariants().size(), variants.getTotalRecords(), VARIANT,
                variants.getMalformedRecords(), variants.getLowQualityRecords(), minimumQuality,
                variants.getUnclassifiableRecords()));

        final PgxAnalysisEngine engine = new PgxAnalysisEngine(catalog, evidenceSource(), Clock.systemUTC(),
                config.pgx_analysis_version());
        final AnalysisRequest request = new AnalysisRequest(PATIENT_ID, expandedDrugs(),
                ConcurrentMedication.parseList(String.join(",", CONCURRENT_MEDICATIONS)), DECISION_TRACE);
        final List<AnalysisResult> results = engine.analyze(variants, request);

        JsonUtils.writeJson(OUTPUT, results);
        logger.info(String.format("Wrote %d result(s) to %s", results.size(), OUTPUT));
        return results.size();
    }

    private List<String> expandedDrugs() {
        return Utils.splitCommaSeparated(String.join(",", DRUGS));
    }

    private File catalogFile() {
        if (RULES_CATALOG != null) {
            return RULES_CATALOG;
        }
        final String configured = config.pgx_rules_catalog_path();
        return configured.isEmpty() ? null : new File(configured);
    }

    private EvidenceAnnotationSource evidenceSource() {
        File annotations = PHARMGKB_ANNOTATIONS;
        if (annotations == null && !config.pgx_pharmgkb_annotations_path().isEmpty()) {
            annotations = new File(config.pgx_pharmgkb_annotations_path());
        }
        if (annotations == null) {
            return EvidenceAnnotationSource.EMPTY;
        }
        final PharmGkbClinicalAnnotationSource source = PharmGkbClinicalAnnotationSource.fromPath(annotations.toPath());
        logger.info(String.format("Loaded %d gene-drug evidence entries from %s", source.size(), annotations));
        return source;
    }
}
