package org.pharmaguard.tools.pgx.catalog;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.tools.pgx.AlleleFunction;
import org.pharmaguard.tools.pgx.InhibitorStrength;
import org.pharmaguard.tools.pgx.Phenotype;
import org.pharmaguard.tools.pgx.RiskLabel;
import org.pharmaguard.tools.pgx.RiskRule;
import org.pharmaguard.tools.pgx.Severity;
import org.pharmaguard.tools.pgx.confidence.CalibrationBin;
import org.pharmaguard.tools.pgx.confidence.PostHocCalibrator;
import org.pharmaguard.utils.Utils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Reads a JSON rule catalog and validates it before anything can use it. Every structural or semantic defect
 * (missing keys, unknown enum values, duplicate rules, bad breakpoints, weights that do not sum to one, a
 * non-monotonic calibration map) fails the load with {@link UserException.MalformedRuleCatalog}.
 */
public final class RuleCatalogLoader {

    private static final Logger logger = LogManager.getLogger(RuleCatalogLoader.class);

    public static final String DEFAULT_CATALOG_RESOURCE = "/org/pharmaguard/tools/pgx/catalog/rules.v1.json";

    private static final JsonMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
            .build();

    private RuleCatalogLoader() {}

    /**
     * Loads the catalog bundled on the class path.
     */
    public static RuleCatalog loadDefault() {
        try (final InputStream in = RuleCatalogLoader.class.getResourceAsStream(DEFAULT_CATALOG_RESOURCE)) {
            if (in == null) {
                throw new UserException.MalformedRuleCatalog(DEFAULT_CATALOG_RESOURCE, "bundled catalog is missing from the class path");
            }
            return load(DEFAULT_CATALOG_RESOURCE, in);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(DEFAULT_CATALOG_RESOURCE, "could not read the bundled rule catalog", e);
        }
    }

    /**
     * Loads a catalog from a file, or the bundled catalog when {@code path} is {@code null}.
     */
    public static RuleCatalog load(final Path path) {
        if (path == null) {
            return loadDefault();
        }
        try (final InputStream in = Files.newInputStream(path)) {
            return load(path.toString(), in);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, "could not read the rule catalog", e);
        }
    }

    public static RuleCatalog load(final String source, final InputStream in) {
        Utils.nonNull(in, "input stream");
        final JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (final JsonProcessingException e) {
            throw new UserException.MalformedRuleCatalog(source, "not valid JSON: " + e.getOriginalMessage(), e);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(source, "could not read the rule catalog", e);
        }
        final RuleCatalog catalog = new Parser(source).parse(root);
        logger.info(String.format("Loaded rule catalog %s from %s (%d genes, %d risk rules, %s)",
                catalog.getVersion(), source, catalog.getTargetGenes().size(), catalog.getRiskRules().size(),
                catalog.getCalibrationBins().isEmpty() ? "identity calibration" : catalog.getCalibrationBins().size() + " calibration bins"));
        return catalog;
    }

    /**
     * Walks one catalog document. Holds the source name so that every error names the file it came from.
     */
    private static final class Parser {
        private final String source;

        Parser(final String source) {
            this.source = source == null ? "<unnamed>" : source;
        }

        RuleCatalog parse(final JsonNode root) {
            if (root == null || !root.isObject()) {
                throw fail("the catalog must be a JSON object");
            }
            final String version = text(root, "rules_version");
            final List<String> targetGenes = stringList(root, "target_genes");
            if (targetGenes.isEmpty()) {
                throw fail("target_genes must not be empty");
            }
            if (new HashSet<>(targetGenes).size() != targetGenes.size()) {
                throw fail("target_genes contains duplicates");
            }
            final String wildType = text(root, "wild_type_allele");

            final Map<String, String> supportedDrugs = new LinkedHashMap<>();
            stringMap(root, "supported_drugs").forEach((drug, gene) -> {
                requireTargetGene(targetGenes, gene, "supported_drugs." + drug);
                supportedDrugs.put(drug.toUpperCase(Locale.ROOT), gene);
            });

            final Map<String, String> aliases = new LinkedHashMap<>();
            stringMap(root, "drug_aliases").forEach((alias, canonical) -> {
                final String canonicalDrug = canonical.toUpperCase(Locale.ROOT);
                if (!supportedDrugs.containsKey(canonicalDrug)) {
                    throw fail("drug alias " + alias + " points at unsupported drug " + canonical);
                }
                aliases.put(alias.toUpperCase(Locale.ROOT), canonicalDrug);
            });

            final List<StarAlleleDefinition> starAlleles = parseStarAlleles(root, targetGenes);
            final Map<String, ActivityScoreTable> activityTables = parseActivityTables(root, targetGenes, wildType);
            final Map<String, Map<String, InhibitorStrength>> inhibitors = parseInhibitors(root);
            final Map<InhibitorStrength, Double> penalties = parsePenalties(root);
            final List<RiskRule> riskRules = parseRiskRules(root, targetGenes, supportedDrugs);
            final Map<String, Double> tierScores = parseTierScores(root);
            final List<CpicReference> references = parseCpicReferences(root, tierScores);
            final ConfidenceModel confidenceModel = parseConfidenceModel(root);
            final List<CalibrationBin> calibrationBins = parseCalibrationBins(root);

            return new RuleCatalog(version, targetGenes, wildType, supportedDrugs, aliases, starAlleles, activityTables,
                    inhibitors, penalties, riskRules, tierScores, references, confidenceModel, calibrationBins);
        }

        private List<StarAlleleDefinition> parseStarAlleles(final JsonNode root, final List<String> targetGenes) {
            final List<StarAlleleDefinition> result = new ArrayList<>();
            final Set<String> seen = new HashSet<>();
            for (final JsonNode row : array(root, "star_alleles")) {
                final String rsid = text(row, "rsid");
                final String gene = text(row, "gene");
                requireTargetGene(targetGenes, gene, "star allele " + rsid);
                final AlleleFunction function = enumValue(row, "function", AlleleFunction::fromLabel);
                if (!seen.add(rsid)) {
                    throw fail("rsID " + rsid + " is defined more than once in star_alleles");
                }
                result.add(new StarAlleleDefinition(rsid, gene, text(row, "star"), function));
            }
            return result;
        }

        private Map<String, ActivityScoreTable> parseActivityTables(final JsonNode root, final List<String> targetGenes, final String wildType) {
            final JsonNode tables = object(root, "activity_tables");
            final Map<String, ActivityScoreTable> result = new LinkedHashMap<>();
            final Iterator<Map.Entry<String, JsonNode>> it = tables.fields();
            while (it.hasNext()) {
                final Map.Entry<String, JsonNode> entry = it.next();
                final String gene = entry.getKey();
                requireTargetGene(targetGenes, gene, "activity_tables");
                final JsonNode table = entry.getValue();

                final Map<String, Double> scores = new LinkedHashMap<>();
                final Iterator<Map.Entry<String, JsonNode>> scoreIt = object(table, "allele_scores").fields();
                while (scoreIt.hasNext()) {
                    final Map.Entry<String, JsonNode> score = scoreIt.next();
                    if (!score.getValue().isNumber() || score.getValue().asDouble() < 0) {
                        throw fail("activity score of " + gene + " " + score.getKey() + " must be a non-negative number");
                    }
                    scores.put(score.getKey(), score.getValue().asDouble());
                }
                if (!scores.containsKey(wildType)) {
                    throw fail("allele_scores of " + gene + " have no score for the wild-type allele " + wildType);
                }

                final List<ActivityScoreTable.Breakpoint> breakpoints = new ArrayList<>();
                for (final JsonNode breakpoint : array(table, "breakpoints")) {
                    final Phenotype phenotype = enumValue(breakpoint, "phenotype", Phenotype::fromLabel);
                    if (phenotype == Phenotype.UNKNOWN) {
                        throw fail("breakpoints of " + gene + " cannot classify into Unknown");
                    }
                    final JsonNode max = breakpoint.get("max_score");
                    if (max != null && !max.isNull() && !max.isNumber()) {
                        throw fail("max_score of " + gene + " " + phenotype.getLabel() + " must be a number");
                    }
                    breakpoints.add(new ActivityScoreTable.Breakpoint(phenotype, max == null || max.isNull() ? null : max.asDouble()));
                }
                final Phenotype defaultPhenotype = enumValue(table, "default_phenotype", Phenotype::fromLabel);
                try {
                    result.put(gene, new ActivityScoreTable(gene, scores, breakpoints, defaultPhenotype));
                } catch (final IllegalArgumentException e) {
                    throw fail(e.getMessage());
                }
            }
            for (final String gene : targetGenes) {
                if (!result.containsKey(gene)) {
                    throw fail("target gene " + gene + " has no activity table");
                }
            }
            return result;
        }

        private Map<String, Map<String, InhibitorStrength>> parseInhibitors(final JsonNode root) {
            final Map<String, Map<String, InhibitorStrength>> result = new LinkedHashMap<>();
            final Iterator<Map.Entry<String, JsonNode>> genes = object(root, "inhibitors").fields();
            while (genes.hasNext()) {
                final Map.Entry<String, JsonNode> gene = genes.next();
                final Map<String, InhibitorStrength> table = new LinkedHashMap<>();
                final Iterator<Map.Entry<String, JsonNode>> strengths = gene.getValue().fields();
                while (strengths.hasNext()) {
                    final Map.Entry<String, JsonNode> strengthEntry = strengths.next();
                    final InhibitorStrength strength = InhibitorStrength.fromLabel(strengthEntry.getKey())
                            .filter(s -> s != InhibitorStrength.NONE)
                            .orElseThrow(() -> fail("unknown inhibitor strength '" + strengthEntry.getKey() + "' for " + gene.getKey()));
                    for (final JsonNode drug : strengthEntry.getValue()) {
                        final String name = RuleCatalog.normalizeMedication(drug.asText());
                        if (table.put(name, strength) != null) {
                            throw fail("inhibitor " + name + " is listed more than once for " + gene.getKey());
                        }
                    }
                }
                result.put(gene.getKey(), table);
            }
            return result;
        }

        private Map<InhibitorStrength, Double> parsePenalties(final JsonNode root) {
            final Map<InhibitorStrength, Double> result = new EnumMap<>(InhibitorStrength.class);
            result.put(InhibitorStrength.NONE, 0.0);
            final Iterator<Map.Entry<String, JsonNode>> it = object(root, "phenoconversion_penalties").fields();
            while (it.hasNext()) {
                final Map.Entry<String, JsonNode> entry = it.next();
                final InhibitorStrength strength = InhibitorStrength.fromLabel(entry.getKey())
                        .orElseThrow(() -> fail("unknown inhibitor strength '" + entry.getKey() + "' in phenoconversion_penalties"));
                result.put(strength, unitInterval(entry.getValue(), "phenoconversion_penalties." + entry.getKey()));
            }
            return result;
        }

        private List<RiskRule> parseRiskRules(final JsonNode root, final List<String> targetGenes, final Map<String, String> supportedDrugs) {
            final List<RiskRule> result = new ArrayList<>();
            final Set<String> keys = new HashSet<>();
            for (final JsonNode row : array(root, "risk_rules")) {
                final String gene = text(row, "gene");
                requireTargetGene(targetGenes, gene, "risk rule");
                final String drug = text(row, "drug").toUpperCase(Locale.ROOT);
                final Phenotype phenotype = enumValue(row, "phenotype", Phenotype::fromLabel);
                if (phenotype == Phenotype.UNKNOWN) {
                    throw fail("risk rule for " + gene + "/" + drug + " cannot match the Unknown phenotype");
                }
                final RiskLabel label = enumValue(row, "risk_label", RiskLabel::fromLabel);
                final Severity severity = enumValue(row, "severity", Severity::fromLabel);
                final List<String> alternatives = row.has("alternatives") ? stringList(row, "alternatives") : List.of();
                final RiskRule rule = new RiskRule(gene, drug, phenotype, label, severity, text(row, "action"), alternatives);
                if (!keys.add(rule.key())) {
                    throw fail("duplicate risk rule for " + gene + " " + phenotype.getLabel() + " " + drug);
                }
                if (!supportedDrugs.containsKey(drug)) {
                    logger.warn(String.format("Rule catalog %s has a rule for %s, which is not a supported drug", source, drug));
                }
                result.add(rule);
            }
            return result;
        }

        private Map<String, Double> parseTierScores(final JsonNode root) {
            final Map<String, Double> result = new LinkedHashMap<>();
            final Iterator<Map.Entry<String, JsonNode>> it = object(root, "evidence_tier_scores").fields();
            while (it.hasNext()) {
                final Map.Entry<String, JsonNode> entry = it.next();
                result.put(entry.getKey().toUpperCase(Locale.ROOT), unitInterval(entry.getValue(), "evidence_tier_scores." + entry.getKey()));
            }
            return result;
        }

        private List<CpicReference> parseCpicReferences(final JsonNode root, final Map<String, Double> tierScores) {
            final List<CpicReference> result = new ArrayList<>();
            final Set<String> pairs = new HashSet<>();
            for (final JsonNode row : array(root, "cpic_references")) {
                final String gene = text(row, "gene");
                final String drug = text(row, "drug").toUpperCase(Locale.ROOT);
                final String tier = text(row, "evidence_level").toUpperCase(Locale.ROOT);
                if (!tierScores.containsKey(tier)) {
                    throw fail("CPIC reference " + gene + "/" + drug + " has unscored evidence level " + tier);
                }
                if (!row.path("year").canConvertToInt()) {
                    throw fail("CPIC reference " + gene + "/" + drug + " needs an integer year");
                }
                if (!pairs.add(gene + "|" + drug)) {
                    throw fail("duplicate CPIC reference for " + gene + "/" + drug);
                }
                final JsonNode doi = row.get("doi");
                result.add(new CpicReference(gene, drug, text(row, "guideline"), text(row, "authors"),
                        row.get("year").asInt(), text(row, "pmid"), doi == null || doi.isNull() ? null : doi.asText(), tier));
            }
            return result;
        }

        private ConfidenceModel parseConfidenceModel(final JsonNode root) {
            final JsonNode model = object(root, "confidence_model");
            final JsonNode weights = object(model, "weights");
            final ConfidenceModel result = new ConfidenceModel(
                    unitInterval(weights.get("evidence"), "weights.evidence"),
                    unitInterval(weights.get("genotype"), "weights.genotype"),
                    unitInterval(weights.get("phenotype"), "weights.phenotype"),
                    unitInterval(weights.get("rule_coverage"), "weights.rule_coverage"),
                    unitInterval(model.get("no_evidence_score"), "no_evidence_score"),
                    unitInterval(model.get("unknown_phenotype_score"), "unknown_phenotype_score"),
                    unitInterval(model.get("called_phenotype_score"), "called_phenotype_score"),
                    unitInterval(model.get("default_phenotype_score"), "default_phenotype_score"),
                    unitInterval(model.get("no_rule_coverage_score"), "no_rule_coverage_score"),
                    unitInterval(model.get("fallback_cap"), "fallback_cap"));
            if (result.fallbackCap() > ConfidenceModel.MAX_FALLBACK_CAP) {
                throw fail(String.format("fallback_cap %s exceeds %s", result.fallbackCap(), ConfidenceModel.MAX_FALLBACK_CAP));
            }
            if (Math.abs(result.weightSum() - 1.0) > ConfidenceModel.WEIGHT_SUM_TOLERANCE) {
                throw fail(String.format("confidence weights must sum to 1 but sum to %s", result.weightSum()));
            }
            return result;
        }

        private List<CalibrationBin> parseCalibrationBins(final JsonNode root) {
            final JsonNode bins = root.get("calibration_bins");
            if (bins == null || bins.isNull()) {
                return List.of();
            }
            if (!bins.isArray()) {
                throw fail("calibration_bins must be an array");
            }
            final List<CalibrationBin> result = new ArrayList<>();
            for (final JsonNode bin : bins) {
                try {
                    result.add(new CalibrationBin(
                            number(bin, "lower"), number(bin, "upper"), number(bin, "calibrated")));
                } catch (final IllegalArgumentException e) {
                    throw fail(e.getMessage());
                }
            }
            try {
                return PostHocCalibrator.validateBins(result);
            } catch (final IllegalArgumentException e) {
                throw fail(e.getMessage());
            }
        }

        // ------------------------------------------------------------------------------------------------------
        // field helpers

        private void requireTargetGene(final List<String> targetGenes, final String gene, final String where) {
            if (!targetGenes.contains(gene)) {
                throw fail(where + " refers to " + gene + ", which is not a target gene");
            }
        }

        private <E extends Enum<E>> E enumValue(final JsonNode node, final String field, final Function<String, Optional<E>> parser) {
            final String value = text(node, field);
            return parser.apply(value).orElseThrow(() -> fail("unknown value '" + value + "' for " + field));
        }

        private String text(final JsonNode node, final String field) {
            final JsonNode value = node.get(field);
            if (value == null || value.isNull() || !value.isValueNode() || value.asText().trim().isEmpty()) {
                throw fail("missing or empty field '" + field + "'");
            }
            return value.asText().trim();
        }

        private double number(final JsonNode node, final String field) {
            final JsonNode value = node.get(field);
            if (value == null || !value.isNumber()) {
                throw fail("field '" + field + "' must be a number");
            }
            return value.asDouble();
        }

        private double unitInterval(final JsonNode value, final String field) {
            if (value == null || !value.isNumber()) {
                throw fail("field '" + field + "' must be a number");
            }
            final double d = value.asDouble();
            if (d < 0.0 || d > 1.0) {
                throw fail("field '" + field + "' must lie in [0, 1] but is " + d);
            }
            return d;
        }

        private JsonNode object(final JsonNode node, final String field) {
            final JsonNode value = node.get(field);
            if (value == null || !value.isObject()) {
                throw fail("missing object '" + field + "'");
            }
            return value;
        }

        private JsonNode array(final JsonNode node, final String field) {
            final JsonNode value = node.get(field);
            if (value == null || !value.isArray()) {
                throw fail("missing array '" + field + "'");
            }
            return value;
        }

        private List<String> stringList(final JsonNode node, final String field) {
            final List<String> result = new ArrayList<>();
            for (final JsonNode value : array(node, field)) {
                if (!value.isTextual() || value.asText().trim().isEmpty()) {
                    throw fail("array '" + field + "' must contain non-empty strings");
                }
                result.add(value.asText().trim());
            }
            return result;
        }

        private Map<String, String> stringMap(final JsonNode node, final String field) {
            final Map<String, String> result = new LinkedHashMap<>();
            final Iterator<Map.Entry<String, JsonNode>> it = object(node, field).fields();
            while (it.hasNext()) {
                final Map.Entry<String, JsonNode> entry = it.next();
                if (!entry.getValue().isTextual()) {
                    throw fail("values of '" + field + "' must be strings");
                }
                result.put(entry.getKey().trim(), entry.getValue().asText().trim());
            }
            return result;
        }

        private UserException.MalformedRuleCatalog fail(final String message) {
            return new UserException.MalformedRuleCatalog(source, message);
        }
    }
}
