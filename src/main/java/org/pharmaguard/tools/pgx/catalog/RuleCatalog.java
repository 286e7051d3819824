package org.pharmaguard.tools.pgx.catalog;

import org.pharmaguard.tools.pgx.InhibitorStrength;
import org.pharmaguard.tools.pgx.Phenotype;
import org.pharmaguard.tools.pgx.RiskRule;
import org.pharmaguard.tools.pgx.confidence.CalibrationBin;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Versioned, read-only pharmacogenomic rule tables. Instances are built and validated by
 * {@link RuleCatalogLoader} and never change afterwards, so one catalog can be shared by any number of concurrent
 * analyses. Pass the catalog explicitly to the components that need it; there is no global instance.
 */
public final class RuleCatalog {

    private final String version;
    private final List<String> targetGenes;
    private final String wildTypeAllele;
    private final Map<String, String> supportedDrugs;
    private final Map<String, String> drugAliases;
    private final Map<String, StarAlleleDefinition> starAllelesByRsid;
    private final Map<String, StarAlleleDefinition> starAllelesByGeneAndName;
    private final Map<String, ActivityScoreTable> activityTables;
    private final Map<String, Map<String, InhibitorStrength>> inhibitors;
    private final Map<InhibitorStrength, Double> phenoconversionPenalties;
    private final Map<String, RiskRule> riskRules;
    private final Map<String, Double> evidenceTierScores;
    private final Map<String, CpicReference> cpicReferences;
    private final ConfidenceModel confidenceModel;
    private final List<CalibrationBin> calibrationBins;

    RuleCatalog(final String version,
                final List<String> targetGenes,
                final String wildTypeAllele,
                final Map<String, String> supportedDrugs,
                final Map<String, String> drugAliases,
                final List<StarAlleleDefinition> starAlleles,
                final Map<String, ActivityScoreTable> activityTables,
                final Map<String, Map<String, InhibitorStrength>> inhibitors,
                final Map<InhibitorStrength, Double> phenoconversionPenalties,
                final List<RiskRule> riskRules,
                final Map<String, Double> evidenceTierScores,
                final List<CpicReference> cpicReferences,
                final ConfidenceModel confidenceModel,
                final List<CalibrationBin> calibrationBins) {
        this.version = version;
        this.targetGenes = List.copyOf(targetGenes);
        this.wildTypeAllele = wildTypeAllele;
        this.supportedDrugs = Collections.unmodifiableMap(new LinkedHashMap<>(supportedDrugs));
        this.drugAliases = Collections.unmodifiableMap(new LinkedHashMap<>(drugAliases));

        final Map<String, StarAlleleDefinition> byRsid = new LinkedHashMap<>();
        final Map<String, StarAlleleDefinition> byName = new LinkedHashMap<>();
        for (final StarAlleleDefinition definition : starAlleles) {
            byRsid.put(definition.rsid(), definition);
            byName.putIfAbsent(starAlleleKey(definition.gene(), definition.starAllele()), definition);
        }
        this.starAllelesByRsid = Collections.unmodifiableMap(byRsid);
        this.starAllelesByGeneAndName = Collections.unmodifiableMap(byName);

        this.activityTables = Collections.unmodifiableMap(new LinkedHashMap<>(activityTables));
        final Map<String, Map<String, InhibitorStrength>> inhibitorCopy = new LinkedHashMap<>();
        inhibitors.forEach((gene, table) -> inhibitorCopy.put(gene, Collections.unmodifiableMap(new LinkedHashMap<>(table))));
        this.inhibitors = Collections.unmodifiableMap(inhibitorCopy);
        this.phenoconversionPenalties = Collections.unmodifiableMap(new EnumMap<>(phenoconversionPenalties));

        final Map<String, RiskRule> rules = new LinkedHashMap<>();
        riskRules.forEach(rule -> rules.put(rule.key(), rule));
        this.riskRules = Collections.unmodifiableMap(rules);

        this.evidenceTierScores = Collections.unmodifiableMap(new LinkedHashMap<>(evidenceTierScores));
        final Map<String, CpicReference> references = new LinkedHashMap<>();
        cpicReferences.forEach(ref -> references.put(pairKey(ref.gene(), ref.drug()), ref));
        this.cpicReferences = Collections.unmodifiableMap(references);
        this.confidenceModel = confidenceModel;
        this.calibrationBins = List.copyOf(calibrationBins);
    }

    /**
     * Loads the catalog bundled with PharmaGuard.
     */
    public static RuleCatalog loadDefault() {
        return RuleCatalogLoader.loadDefault();
    }

    public String getVersion() {
        return version;
    }

    public List<String> getTargetGenes() {
        return targetGenes;
    }

    public boolean isTargetGene(final String gene) {
        return gene != null && targetGenes.contains(gene);
    }

    public String getWildTypeAllele() {
        return wildTypeAllele;
    }

    /**
     * @return canonical drug name to primary gene, in catalog order.
     */
    public Map<String, String> getSupportedDrugs() {
        return supportedDrugs;
    }

    public Optional<String> primaryGene(final String canonicalDrug) {
        return Optional.ofNullable(supportedDrugs.get(canonicalDrug));
    }

    /**
     * @return upper-case alias to canonical drug name.
     */
    public Map<String, String> getDrugAliases() {
        return drugAliases;
    }

    public Optional<StarAlleleDefinition> starAlleleByRsid(final String rsid) {
        return rsid == null ? Optional.empty() : Optional.ofNullable(starAllelesByRsid.get(rsid));
    }

    public Optional<StarAlleleDefinition> starAllele(final String gene, final String starAllele) {
        return Optional.ofNullable(starAllelesByGeneAndName.get(starAlleleKey(gene, starAllele)));
    }

    public Optional<ActivityScoreTable> activityTable(final String gene) {
        return Optional.ofNullable(activityTables.get(gene));
    }

    /**
     * @return true if the catalog lists inhibitors for the gene, i.e. phenoconversion is modeled for it.
     */
    public boolean modelsInhibitorsFor(final String gene) {
        return inhibitors.containsKey(gene);
    }

    public Map<String, Map<String, InhibitorStrength>> getInhibitors() {
        return inhibitors;
    }

    /**
     * Inhibitor strength of a medication for a gene; names are compared case-insensitively and unknown names are
     * {@link InhibitorStrength#NONE}.
     */
    public InhibitorStrength inhibitorStrength(final String gene, final String medication) {
        final Map<String, InhibitorStrength> table = inhibitors.get(gene);
        if (table == null || medication == null) {
            return InhibitorStrength.NONE;
        }
        return table.getOrDefault(normalizeMedication(medication), InhibitorStrength.NONE);
    }

    public double phenoconversionPenalty(final InhibitorStrength strength) {
        return phenoconversionPenalties.getOrDefault(strength, 0.0);
    }

    public Optional<RiskRule> riskRule(final String gene, final Phenotype phenotype, final String drug) {
        return Optional.ofNullable(riskRules.get(RiskRule.key(gene, phenotype, drug)));
    }

    public Map<String, RiskRule> getRiskRules() {
        return riskRules;
    }

    public OptionalDouble evidenceTierScore(final String tier) {
        final Double score = tier == null ? null : evidenceTierScores.get(tier.toUpperCase(Locale.ROOT));
        return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
    }

    public Map<String, Double> getEvidenceTierScores() {
        return evidenceTierScores;
    }

    public Optional<CpicReference> cpicReference(final String gene, final String drug) {
        return Optional.ofNullable(cpicReferences.get(pairKey(gene, drug)));
    }

    public ConfidenceModel getConfidenceModel() {
        return confidenceModel;
    }

    /**
     * @return the calibration bins, empty when the catalog ships no calibration map.
     */
    public List<CalibrationBin> getCalibrationBins() {
        return calibrationBins;
    }

    static String normalizeMedication(final String medication) {
        return medication.trim().toLowerCase(Locale.ROOT);
    }

    private static String starAlleleKey(final String gene, final String starAllele) {
        return gene + "|" + starAllele;
    }

    private static String pairKey(final String gene, final String drug) {
        return gene + "|" + drug;
    }

    @Override
    public String toString() {
        return "RuleCatalog{version=" + version + ", genes=" + targetGenes + ", rules=" + riskRules.size() + "}";
    }
}
