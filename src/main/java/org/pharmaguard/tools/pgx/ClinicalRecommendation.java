package org.pharmaguard.tools.pgx;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.pharmaguard.tools.pgx.evidence.EvidenceAnnotation;
import org.pharmaguard.tools.pgx.evidence.EvidenceSource;
import org.pharmaguard.utils.Utils;

import java.util.List;

/**
 * What to do about a drug, and the guideline evidence behind it.
 *
 * @param reference formatted citation, {@code null} when no real citation is on file
 */
@JsonPropertyOrder({"cpic_guideline", "action", "alternative_drugs", "monitoring", "evidence_level", "evidence_source",
        "fda_requirement", "reference"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClinicalRecommendation(@JsonProperty("cpic_guideline") String guideline,
                                     @JsonProperty("action") String action,
                                     @JsonProperty("alternative_drugs") List<String> alternativeDrugs,
                                     @JsonProperty("monitoring") String monitoring,
                                     @JsonProperty("evidence_level") String evidenceLevel,
                                     @JsonProperty("evidence_source") EvidenceSource evidenceSource,
                                     @JsonProperty("fda_requirement") String fdaRequirement,
                                     @JsonProperty("reference") String reference) {

    static final String CRITICAL_MONITORING = "Do NOT initiate therapy. Consult clinical pharmacist or pharmacogenomics specialist.";
    static final String HIGH_MONITORING = "Intensive monitoring required. Check labs frequently. Watch for adverse events.";
    static final String MODERATE_MONITORING = "Monitor patient response. Adjust dose as needed based on clinical outcome.";
    static final String UNKNOWN_RULE_MONITORING = "Insufficient curated evidence for this combination. "
            + "Use standard monitoring and seek specialist pharmacogenomic review.";
    static final String STANDARD_MONITORING = "Standard monitoring per drug label.";

    public ClinicalRecommendation {
        Utils.nonNull(guideline, "guideline");
        Utils.nonNull(action, "action");
        Utils.nonNull(monitoring, "monitoring");
        Utils.nonNull(evidenceLevel, "evidence level");
        Utils.nonNull(evidenceSource, "evidence source");
        Utils.nonNull(fdaRequirement, "FDA requirement");
        alternativeDrugs = List.copyOf(alternativeDrugs);
    }

    /**
     * Assembles a recommendation from the rule verdict and the resolved evidence. When phenoconversion shifted the
     * phenotype its note is put in front of the action.
     */
    public static ClinicalRecommendation build(final String gene,
                                               final String drug,
                                               final RiskRuleMatch match,
                                               final EvidenceAnnotation evidence,
                                               final PhenoconversionResult phenoconversion) {
        Utils.nonNull(match, "match");
        Utils.nonNull(evidence, "evidence");
        final String guideline = evidence.getGuideline() != null
                ? evidence.getGuideline()
                : String.format("No curated CPIC guideline mapping for %s and %s", drug, gene);
        final String action = phenoconversion != null && phenoconversion.isPhenotypeShifted()
                ? phenoconversion.getClinicalNote() + " " + match.action()
                : match.action();
        return new ClinicalRecommendation(guideline, action, match.alternatives(), monitoringFor(match),
                evidence.getEvidenceLevel(), evidence.getSource(), evidence.getFdaRequirement(),
                evidence.formatReference().orElse(null));
    }

    static String monitoringFor(final RiskRuleMatch match) {
        if (!match.isRuleCovered()) {
            return UNKNOWN_RULE_MONITORING;
        }
        switch (match.severity()) {
            case CRITICAL:
                return CRITICAL_MONITORING;
            case HIGH:
                return HIGH_MONITORING;
            case MODERATE:
                return MODERATE_MONITORING;
            default:
                return STANDARD_MONITORING;
        }
    }
}
