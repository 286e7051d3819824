package org.pharmaguard.tools.pgx;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.pharmaguard.tools.pgx.cohort.CohortMember;
import org.pharmaguard.tools.pgx.confidence.ConfidenceScore;
import org.pharmaguard.utils.Utils;

import java.util.Objects;

/**
 * Everything PharmaGuard reports for one (patient, drug) pair. Immutable.
 */
@JsonPropertyOrder({"patient_id", "drug", "timestamp", "risk_assessment", "pharmacogenomic_profile",
        "clinical_recommendation", "confidence", "phenoconversion", "quality_metrics", "decision_trace"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnalysisResult implements CohortMember {

    private final String patientId;
    private final String drug;
    private final String timestamp;
    private final RiskAssessment riskAssessment;
    private final PharmacogenomicProfile profile;
    private final ClinicalRecommendation recommendation;
    private final ConfidenceScore confidence;
    private final PhenoconversionResult phenoconversion;
    private final QualityMetrics qualityMetrics;
    private final DecisionTrace decisionTrace;

    public AnalysisResult(final String patientId,
                          final String drug,
                          final String timestamp,
                          final RiskAssessment riskAssessment,
                          final PharmacogenomicProfile profile,
                          final ClinicalRecommendation recommendation,
                          final ConfidenceScore confidence,
                          final PhenoconversionResult phenoconversion,
                          final QualityMetrics qualityMetrics,
                          final DecisionTrace decisionTrace) {
        this.patientId = Utils.nonEmpty(patientId, "patient id");
        this.drug = Utils.nonEmpty(drug, "drug");
        this.timestamp = Utils.nonNull(timestamp, "timestamp");
        this.riskAssessment = Utils.nonNull(riskAssessment, "risk assessment");
        this.profile = Utils.nonNull(profile, "profile");
        this.recommendation = Utils.nonNull(recommendation, "recommendation");
        this.confidence = Utils.nonNull(confidence, "confidence");
        this.phenoconversion = phenoconversion;
        this.qualityMetrics = Utils.nonNull(qualityMetrics, "quality metrics");
        this.decisionTrace = decisionTrace;
    }

    @Override
    @JsonProperty("patient_id")
    public String getPatientId() {
        return patientId;
    }

    @Override
    @JsonProperty("drug")
    public String getDrug() {
        return drug;
    }

    @JsonProperty("timestamp")
    public String getTimestamp() {
        return timestamp;
    }

    @JsonProperty("risk_assessment")
    public RiskAssessment getRiskAssessment() {
        return riskAssessment;
    }

    @JsonProperty("pharmacogenomic_profile")
    public PharmacogenomicProfile getProfile() {
        return profile;
    }

    @JsonProperty("clinical_recommendation")
    public ClinicalRecommendation getRecommendation() {
        return recommendation;
    }

    @JsonProperty("confidence")
    public ConfidenceScore getConfidence() {
        return confidence;
    }

    /**
     * @return the phenoconversion check of the primary gene, {@code null} for unsupported drugs
     */
    @JsonProperty("phenoconversion")
    public PhenoconversionResult getPhenoconversion() {
        return phenoconversion;
    }

    @JsonProperty("quality_metrics")
    public QualityMetrics getQualityMetrics() {
        return qualityMetrics;
    }

    @JsonProperty("decision_trace")
    public DecisionTrace getDecisionTrace() {
        return decisionTrace == null || !decisionTrace.isEnabled() ? null : decisionTrace;
    }

    @Override
    @JsonIgnore
    public RiskLabel getRiskLabel() {
        return riskAssessment.riskLabel();
    }

    @Override
    @JsonIgnore
    public Severity getSeverity() {
        return riskAssessment.severity();
    }

    @Override
    @JsonIgnore
    public boolean isHighRisk() {
        return CohortMember.super.isHighRisk();
    }

    @JsonIgnore
    public boolean isRuleCovered() {
        return qualityMetrics.ruleCoverage();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final AnalysisResult that = (AnalysisResult) o;
        return patientId.equals(that.patientId) && drug.equals(that.drug) && timestamp.equals(that.timestamp)
                && riskAssessment.equals(that.riskAssessment) && profile.equals(that.profile)
                && recommendation.equals(that.recommendation) && confidence.equals(that.confidence)
                && Objects.equals(phenoconversion, that.phenoconversion) && qualityMetrics.equals(that.qualityMetrics)
                && Objects.equals(getDecisionTrace(), that.getDecisionTrace());
    }

    @Override
    public int hashCode() {
        return Objects.hash(patientId, drug, timestamp, riskAssessment, profile, recommendation, confidence,
                phenoconversion, qualityMetrics, getDecisionTrace());
    }

    @Override
    public String toString() {
        return patientId + "/" + drug + ": " + riskAssessment.riskLabel().getLabel() + " ("
                + riskAssessment.severity().getLabel() + ", confidence " + riskAssessment.confidenceScore() + ")";
    }
}
