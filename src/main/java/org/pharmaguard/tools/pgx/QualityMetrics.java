package org.pharmaguard.tools.pgx;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Input quality and provenance of one analysis.
 */
@JsonPropertyOrder({"vcf_parsing_success", "vcf_quality_score", "variants_analyzed", "records_skipped",
        "annotation_completeness", "rule_coverage", "confidence_level", "analysis_version", "clinical_rules_version"})
public record QualityMetrics(@JsonProperty("vcf_parsing_success") boolean vcfParsingSuccess,
                             @JsonProperty("vcf_quality_score") double vcfQualityScore,
                             @JsonProperty("variants_analyzed") int variantsAnalyzed,
                             @JsonProperty("records_skipped") int recordsSkipped,
                             @JsonProperty("annotation_completeness") double annotationCompleteness,
                             @JsonProperty("rule_coverage") boolean ruleCoverage,
                             @JsonProperty("confidence_level") String confidenceLevel,
                             @JsonProperty("analysis_version") String analysisVersion,
                             @JsonProperty("clinical_rules_version") String clinicalRulesVersion) {
}
