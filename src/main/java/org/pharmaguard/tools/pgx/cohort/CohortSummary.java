package org.pharmaguard.tools.pgx.cohort;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.pharmaguard.tools.pgx.RiskLabel;
import org.pharmaguard.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Risk distribution over a batch of per-drug results.
 * <p>
 * Summaries of disjoint partitions {@link #combine} into the summary of their union, so a cohort can be folded in
 * parallel. Nothing here depends on input order.
 * </p>
 */
@JsonPropertyOrder({"cohort_size", "patient_count", "risk_matrix", "high_risk_patients", "high_risk_count", "alert"})
public final class CohortSummary {

    static final String ALERT_FORMAT = "%d patient(s) require immediate clinical review";

    private static final CohortSummary EMPTY = new CohortSummary(0, new TreeSet<>(), new TreeSet<>(), new TreeMap<>());

    private final long resultCount;
    private final SortedSet<String> patients;
    private final SortedSet<String> highRiskPatients;
    private final SortedMap<String, Map<RiskLabel, Long>> riskMatrix;

    private CohortSummary(final long resultCount,
                          final SortedSet<String> patients,
                          final SortedSet<String> highRiskPatients,
                          final SortedMap<String, Map<RiskLabel, Long>> riskMatrix) {
        this.resultCount = resultCount;
        this.patients = Collections.unmodifiableSortedSet(patients);
        this.highRiskPatients = Collections.unmodifiableSortedSet(highRiskPatients);
        this.riskMatrix = Collections.unmodifiableSortedMap(riskMatrix);
    }

    public static CohortSummary empty() {
        return EMPTY;
    }

    public static CohortSummary of(final CohortMember member) {
        Utils.nonNull(member, "member");
        final SortedSet<String> highRisk = new TreeSet<>();
        if (member.isHighRisk()) {
            highRisk.add(member.getPatientId());
        }
        final Map<RiskLabel, Long> counts = zeroCounts();
        counts.put(member.getRiskLabel(), 1L);
        final SortedMap<String, Map<RiskLabel, Long>> matrix = new TreeMap<>();
        matrix.put(member.getDrug(), counts);
        return new CohortSummary(1, new TreeSet<>(Collections.singleton(member.getPatientId())), highRisk, matrix);
    }

    /**
     * @return the summary of both inputs together
     */
    public CohortSummary combine(final CohortSummary other) {
        Utils.nonNull(other, "other");
        final SortedSet<String> mergedPatients = new TreeSet<>(patients);
        mergedPatients.addAll(other.patients);
        final SortedSet<String> mergedHighRisk = new TreeSet<>(highRiskPatients);
        mergedHighRisk.addAll(other.highRiskPatients);
        final SortedMap<String, Map<RiskLabel, Long>> mergedMatrix = new TreeMap<>();
        for (final Map<String, Map<RiskLabel, Long>> source : List.of(riskMatrix, other.riskMatrix)) {
            source.forEach((drug, counts) -> {
                final Map<RiskLabel, Long> target = mergedMatrix.computeIfAbsent(drug, d -> zeroCounts());
                counts.forEach((label, n) -> target.merge(label, n, Long::sum));
            });
        }
        return new CohortSummary(resultCount + other.resultCount, mergedPatients, mergedHighRisk, mergedMatrix);
    }

    private static Map<RiskLabel, Long> zeroCounts() {
        final Map<RiskLabel, Long> counts = new EnumMap<>(RiskLabel.class);
        for (final RiskLabel label : RiskLabel.values()) {
            counts.put(label, 0L);
        }
        return counts;
    }

    /**
     * @return number of per-drug results folded in
     */
    @JsonProperty("cohort_size")
    public long getCohortSize() {
        return resultCount;
    }

    @JsonProperty("patient_count")
    public int getPatientCount() {
        return patients.size();
    }

    @JsonProperty("high_risk_patients")
    public List<String> getHighRiskPatients() {
        return new ArrayList<>(highRiskPatients);
    }

    @JsonProperty("high_risk_count")
    public int getHighRiskCount() {
        return highRiskPatients.size();
    }

    @JsonProperty("alert")
    public String getAlert() {
        return String.format(ALERT_FORMAT, highRiskPatients.size());
    }

    /**
     * @return drug to risk label to count; every label is present for every drug
     */
    @JsonProperty("risk_matrix")
    public Map<String, Map<String, Long>> getRiskMatrix() {
        final Map<String, Map<String, Long>> view = new LinkedHashMap<>();
        riskMatrix.forEach((drug, counts) -> {
            final Map<String, Long> row = new LinkedHashMap<>();
            counts.forEach((label, n) -> row.put(label.getLabel(), n));
            view.put(drug, row);
        });
        return view;
    }

    public long count(final String drug, final RiskLabel label) {
        final Map<RiskLabel, Long> counts = riskMatrix.get(drug);
        return counts == null ? 0 : counts.getOrDefault(label, 0L);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final CohortSummary that = (CohortSummary) o;
        return resultCount == that.resultCount && patients.equals(that.patients)
                && highRiskPatients.equals(that.highRiskPatients) && riskMatrix.equals(that.riskMatrix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resultCount, patients, highRiskPatients, riskMatrix);
    }

    @Override
    public String toString() {
        return "CohortSummary{results=" + resultCount + ", patients=" + patients.size() + ", highRisk=" + highRiskPatients + "}";
    }
}
