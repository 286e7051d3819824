package org.pharmaguard.tools.pgx;

import org.pharmaguard.utils.Utils;

import java.util.List;

/**
 * What to analyze for one patient.
 *
 * @param patientId             may be {@code null}; the VCF sample name is used then
 * @param drugs                 free-text drug names
 * @param concurrentMedications free-text names of the other medications the patient takes
 * @param traceEnabled          whether results carry a {@link DecisionTrace}
 */
public record AnalysisRequest(String patientId, List<String> drugs, List<String> concurrentMedications, boolean traceEnabled) {

    public AnalysisRequest {
        drugs = List.copyOf(Utils.nonNull(drugs, "drugs"));
        concurrentMedications = List.copyOf(Utils.nonNull(concurrentMedications, "concurrent medications"));
    }

    public static AnalysisRequest of(final String patientId, final String drugs, final String concurrentMedications) {
        return new AnalysisRequest(patientId, Utils.splitCommaSeparated(drugs), ConcurrentMedication.parseList(concurrentMedications), false);
    }

    public AnalysisRequest withTrace(final boolean enabled) {
        return new AnalysisRequest(patientId, drugs, concurrentMedications, enabled);
    }
}
