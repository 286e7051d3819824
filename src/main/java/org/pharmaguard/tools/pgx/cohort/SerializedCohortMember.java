package org.pharmaguard.tools.pgx.cohort;

import com.fasterxml.jackson.databind.JsonNode;
import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.tools.pgx.RiskLabel;
import org.pharmaguard.tools.pgx.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * A cohort member read back from a previously written analysis result.
 */
public record SerializedCohortMember(String patientId, String drug, RiskLabel riskLabel, Severity severity) implements CohortMember {

    @Override
    public String getPatientId() { return patientId; }

    @Override
    public String getDrug() { return drug; }

    @Override
    public RiskLabel getRiskLabel() { return riskLabel; }

    @Override
    public Severity getSeverity() { return severity; }

    /**
     * Reads the members in {@code root}, which is either one result object or an array of them.
     *
     * @throws UserException.MalformedFile if a result lacks a field the cohort fold needs
     */
    public static List<SerializedCohortMember> fromJson(final String source, final JsonNode root) {
        final List<SerializedCohortMember> members = new ArrayList<>();
        if (root.isArray()) {
            int index = 0;
            for (final JsonNode element : root) {
                members.add(fromResult(source + "[" + index++ + "]", element));
            }
        } else {
            members.add(fromResult(source, root));
        }
        return members;
    }

    private static SerializedCohortMember fromResult(final String source, final JsonNode result) {
        final String patientId = requiredText(source, result, "patient_id");
        final String drug = requiredText(source, result, "drug");
        final JsonNode assessment = result.path("risk_assessment");
        final String labelText = requiredText(source, assessment, "risk_label");
        final String severityText = requiredText(source, assessment, "severity");
        final RiskLabel label = RiskLabel.fromLabel(labelText)
                .orElseThrow(() -> new UserException.MalformedFile(source, "unknown risk label " + labelText));
        final Severity severity = Severity.fromLabel(severityText)
                .orElseThrow(() -> new UserException.MalformedFile(source, "unknown severity " + severityText));
        return new SerializedCohortMember(patientId, drug, label, severity);
    }

    private static String requiredText(final String source, final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new UserException.MalformedFile(source, "missing text field " + field);
        }
        return value.asText();
    }
}
