package org.pharmaguard.tools.pgx;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum RiskLabel {
    SAFE("Safe"),
    ADJUST_DOSAGE("Adjust Dosage"),
    TOXIC("Toxic"),
    INEFFECTIVE("Ineffective"),
    UNKNOWN("Unknown");

    private final String label;

    RiskLabel(final String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Optional<RiskLabel> fromLabel(final String text) {
        if (text == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(r -> r.label.equalsIgnoreCase(text.trim())).findFirst();
    }
}
