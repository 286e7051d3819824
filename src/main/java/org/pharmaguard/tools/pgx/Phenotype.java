package org.pharmaguard.tools.pgx;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Functional metabolizer class of a pharmacogene.
 */
public enum Phenotype {
    PM("PM", "Poor Metabolizer"),
    IM("IM", "Intermediate Metabolizer"),
    NM("NM", "Normal Metabolizer"),
    RM("RM", "Rapid Metabolizer"),
    URM("URM", "Ultrarapid Metabolizer"),
    UNKNOWN("Unknown", "Unknown");

    private final String label;
    private final String description;

    Phenotype(final String label, final String description) {
        this.label = label;
        this.description = description;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Case-insensitive lookup by short label ({@code "IM"}) or description ({@code "Intermediate Metabolizer"}).
     */
    public static Optional<Phenotype> fromLabel(final String text) {
        if (text == null) {
            return Optional.empty();
        }
        final String trimmed = text.trim();
        return Arrays.stream(values())
                .filter(p -> p.label.equalsIgnoreCase(trimmed) || p.description.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
