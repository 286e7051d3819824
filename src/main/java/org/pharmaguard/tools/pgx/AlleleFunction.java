package org.pharmaguard.tools.pgx;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Functional annotation of a star allele. {@link #getImpact()} ranks alleles for diplotype ordering:
 * loss of function first, then reduced, then increased, then normal or unannotated.
 */
public enum AlleleFunction {
    NO_FUNCTION("No function", 3),
    DECREASED("Decreased function", 2),
    INCREASED("Increased function", 1),
    NORMAL("Normal function", 0),
    UNCERTAIN("Uncertain function", 0);

    private final String label;
    private final int impact;

    AlleleFunction(final String label, final int impact) {
        this.label = label;
        this.impact = impact;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getImpact() {
        return impact;
    }

    /**
     * Accepts the full label ({@code "No function"}), the leading word ({@code "No"}) or the constant name.
     */
    public static Optional<AlleleFunction> fromLabel(final String text) {
        if (text == null) {
            return Optional.empty();
        }
        final String trimmed = text.trim();
        return Arrays.stream(values())
                .filter(f -> f.label.equalsIgnoreCase(trimmed)
                        || f.label.split(" ")[0].equalsIgnoreCase(trimmed)
                        || f.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
