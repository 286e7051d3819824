package org.pharmaguard.tools.pgx;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Strength with which a concurrent medication inhibits a gene's enzyme. Declaration order is weakest first,
 * so {@link #compareTo} orders by strength.
 */
public enum InhibitorStrength {
    NONE("none"),
    WEAK("weak"),
    MODERATE("moderate"),
    STRONG("strong");

    private final String label;

    InhibitorStrength(final String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isStrongerThan(final InhibitorStrength other) {
        return compareTo(other) > 0;
    }

    public static InhibitorStrength strongest(final InhibitorStrength a, final InhibitorStrength b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static Optional<InhibitorStrength> fromLabel(final String text) {
        if (text == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(s -> s.label.equalsIgnoreCase(text.trim())).findFirst();
    }
}
