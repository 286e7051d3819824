package org.pharmaguard.tools.pgx;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Zygosity {
    HETEROZYGOUS("heterozygous"),
    HOMOZYGOUS("homozygous");

    private final String label;

    Zygosity(final String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
