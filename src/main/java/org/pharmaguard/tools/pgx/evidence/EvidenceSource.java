package org.pharmaguard.tools.pgx.evidence;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where an {@link EvidenceAnnotation} came from.
 */
public enum EvidenceSource {
    PHARMGKB("PharmGKB"),
    CPIC_CURATED("CPIC curated"),
    NONE("none");

    private final String label;

    EvidenceSource(final String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
