package org.pharmaguard.tools.pgx.evidence;

import java.util.Optional;

/**
 * A dynamic, externally maintained table of gene-drug evidence.
 */
public interface EvidenceAnnotationSource {

    /**
     * A source with no rows.
     */
    EvidenceAnnotationSource EMPTY = (gene, drug) -> Optional.empty();

    /**
     * @param gene gene symbol, e.g. {@code CYP2D6}
     * @param drug canonical upper-case drug name
     */
    Optional<EvidenceAnnotation> lookup(String gene, String drug);
}
