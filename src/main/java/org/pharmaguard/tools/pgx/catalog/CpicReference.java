package org.pharmaguard.tools.pgx.catalog;

/**
 * Curated CPIC guideline citation for a gene-drug pair.
 *
 * @param doi may be {@code null}
 */
public record CpicReference(String gene,
                            String drug,
                            String guideline,
                            String authors,
                            int year,
                            String pmid,
                            String doi,
                            String evidenceLevel) {
}
