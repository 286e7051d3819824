package org.pharmaguard.tools.pgx.catalog;

import org.pharmaguard.tools.pgx.AlleleFunction;

/**
 * Maps a defining variant (by rsID) to the star allele it tags.
 */
public record StarAlleleDefinition(String rsid, String gene, String starAllele, AlleleFunction function) {
}
