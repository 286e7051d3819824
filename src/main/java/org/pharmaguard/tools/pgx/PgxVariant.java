package org.pharmaguard.tools.pgx;

import org.pharmaguard.utils.Utils;

/**
 * A variant record that survived quality filtering, annotated with its pharmacogene and star allele where
 * those could be resolved.
 *
 * @param chromosome  contig name as written in the VCF
 * @param position    1-based position
 * @param rsid        identifier from the ID column or INFO/RS, or a synthetic {@code chr<contig>:<pos>} id
 * @param ref         reference allele
 * @param alt         alternate allele(s), comma separated
 * @param quality     phred-scaled QUAL; a missing QUAL is 0
 * @param genotype    classified genotype of the sample
 * @param rawGenotype genotype string of the sample (e.g. {@code 0|1})
 * @param gene        resolved gene symbol, or {@code null}
 * @param starAllele  resolved star allele, or {@code null}
 * @param function    functional annotation of the star allele, or {@code null}
 */
public record PgxVariant(String chromosome,
                         int position,
                         String rsid,
                         String ref,
                         String alt,
                         double quality,
                         GenotypeCall genotype,
                         String rawGenotype,
                         String gene,
                         String starAllele,
                         AlleleFunction function) {

    public PgxVariant {
        Utils.nonNull(chromosome, "chromosome");
        Utils.nonNull(rsid, "rsid");
        Utils.nonNull(genotype, "genotype");
    }

    /**
     * @return true when both the gene and the star allele are known.
     */
    public boolean isAnnotated() {
        return gene != null && !gene.isEmpty() && starAllele != null && !starAllele.isEmpty();
    }

    public boolean isReferenceCall() {
        return genotype == GenotypeCall.HOM_REF;
    }
}
