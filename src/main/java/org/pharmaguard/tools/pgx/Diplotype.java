package org.pharmaguard.tools.pgx;

import org.pharmaguard.utils.Utils;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The ordered pair of star alleles called for one gene, together with the non-reference calls that support it.
 */
public final class Diplotype {

    private final String gene;
    private final String firstAllele;
    private final String secondAllele;
    private final List<DetectedVariant> supportingVariants;

    public Diplotype(final String gene, final String firstAllele, final String secondAllele,
                     final List<DetectedVariant> supportingVariants) {
        this.gene = Utils.nonEmpty(gene, "gene");
        this.firstAllele = Utils.nonEmpty(firstAllele, "first allele");
        this.secondAllele = Utils.nonEmpty(secondAllele, "second allele");
        this.supportingVariants = Collections.unmodifiableList(Utils.nonNull(supportingVariants));
    }

    /**
     * Homozygous wild-type diplotype, used for genes with no retained non-reference call.
     */
    public static Diplotype wildType(final String gene, final String wildTypeAllele) {
        return new Diplotype(gene, wildTypeAllele, wildTypeAllele, Collections.emptyList());
    }

    public String getGene() {
        return gene;
    }

    public String getFirstAllele() {
        return firstAllele;
    }

    public String getSecondAllele() {
        return secondAllele;
    }

    public List<DetectedVariant> getSupportingVariants() {
        return supportingVariants;
    }

    public boolean isWildType(final String wildTypeAllele) {
        return firstAllele.equals(wildTypeAllele) && secondAllele.equals(wildTypeAllele);
    }

    /**
     * @return the diplotype in star notation, e.g. {@code *1/*4}.
     */
    public String toDiplotypeString() {
        return firstAllele + "/" + secondAllele;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Diplotype that = (Diplotype) o;
        return gene.equals(that.gene) && firstAllele.equals(that.firstAllele)
                && secondAllele.equals(that.secondAllele) && supportingVariants.equals(that.supportingVariants);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gene, firstAllele, secondAllele, supportingVariants);
    }

    @Override
    public String toString() {
        return gene + " " + toDiplotypeString();
    }
}
