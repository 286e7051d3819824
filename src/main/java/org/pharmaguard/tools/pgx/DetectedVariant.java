package org.pharmaguard.tools.pgx;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.pharmaguard.utils.Utils;

import java.util.Objects;

/**
 * A non-reference star allele call reported in the pharmacogenomic profile.
 */
@JsonPropertyOrder({"rsid", "gene", "star_allele", "zygosity", "function", "clinical_significance"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DetectedVariant {

    private final String rsid;
    private final String gene;
    private final String starAllele;
    private final Zygosity zygosity;
    private final AlleleFunction function;

    public DetectedVariant(final String rsid, final String gene, final String starAllele,
                           final Zygosity zygosity, final AlleleFunction function) {
        this.rsid = Utils.nonNull(rsid);
        this.gene = Utils.nonEmpty(gene, "gene");
        this.starAllele = Utils.nonEmpty(starAllele, "star allele");
        this.zygosity = Utils.nonNull(zygosity);
        this.function = function;
    }

    @JsonProperty("rsid")
    public String getRsid() {
        return rsid;
    }

    @JsonProperty("gene")
    public String getGene() {
        return gene;
    }

    @JsonProperty("star_allele")
    public String getStarAllele() {
        return starAllele;
    }

    @JsonProperty("zygosity")
    public Zygosity getZygosity() {
        return zygosity;
    }

    @JsonProperty("function")
    public AlleleFunction getFunction() {
        return function;
    }

    /**
     * Human-readable significance derived from the functional annotation.
     */
    @JsonProperty("clinical_significance")
    public String getClinicalSignificance() {
        if (function == null) {
            return "Variant of uncertain significance";
        }
        switch (function) {
            case NO_FUNCTION:
                return "Loss-of-function variant";
            case DECREASED:
                return "Reduced function variant";
            case INCREASED:
                return "Gain-of-function variant";
            case NORMAL:
                return "Normal function variant";
            default:
                return "Variant of uncertain significance";
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final DetectedVariant that = (DetectedVariant) o;
        return rsid.equals(that.rsid) && gene.equals(that.gene) && starAllele.equals(that.starAllele)
                && zygosity == that.zygosity && function == that.function;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rsid, gene, starAllele, zygosity, function);
    }

    @Override
    public String toString() {
        return gene + " " + starAllele + " (" + rsid + ", " + zygosity.getLabel() + ")";
    }
}
