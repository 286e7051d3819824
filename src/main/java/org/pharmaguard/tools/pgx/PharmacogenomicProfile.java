package org.pharmaguard.tools.pgx;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.pharmaguard.utils.Utils;

import java.util.List;

/**
 * Genotype-derived view of the drug's primary gene.
 *
 * @param phenotype           genetic phenotype called from the diplotype
 * @param functionalPhenotype phenotype after phenoconversion; equals {@code phenotype} when nothing shifted it
 * @param activityScore       summed activity score, {@code null} when the phenotype is Unknown
 */
@JsonPropertyOrder({"primary_gene", "diplotype", "phenotype", "functional_phenotype", "activity_score", "detected_variants"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PharmacogenomicProfile(@JsonProperty("primary_gene") String primaryGene,
                                     @JsonProperty("diplotype") String diplotype,
                                     @JsonProperty("phenotype") Phenotype phenotype,
                                     @JsonProperty("functional_phenotype") Phenotype functionalPhenotype,
                                     @JsonProperty("activity_score") Double activityScore,
                                     @JsonProperty("detected_variants") List<DetectedVariant> detectedVariants) {

    public static final String NO_GENE = "NONE";
    public static final String NO_DIPLOTYPE = "N/A";

    public PharmacogenomicProfile {
        Utils.nonNull(primaryGene, "primary gene");
        Utils.nonNull(diplotype, "diplotype");
        Utils.nonNull(phenotype, "phenotype");
        Utils.nonNull(functionalPhenotype, "functional phenotype");
        detectedVariants = List.copyOf(detectedVariants);
    }

    /**
     * Profile reported for a drug no catalog gene is mapped to.
     */
    public static PharmacogenomicProfile unsupportedDrug() {
        return new PharmacogenomicProfile(NO_GENE, NO_DIPLOTYPE, Phenotype.UNKNOWN, Phenotype.UNKNOWN, null, List.of());
    }
}
