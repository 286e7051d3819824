package org.pharmaguard.tools.pgx;

import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pharmaguard.tools.pgx.catalog.RuleCatalog;
import org.pharmaguard.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds exactly one {@link Diplotype} per target gene from the filtered variants.
 * <p>
 * Only annotated, non-reference calls of a non-wild-type star allele contribute: a het call adds its allele once,
 * a hom-var call twice. Genes with no contributing call get the wild-type pair. A single allele is paired with the
 * wild-type allele ({@code *1/*4}); otherwise alleles are ordered by functional impact, highest first, stable for
 * equal impact, and the first two form the diplotype.
 * </p>
 */
public final class DiplotypeAssembler {

    private static final Logger logger = LogManager.getLogger(DiplotypeAssembler.class);

    private final RuleCatalog catalog;

    public DiplotypeAssembler(final RuleCatalog catalog) {
        this.catalog = Utils.nonNull(catalog, "catalog");
    }

    /**
     * @return diplotypes keyed by gene, in the catalog's target gene order
     */
    public Map<String, Diplotype> assemble(final List<PgxVariant> variants) {
        Utils.nonNull(variants, "variants");
        final Map<String, Diplotype> diplotypes = new LinkedHashMap<>();
        for (final String gene : catalog.getTargetGenes()) {
            diplotypes.put(gene, assembleGene(gene, variants));
        }
        return Collections.unmodifiableMap(diplotypes);
    }

    @VisibleForTesting
    Diplotype assembleGene(final String gene, final List<PgxVariant> variants) {
        final String wildType = catalog.getWildTypeAllele();
        final List<DetectedVariant> detected = new ArrayList<>();
        final List<DetectedVariant> alleleCopies = new ArrayList<>();
        for (final PgxVariant variant : variants) {
            if (!contributesAllele(variant, gene, wildType)) {
                continue;
            }
            final Zygosity zygosity = variant.genotype() == GenotypeCall.HOM_VAR ? Zygosity.HOMOZYGOUS : Zygosity.HETEROZYGOUS;
            final DetectedVariant call = new DetectedVariant(variant.rsid(), gene, variant.starAllele(), zygosity, variant.function());
            detected.add(call);
            alleleCopies.add(call);
            if (zygosity == Zygosity.HOMOZYGOUS) {
                alleleCopies.add(call);
            }
        }

        if (alleleCopies.isEmpty()) {
            return Diplotype.wildType(gene, wildType);
        }
        if (alleleCopies.size() == 1) {
            return new Diplotype(gene, wildType, alleleCopies.get(0).getStarAllele(), detected);
        }

        final List<DetectedVariant> ordered = new ArrayList<>(alleleCopies);
        // List.sort is stable, so equal-impact alleles keep their input order.
        ordered.sort(Comparator.comparingInt(DiplotypeAssembler::impactOf).reversed());
        if (ordered.size() > 2) {
            logger.warn(String.format("%s has %d non-reference allele copies; keeping the two with highest impact (%s, %s)",
                    gene, ordered.size(), ordered.get(0).getStarAllele(), ordered.get(1).getStarAllele()));
        }
        return new Diplotype(gene, ordered.get(0).getStarAllele(), ordered.get(1).getStarAllele(), detected);
    }

    /**
     * Reference calls and wild-type alleles never contribute, whatever else the record says.
     */
    static boolean contributesAllele(final PgxVariant variant, final String gene, final String wildType) {
        return gene.equals(variant.gene())
                && variant.isAnnotated()
                && variant.genotype().carriesAlternate()
                && !wildType.equals(variant.starAllele());
    }

    private static int impactOf(final DetectedVariant variant) {
        return variant.getFunction() == null ? AlleleFunction.UNCERTAIN.getImpact() : variant.getFunction().getImpact();
    }
}
