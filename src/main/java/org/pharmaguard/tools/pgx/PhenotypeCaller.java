package org.pharmaguard.tools.pgx;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pharmaguard.tools.pgx.catalog.ActivityScoreTable;
import org.pharmaguard.tools.pgx.catalog.RuleCatalog;
import org.pharmaguard.utils.Utils;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Calls a metabolizer phenotype from a diplotype by summing per-allele activity scores and classifying the sum
 * with the gene's breakpoints. An allele missing from the gene's table makes the call Unknown; nothing is guessed.
 * A defaulted wild-type diplotype reports the gene's default phenotype.
 */
public final class PhenotypeCaller {

    private static final Logger logger = LogManager.getLogger(PhenotypeCaller.class);

    private final RuleCatalog catalog;

    public PhenotypeCaller(final RuleCatalog catalog) {
        this.catalog = Utils.nonNull(catalog, "catalog");
    }

    public PhenotypeCall call(final Diplotype diplotype) {
        Utils.nonNull(diplotype, "diplotype");
        final String gene = diplotype.getGene();
        final Optional<ActivityScoreTable> table = catalog.activityTable(gene);
        if (table.isEmpty()) {
            logger.debug("No activity table for " + gene + "; phenotype is Unknown");
            return PhenotypeCall.unknown(gene, diplotype);
        }

        final OptionalDouble first = table.get().alleleScore(diplotype.getFirstAllele());
        final OptionalDouble second = table.get().alleleScore(diplotype.getSecondAllele());
        final boolean scored = first.isPresent() && second.isPresent();
        final double score = scored ? first.getAsDouble() + second.getAsDouble() : Double.NaN;

        if (diplotype.getSupportingVariants().isEmpty() && diplotype.isWildType(catalog.getWildTypeAllele())) {
            return new PhenotypeCall(gene, diplotype, table.get().getDefaultPhenotype(), score, true);
        }
        if (!scored) {
            logger.debug(String.format("Diplotype %s has an allele without an activity score; phenotype is Unknown", diplotype));
            return PhenotypeCall.unknown(gene, diplotype);
        }
        return new PhenotypeCall(gene, diplotype, table.get().classify(score), score, false);
    }
}
