package org.pharmaguard.tools.pgx;

import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pharmaguard.tools.pgx.catalog.RuleCatalog;
import org.pharmaguard.utils.Utils;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shifts a genetic phenotype to a functional phenotype when concurrent medications inhibit the gene's enzyme.
 * <p>
 * The shift depends only on the genetic phenotype and the strongest inhibitor detected, through a fixed
 * transition table. Weak inhibitors, and the absence of any, leave the phenotype unchanged. {@link Phenotype#UNKNOWN}
 * is never shifted.
 * </p>
 */
public final class PhenoconversionAdjuster {

    private static final Logger logger = LogManager.getLogger(PhenoconversionAdjuster.class);

    static final String NO_SIGNAL_NOTE = "No known inhibitor-based phenoconversion signal detected.";

    private static final Map<InhibitorStrength, Map<Phenotype, Phenotype>> DOWNGRADE_TABLE = buildDowngradeTable();

    private final RuleCatalog catalog;

    public PhenoconversionAdjuster(final RuleCatalog catalog) {
        this.catalog = Utils.nonNull(catalog, "catalog");
    }

    private static Map<InhibitorStrength, Map<Phenotype, Phenotype>> buildDowngradeTable() {
        final Map<Phenotype, Phenotype> strong = new EnumMap<>(Phenotype.class);
        strong.put(Phenotype.URM, Phenotype.NM);
        strong.put(Phenotype.RM, Phenotype.IM);
        strong.put(Phenotype.NM, Phenotype.IM);
        strong.put(Phenotype.IM, Phenotype.PM);
        strong.put(Phenotype.PM, Phenotype.PM);

        final Map<Phenotype, Phenotype> moderate = new EnumMap<>(Phenotype.class);
        moderate.put(Phenotype.URM, Phenotype.RM);
        moderate.put(Phenotype.RM, Phenotype.NM);
        moderate.put(Phenotype.NM, Phenotype.NM);
        moderate.put(Phenotype.IM, Phenotype.IM);
        moderate.put(Phenotype.PM, Phenotype.PM);

        final Map<InhibitorStrength, Map<Phenotype, Phenotype>> table = new EnumMap<>(InhibitorStrength.class);
        table.put(InhibitorStrength.STRONG, Collections.unmodifiableMap(strong));
        table.put(InhibitorStrength.MODERATE, Collections.unmodifiableMap(moderate));
        return Collections.unmodifiableMap(table);
    }

    /**
     * Functional phenotype for a genetic phenotype under the given strongest inhibitor.
     */
    public static Phenotype functionalPhenotype(final Phenotype genetic, final InhibitorStrength strongest) {
        Utils.nonNull(genetic, "genetic phenotype");
        Utils.nonNull(strongest, "strength");
        final Map<Phenotype, Phenotype> row = DOWNGRADE_TABLE.get(strongest);
        return row == null ? genetic : row.getOrDefault(genetic, genetic);
    }

    public PhenoconversionResult adjust(final String gene, final Phenotype genetic, final List<String> medications) {
        Utils.nonNull(gene, "gene");
        Utils.nonNull(genetic, "genetic phenotype");
        Utils.nonNull(medications, "medications");

        if (!catalog.modelsInhibitorsFor(gene)) {
            return new PhenoconversionResult(gene, genetic, genetic, InhibitorStrength.NONE, List.of(), 0.0,
                    "Phenoconversion is not modeled for " + gene + ".");
        }

        final List<ConcurrentMedication> drivers = ConcurrentMedication.resolve(catalog, gene, medications).stream()
                .filter(ConcurrentMedication::isInhibitor)
                .collect(Collectors.toList());
        if (drivers.isEmpty()) {
            return new PhenoconversionResult(gene, genetic, genetic, InhibitorStrength.NONE, List.of(), 0.0, NO_SIGNAL_NOTE);
        }

        final InhibitorStrength strongest = drivers.stream()
                .map(ConcurrentMedication::getStrength)
                .reduce(InhibitorStrength.NONE, InhibitorStrength::strongest);
        final Phenotype functional = functionalPhenotype(genetic, strongest);
        final String drugs = drivers.stream().map(ConcurrentMedication::getDrug).sorted().collect(Collectors.joining(", "));
        final String note = String.format("Genetic phenotype %s may functionally shift to %s due to inhibitor exposure (%s). Source: inhibitor rule table.",
                genetic.getLabel(), functional.getLabel(), drugs);
        if (functional != genetic) {
            logger.debug(String.format("%s phenotype %s shifted to %s by %s inhibitor(s): %s",
                    gene, genetic.getLabel(), functional.getLabel(), strongest.getLabel(), drugs));
        }
        return new PhenoconversionResult(gene, genetic, functional, strongest, drivers,
                catalog.phenoconversionPenalty(strongest), note);
    }

    @VisibleForTesting
    static Map<InhibitorStrength, Map<Phenotype, Phenotype>> getDowngradeTable() {
        return DOWNGRADE_TABLE;
    }
}
