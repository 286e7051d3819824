package org.pharmaguard.tools.pgx;

import org.pharmaguard.tools.pgx.catalog.RuleCatalog;
import org.pharmaguard.utils.Utils;

import java.util.List;

/**
 * Exact (gene, phenotype, drug) lookup of a {@link RiskRule}. Anything without a rule, including an Unknown
 * phenotype, gets the Unknown fallback with severity none and no alternatives.
 */
public final class RiskRuleMatcher {

    private final RuleCatalog catalog;

    public RiskRuleMatcher(final RuleCatalog catalog) {
        this.catalog = Utils.nonNull(catalog, "catalog");
    }

    public RiskRuleMatch match(final String gene, final Phenotype phenotype, final String drug) {
        Utils.nonNull(gene, "gene");
        Utils.nonNull(phenotype, "phenotype");
        Utils.nonNull(drug, "drug");
        return catalog.riskRule(gene, phenotype, drug)
                .map(RiskRuleMatch::matched)
                .orElseGet(() -> fallback(gene, phenotype, drug));
    }

    public static RiskRuleMatch fallback(final String gene, final Phenotype phenotype, final String drug) {
        return new RiskRuleMatch(null, RiskLabel.UNKNOWN, Severity.NONE, unknownAction(gene, phenotype, drug), List.of());
    }

    static String unknownAction(final String gene, final Phenotype phenotype, final String drug) {
        return String.format("No curated pharmacogenomic rule found for %s + %s + %s. "
                + "Classify as Unknown and consult CPIC/PharmGKB or a pharmacogenomics specialist.", gene, drug, phenotype.getLabel());
    }
}
