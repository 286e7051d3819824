package org.pharmaguard.tools.pgx;

import java.util.List;

/**
 * A curated (gene, phenotype, drug) rule and the verdict it yields.
 */
public record RiskRule(String gene,
                       String drug,
                       Phenotype phenotype,
                       RiskLabel riskLabel,
                       Severity severity,
                       String action,
                       List<String> alternatives) {

    public RiskRule {
        alternatives = List.copyOf(alternatives);
    }

    public static String key(final String gene, final Phenotype phenotype, final String drug) {
        return gene + "|" + phenotype.getLabel() + "|" + drug;
    }

    public String key() {
        return key(gene, phenotype, drug);
    }
}
