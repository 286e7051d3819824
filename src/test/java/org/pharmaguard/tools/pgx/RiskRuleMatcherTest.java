package org.pharmaguard.tools.pgx;

import org.pharmaguard.testutils.PgxBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;

public final class RiskRuleMatcherTest extends PgxBaseTest {

    private final RiskRuleMatcher matcher = new RiskRuleMatcher(defaultCatalog());

    @DataProvider(name = "rules")
    public Object[][] rules() {
        return new Object[][]{
                {"CYP2D6", Phenotype.PM, "CODEINE", RiskLabel.TOXIC, Severity.CRITICAL},
                {"CYP2D6", Phenotype.URM, "CODEINE", RiskLabel.TOXIC, Severity.CRITICAL},
                {"CYP2D6", Phenotype.IM, "CODEINE", RiskLabel.ADJUST_DOSAGE, Severity.MODERATE},
                {"CYP2D6", Phenotype.NM, "CODEINE", RiskLabel.SAFE, Severity.NONE},
                {"CYP2C19", Phenotype.PM, "CLOPIDOGREL", RiskLabel.INEFFECTIVE, Severity.HIGH},
                {"CYP2C19", Phenotype.RM, "CLOPIDOGREL", RiskLabel.ADJUST_DOSAGE, Severity.MODERATE},
                {"CYP2C9", Phenotype.PM, "WARFARIN", RiskLabel.TOXIC, Severity.HIGH},
                {"SLCO1B1", Phenotype.IM, "SIMVASTATIN", RiskLabel.ADJUST_DOSAGE, Severity.MODERATE},
                {"TPMT", Phenotype.PM, "AZATHIOPRINE", RiskLabel.TOXIC, Severity.CRITICAL},
                {"DPYD", Phenotype.IM, "FLUOROURACIL", RiskLabel.ADJUST_DOSAGE, Severity.HIGH},
        };
    }

    @Test(dataProvider = "rules")
    public void testMatchedRule(final String gene, final Phenotype phenotype, final String drug,
                                final RiskLabel expectedLabel, final Severity expectedSeverity) {
        final RiskRuleMatch match = matcher.match(gene, phenotype, drug);
        Assert.assertTrue(match.isRuleCovered());
        Assert.assertEquals(match.riskLabel(), expectedLabel);
        Assert.assertEquals(match.severity(), expectedSeverity);
        Assert.assertFalse(match.action().isEmpty());
    }

    @Test
    public void testAlternativesComeFromTheRule() {
        final RiskRuleMatch match = matcher.match("CYP2C19", Phenotype.PM, "CLOPIDOGREL");
        Assert.assertEquals(match.alternatives(), Arrays.asList("prasugrel", "ticagrelor"));
        Assert.assertEquals(match.getRule().get().gene(), "CYP2C19");
    }

    @DataProvider(name = "uncovered")
    public Object[][] uncovered() {
        return new Object[][]{
                {"CYP2D6", Phenotype.UNKNOWN, "CODEINE"},
                {"CYP2C9", Phenotype.RM, "WARFARIN"},
                {"CYP2D6", Phenotype.PM, "CLOPIDOGREL"},
                {"NONE", Phenotype.UNKNOWN, "ASPIRIN"},
        };
    }

    @Test(dataProvider = "uncovered")
    public void testFallback(final String gene, final Phenotype phenotype, final String drug) {
        final RiskRuleMatch match = matcher.match(gene, phenotype, drug);
        Assert.assertFalse(match.isRuleCovered());
        Assert.assertEquals(match.riskLabel(), RiskLabel.UNKNOWN);
        Assert.assertEquals(match.severity(), Severity.NONE);
        Assert.assertTrue(match.alternatives().isEmpty());
        Assert.assertEquals(match.action(), RiskRuleMatcher.unknownAction(gene, phenotype, drug));
        Assert.assertTrue(match.action().contains(gene + " + " + drug + " + " + phenotype.getLabel()));
    }
}
