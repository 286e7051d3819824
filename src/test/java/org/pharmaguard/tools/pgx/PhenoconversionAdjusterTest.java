package org.pharmaguard.tools.pgx;

import org.pharmaguard.testutils.PgxBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public final class PhenoconversionAdjusterTest extends PgxBaseTest {

    private final PhenoconversionAdjuster adjuster = new PhenoconversionAdjuster(defaultCatalog());

    @DataProvider(name = "transitions")
    public Object[][] transitions() {
        return new Object[][]{
                {Phenotype.URM, InhibitorStrength.STRONG, Phenotype.NM},
                {Phenotype.RM, InhibitorStrength.STRONG, Phenotype.IM},
                {Phenotype.NM, InhibitorStrength.STRONG, Phenotype.IM},
                {Phenotype.IM, InhibitorStrength.STRONG, Phenotype.PM},
                {Phenotype.PM, InhibitorStrength.STRONG, Phenotype.PM},
                {Phenotype.URM, InhibitorStrength.MODERATE, Phenotype.RM},
                {Phenotype.RM, InhibitorStrength.MODERATE, Phenotype.NM},
                {Phenotype.NM, InhibitorStrength.MODERATE, Phenotype.NM},
                {Phenotype.IM, InhibitorStrength.MODERATE, Phenotype.IM},
                {Phenotype.PM, InhibitorStrength.MODERATE, Phenotype.PM},
                {Phenotype.URM, InhibitorStrength.WEAK, Phenotype.URM},
                {Phenotype.RM, InhibitorStrength.WEAK, Phenotype.RM},
                {Phenotype.NM, InhibitorStrength.WEAK, Phenotype.NM},
                {Phenotype.IM, InhibitorStrength.WEAK, Phenotype.IM},
                {Phenotype.PM, InhibitorStrength.WEAK, Phenotype.PM},
                {Phenotype.UNKNOWN, InhibitorStrength.STRONG, Phenotype.UNKNOWN},
                {Phenotype.NM, InhibitorStrength.NONE, Phenotype.NM},
        };
    }

    @Test(dataProvider = "transitions")
    public void testFunctionalPhenotype(final Phenotype genetic, final InhibitorStrength strength, final Phenotype expected) {
        Assert.assertEquals(PhenoconversionAdjuster.functionalPhenotype(genetic, strength), expected);
    }

    @Test
    public void testTableNeverRaisesActivity() {
        final List<Phenotype> byActivity = Arrays.asList(Phenotype.PM, Phenotype.IM, Phenotype.NM, Phenotype.RM, Phenotype.URM);
        for (final Map<Phenotype, Phenotype> row : PhenoconversionAdjuster.getDowngradeTable().values()) {
            for (final Map.Entry<Phenotype, Phenotype> transition : row.entrySet()) {
                Assert.assertTrue(byActivity.indexOf(transition.getValue()) <= byActivity.indexOf(transition.getKey()),
                        transition.toString());
            }
        }
    }

    @Test
    public void testStrongInhibitorShiftsNormalMetabolizer() {
        final PhenoconversionResult result = adjuster.adjust("CYP2D6", Phenotype.NM, Arrays.asList("Fluoxetine"));
        Assert.assertEquals(result.getFunctionalPhenotype(), Phenotype.IM);
        Assert.assertEquals(result.getStrongestInhibitor(), InhibitorStrength.STRONG);
        Assert.assertEquals(result.getDrivers(), Arrays.asList(new ConcurrentMedication("fluoxetine", InhibitorStrength.STRONG)));
        assertEqualsDoubleSmart(result.getConfidencePenalty(), 0.10);
        Assert.assertTrue(result.isPhenotypeShifted());
        Assert.assertTrue(result.hasInhibitorExposure());
        Assert.assertEquals(result.getClinicalNote(),
                "Genetic phenotype NM may functionally shift to IM due to inhibitor exposure (fluoxetine). Source: inhibitor rule table.");
    }

    @Test
    public void testStrongestInhibitorWinsAndDriversAreListed() {
        final PhenoconversionResult result = adjuster.adjust("CYP2D6", Phenotype.URM,
                Arrays.asList("duloxetine", " CIMETIDINE ", "ibuprofen", "duloxetine"));
        Assert.assertEquals(result.getStrongestInhibitor(), InhibitorStrength.MODERATE);
        Assert.assertEquals(result.getFunctionalPhenotype(), Phenotype.RM);
        Assert.assertEquals(result.getDrivers().size(), 2);
        assertEqualsDoubleSmart(result.getConfidencePenalty(), 0.05);
        Assert.assertTrue(result.getClinicalNote().contains("(cimetidine, duloxetine)"));
    }

    @Test
    public void testWeakInhibitorKeepsPhenotypeButCarriesPenalty() {
        final PhenoconversionResult result = adjuster.adjust("CYP2C9", Phenotype.NM, Arrays.asList("ibuprofen"));
        Assert.assertFalse(result.isPhenotypeShifted());
        Assert.assertTrue(result.hasInhibitorExposure());
        assertEqualsDoubleSmart(result.getConfidencePenalty(), 0.02);
    }

    @Test
    public void testNoInhibitors() {
        final PhenoconversionResult result = adjuster.adjust("CYP2C19", Phenotype.IM, Arrays.asList("acetaminophen"));
        Assert.assertEquals(result.getFunctionalPhenotype(), Phenotype.IM);
        Assert.assertEquals(result.getStrongestInhibitor(), InhibitorStrength.NONE);
        Assert.assertFalse(result.hasInhibitorExposure());
        assertEqualsDoubleSmart(result.getConfidencePenalty(), 0.0);
        Assert.assertEquals(result.getClinicalNote(), PhenoconversionAdjuster.NO_SIGNAL_NOTE);

        Assert.assertEquals(adjuster.adjust("CYP2C19", Phenotype.IM, Collections.emptyList()).getClinicalNote(),
                PhenoconversionAdjuster.NO_SIGNAL_NOTE);
    }

    @Test
    public void testUnmodeledGene() {
        final PhenoconversionResult result = adjuster.adjust("TPMT", Phenotype.NM, Arrays.asList("fluoxetine"));
        Assert.assertEquals(result.getFunctionalPhenotype(), Phenotype.NM);
        Assert.assertFalse(result.hasInhibitorExposure());
        Assert.assertEquals(result.getClinicalNote(), "Phenoconversion is not modeled for TPMT.");
    }

    @Test
    public void testUnknownPhenotypeIsNeverShifted() {
        final PhenoconversionResult result = adjuster.adjust("CYP2D6", Phenotype.UNKNOWN, Arrays.asList("paroxetine"));
        Assert.assertEquals(result.getFunctionalPhenotype(), Phenotype.UNKNOWN);
        Assert.assertFalse(result.isPhenotypeShifted());
    }

    @Test
    public void testParseMedicationList() {
        Assert.assertEquals(ConcurrentMedication.parseList("Fluoxetine, omeprazole,,"), Arrays.asList("Fluoxetine", "omeprazole"));
        Assert.assertTrue(ConcurrentMedication.parseList(null).isEmpty());
    }
}
