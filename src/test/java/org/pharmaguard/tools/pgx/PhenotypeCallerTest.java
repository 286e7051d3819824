package org.pharmaguard.tools.pgx;

import org.pharmaguard.testutils.PgxBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Collections;
import java.util.List;

public final class PhenotypeCallerTest extends PgxBaseTest {

    private final PhenotypeCaller caller = new PhenotypeCaller(defaultCatalog());

    private static Diplotype called(final String gene, final String first, final String second) {
        final List<DetectedVariant> support = Collections.singletonList(
                new DetectedVariant("rs0", gene, second, Zygosity.HETEROZYGOUS, null));
        return new Diplotype(gene, first, second, support);
    }

    @DataProvider(name = "diplotypes")
    public Object[][] diplotypes() {
        return new Object[][]{
                {"CYP2D6", "*4", "*4", Phenotype.PM, 0.0},
                {"CYP2D6", "*1", "*4", Phenotype.IM, 1.0},
                {"CYP2D6", "*4", "*10", Phenotype.IM, 0.25},
                {"CYP2D6", "*1", "*2", Phenotype.NM, 2.0},
                {"CYP2D6", "*1", "*1xN", Phenotype.URM, 3.0},
                {"CYP2C19", "*1", "*2", Phenotype.IM, 1.0},
                {"CYP2C19", "*2", "*2", Phenotype.PM, 0.0},
                {"CYP2C19", "*1", "*17", Phenotype.RM, 2.5},
                {"CYP2C19", "*17", "*17", Phenotype.URM, 3.0},
                {"CYP2C9", "*2", "*3", Phenotype.PM, 0.5},
                {"CYP2C9", "*1", "*3", Phenotype.IM, 1.0},
                {"DPYD", "*1", "HapB3", Phenotype.IM, 1.5},
        };
    }

    @Test(dataProvider = "diplotypes")
    public void testActivityScoreClassification(final String gene, final String first, final String second,
                                                final Phenotype expected, final double expectedScore) {
        final PhenotypeCall call = caller.call(called(gene, first, second));
        Assert.assertEquals(call.phenotype(), expected);
        Assert.assertFalse(call.defaulted());
        assertEqualsDoubleSmart(call.getActivityScore().getAsDouble(), expectedScore);
    }

    @Test
    public void testDefaultedWildTypeUsesDefaultPhenotype() {
        final PhenotypeCall call = caller.call(Diplotype.wildType("CYP2D6", "*1"));
        Assert.assertEquals(call.phenotype(), Phenotype.NM);
        Assert.assertTrue(call.defaulted());
        assertEqualsDoubleSmart(call.activityScore(), 2.0);
    }

    @Test
    public void testAlleleWithoutScoreIsUnknown() {
        final PhenotypeCall call = caller.call(called("CYP2D6", "*1", "*99"));
        Assert.assertTrue(call.isUnknown());
        Assert.assertFalse(call.getActivityScore().isPresent());
    }

    @Test
    public void testGeneWithoutTableIsUnknown() {
        final PhenotypeCall call = caller.call(Diplotype.wildType("CFTR", "*1"));
        Assert.assertEquals(call.phenotype(), Phenotype.UNKNOWN);
    }
}
