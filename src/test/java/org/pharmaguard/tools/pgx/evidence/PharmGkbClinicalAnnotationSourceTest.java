package org.pharmaguard.tools.pgx.evidence;

import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.testutils.PgxBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;

public final class PharmGkbClinicalAnnotationSourceTest extends PgxBaseTest {

    private PharmGkbClinicalAnnotationSource load() {
        return PharmGkbClinicalAnnotationSource.fromPath(getTestFile("clinical_annotations.tsv").toPath());
    }

    @Test
    public void testMultiDrugRowsAreSplit() {
        final PharmGkbClinicalAnnotationSource source = load();
        Assert.assertEquals(source.size(), 5);
        Assert.assertTrue(source.lookup("CYP2D6", "TRAMADOL").isPresent());
        Assert.assertTrue(source.lookup("CYP2D6", " codeine ").isPresent());
        Assert.assertFalse(source.lookup("CYP2D6", "MORPHINE").isPresent());
        Assert.assertFalse(source.lookup(null, "CODEINE").isPresent());
    }

    @Test
    public void testStrongestTierWinsAndCategoriesMerge() {
        final EvidenceAnnotation codeine = load().lookup("CYP2D6", "CODEINE").get();
        Assert.assertEquals(codeine.getEvidenceLevel(), "1A");
        Assert.assertEquals(codeine.getSource(), EvidenceSource.PHARMGKB);
        Assert.assertEquals(codeine.getPhenotypeCategories(), Arrays.asList("Toxicity", "Efficacy", "Dosage"));
        Assert.assertEquals(codeine.getPmid(), "24458010");
        Assert.assertEquals(codeine.getYear(), Integer.valueOf(2014));
        Assert.assertFalse(codeine.isSparse());
    }

    @Test
    public void testUnrecognisedLevelIsSkipped() {
        Assert.assertFalse(load().lookup("UGT1A1", "IRINOTECAN").isPresent());
    }

    @Test
    public void testBlankCitationColumnsAreSparse() {
        final EvidenceAnnotation tacrolimus = load().lookup("CYP3A5", "TACROLIMUS").get();
        Assert.assertNull(tacrolimus.getPmid());
        Assert.assertNull(tacrolimus.getYear());
        Assert.assertTrue(tacrolimus.isSparse());
    }

    @Test
    public void testOptionalColumnsMayBeAbsent() throws IOException {
        final String table = "Gene\tDrug(s)\tLevel of Evidence\nCYP2C19\tclopidogrel\t1b\n";
        final PharmGkbClinicalAnnotationSource source = PharmGkbClinicalAnnotationSource.fromReader("inline", new StringReader(table));
        final EvidenceAnnotation annotation = source.lookup("CYP2C19", "CLOPIDOGREL").get();
        Assert.assertEquals(annotation.getEvidenceLevel(), "1B");
        Assert.assertTrue(annotation.getPhenotypeCategories().isEmpty());
        Assert.assertTrue(annotation.isSparse());
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMissingRequiredColumns() {
        PharmGkbClinicalAnnotationSource.fromPath(getTestFile("missing_columns.tsv").toPath());
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testRaggedRow() throws IOException {
        PharmGkbClinicalAnnotationSource.fromReader("inline",
                new StringReader("Gene\tDrug(s)\tLevel of Evidence\nCYP2C19\tclopidogrel\n"));
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingFile() {
        PharmGkbClinicalAnnotationSource.fromPath(new File(getToolTestDataDir(), "absent.tsv").toPath());
    }
}
