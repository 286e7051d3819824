package org.pharmaguard.tools.pgx;

import com.fasterxml.jackson.databind.JsonNode;
import org.pharmaguard.Main;
import org.pharmaguard.cmdline.StandardArgumentDefinitions;
import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.testutils.CommandLineProgramTest;
import org.pharmaguard.utils.json.JsonUtils;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.util.Arrays;
import java.util.List;

public final class SummarizeCohortRiskIntegrationTest extends CommandLineProgramTest {

    private File analyze(final String vcf, final String drugs) {
        final File output = createTempFile("pgx_report", ".json");
        new Main().instanceMain(new String[]{"AnalyzePharmacogenomics",
                "-V", new File(toolsTestDir, vcf).getAbsolutePath(),
                "-O", output.getAbsolutePath(),
                "-D", drugs,
                "--" + StandardArgumentDefinitions.VERBOSITY_NAME, "ERROR"});
        return output;
    }

    @Test
    public void testSummarizeReports() {
        final File poorMetabolizer = analyze("cyp2d6_poor_metabolizer.vcf", "codeine,warfarin");
        final File normalMetabolizer = analyze("reference_calls_only.vcf", "codeine");
        final File summary = createTempFile("cohort", ".json");

        final Object ret = runCommandLine(Arrays.asList(
                "-" + StandardArgumentDefinitions.INPUT_SHORT_NAME, poorMetabolizer.getAbsolutePath(),
                "-" + StandardArgumentDefinitions.INPUT_SHORT_NAME, normalMetabolizer.getAbsolutePath(),
                "-" + StandardArgumentDefinitions.OUTPUT_SHORT_NAME, summary.getAbsolutePath()));
        Assert.assertEquals(ret, 1);

        final JsonNode cohort = JsonUtils.readTree(summary.toPath());
        Assert.assertEquals(cohort.get("cohort_size").asLong(), 3);
        Assert.assertEquals(cohort.get("patient_count").asInt(), 2);
        Assert.assertEquals(cohort.get("high_risk_count").asInt(), 1);
        Assert.assertEquals(cohort.get("high_risk_patients").size(), 1);
        Assert.assertEquals(cohort.get("high_risk_patients").get(0).asText(), "PATIENT_001");
        Assert.assertEquals(cohort.get("alert").asText(), "1 patient(s) require immediate clinical review");
        Assert.assertEquals(cohort.at("/risk_matrix/CODEINE/Toxic").asLong(), 1);
        Assert.assertEquals(cohort.at("/risk_matrix/CODEINE/Safe").asLong(), 1);
        Assert.assertEquals(cohort.at("/risk_matrix/CODEINE/Ineffective").asLong(), 0);
        Assert.assertTrue(cohort.at("/risk_matrix/WARFARIN").isObject());
    }

    @Test
    public void testSingleReport() {
        final File normalMetabolizer = analyze("reference_calls_only.vcf", "codeine,clopidogrel");
        final File summary = createTempFile("cohort", ".json");

        final Object ret = runCommandLine(Arrays.asList(
                "-" + StandardArgumentDefinitions.INPUT_SHORT_NAME, normalMetabolizer.getAbsolutePath(),
                "-" + StandardArgumentDefinitions.OUTPUT_SHORT_NAME, summary.getAbsolutePath()));
        Assert.assertEquals(ret, 0);

        final JsonNode cohort = JsonUtils.readTree(summary.toPath());
        Assert.assertEquals(cohort.get("cohort_size").asLong(), 2);
        Assert.assertEquals(cohort.get("patient_count").asInt(), 1);
        Assert.assertEquals(cohort.get("high_risk_patients").size(), 0);
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testNonReportInput() {
        final File notAReport = writeTempLines("not_a_report", ".json", List.of("{\"hello\": \"world\"}")).toFile();
        runCommandLine(Arrays.asList(
                "-" + StandardArgumentDefinitions.INPUT_SHORT_NAME, notAReport.getAbsolutePath(),
                "-" + StandardArgumentDefinitions.OUTPUT_SHORT_NAME, createTempFile("cohort", ".json").getAbsolutePath()));
    }
}
