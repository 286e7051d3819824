package org.pharmaguard.tools.pgx.cohort;

import com.fasterxml.jackson.databind.JsonNode;
import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.testutils.PgxBaseTest;
import org.pharmaguard.tools.pgx.RiskLabel;
import org.pharmaguard.tools.pgx.Severity;
import org.pharmaguard.utils.json.JsonUtils;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public final class CohortAggregatorTest extends PgxBaseTest {

    private static SerializedCohortMember member(final String patient, final String drug, final RiskLabel label, final Severity severity) {
        return new SerializedCohortMember(patient, drug, label, severity);
    }

    private static List<SerializedCohortMember> threePatients() {
        return Arrays.asList(
                member("PATIENT_001", "CODEINE", RiskLabel.TOXIC, Severity.CRITICAL),
                member("PATIENT_002", "CODEINE", RiskLabel.SAFE, Severity.NONE),
                member("PATIENT_003", "CLOPIDOGREL", RiskLabel.ADJUST_DOSAGE, Severity.MODERATE));
    }

    @Test
    public void testOneToxicResult() {
        final CohortSummary summary = CohortAggregator.summarize(threePatients());
        Assert.assertEquals(summary.getCohortSize(), 3);
        Assert.assertEquals(summary.getPatientCount(), 3);
        Assert.assertEquals(summary.getHighRiskCount(), 1);
        Assert.assertEquals(summary.getHighRiskPatients(), Collections.singletonList("PATIENT_001"));
        Assert.assertEquals(summary.getAlert(), "1 patient(s) require immediate clinical review");
        Assert.assertEquals(summary.count("CODEINE", RiskLabel.TOXIC), 1);
        Assert.assertEquals(summary.count("CODEINE", RiskLabel.SAFE), 1);
        Assert.assertEquals(summary.count("CODEINE", RiskLabel.INEFFECTIVE), 0);
        Assert.assertEquals(summary.count("WARFARIN", RiskLabel.SAFE), 0);
    }

    @Test
    public void testRiskMatrixListsEveryLabel() {
        final Map<String, Map<String, Long>> matrix = CohortAggregator.summarize(threePatients()).getRiskMatrix();
        Assert.assertEquals(new ArrayList<>(matrix.keySet()), Arrays.asList("CLOPIDOGREL", "CODEINE"));
        Assert.assertEquals(new ArrayList<>(matrix.get("CODEINE").keySet()),
                Arrays.stream(RiskLabel.values()).map(RiskLabel::getLabel).collect(Collectors.toList()));
        Assert.assertEquals(matrix.get("CLOPIDOGREL").get("Adjust Dosage"), Long.valueOf(1));
        Assert.assertEquals(matrix.get("CLOPIDOGREL").get("Toxic"), Long.valueOf(0));
    }

    @DataProvider(name = "highRisk")
    public Object[][] highRisk() {
        return new Object[][]{
                {RiskLabel.TOXIC, Severity.NONE, true},
                {RiskLabel.INEFFECTIVE, Severity.LOW, true},
                {RiskLabel.ADJUST_DOSAGE, Severity.HIGH, true},
                {RiskLabel.ADJUST_DOSAGE, Severity.CRITICAL, true},
                {RiskLabel.ADJUST_DOSAGE, Severity.MODERATE, false},
                {RiskLabel.SAFE, Severity.NONE, false},
                {RiskLabel.UNKNOWN, Severity.NONE, false},
        };
    }

    @Test(dataProvider = "highRisk")
    public void testHighRiskDefinition(final RiskLabel label, final Severity severity, final boolean expected) {
        Assert.assertEquals(member("P", "D", label, severity).isHighRisk(), expected);
    }

    @Test
    public void testPatientWithSeveralHighRiskDrugsIsCountedOnce() {
        final CohortSummary summary = CohortAggregator.summarize(Arrays.asList(
                member("PATIENT_001", "CODEINE", RiskLabel.TOXIC, Severity.CRITICAL),
                member("PATIENT_001", "CLOPIDOGREL", RiskLabel.INEFFECTIVE, Severity.HIGH)));
        Assert.assertEquals(summary.getCohortSize(), 2);
        Assert.assertEquals(summary.getPatientCount(), 1);
        Assert.assertEquals(summary.getHighRiskCount(), 1);
    }

    @Test
    public void testEmptyCohort() {
        final CohortSummary summary = CohortAggregator.summarize(Collections.emptyList());
        Assert.assertEquals(summary, CohortSummary.empty());
        Assert.assertEquals(summary.getCohortSize(), 0);
        Assert.assertEquals(summary.getAlert(), "0 patient(s) require immediate clinical review");
        Assert.assertTrue(summary.getRiskMatrix().isEmpty());
    }

    @Test
    public void testCombineIsOrderIndependent() {
        final List<SerializedCohortMember> members = new ArrayList<>(threePatients());
        members.add(member("PATIENT_004", "WARFARIN", RiskLabel.TOXIC, Severity.HIGH));
        final CohortSummary forward = CohortAggregator.summarize(members);

        final List<SerializedCohortMember> reversed = new ArrayList<>(members);
        Collections.reverse(reversed);
        Assert.assertEquals(CohortAggregator.summarize(reversed), forward);

        final CohortSummary left = CohortAggregator.summarize(members.subList(0, 2));
        final CohortSummary right = CohortAggregator.summarize(members.subList(2, 4));
        Assert.assertEquals(left.combine(right), forward);
        Assert.assertEquals(right.combine(left), forward);
        Assert.assertEquals(forward.combine(CohortSummary.empty()), forward);
    }

    @Test
    public void testParallelMatchesSequential() {
        final List<SerializedCohortMember> members = IntStream.range(0, 500)
                .mapToObj(i -> member("PATIENT_" + (i % 97), i % 2 == 0 ? "CODEINE" : "WARFARIN",
                        RiskLabel.values()[i % RiskLabel.values().length], Severity.values()[i % Severity.values().length]))
                .collect(Collectors.toList());
        Assert.assertEquals(CohortAggregator.summarizeInParallel(members), CohortAggregator.summarize(members));
    }

    @Test
    public void testMembersFromSerializedResults() throws Exception {
        final JsonNode array = JsonUtils.outputMapper().readTree("[" +
                "{\"patient_id\":\"P1\",\"drug\":\"CODEINE\",\"risk_assessment\":{\"risk_label\":\"Toxic\",\"severity\":\"critical\"}}," +
                "{\"patient_id\":\"P2\",\"drug\":\"WARFARIN\",\"risk_assessment\":{\"risk_label\":\"Adjust Dosage\",\"severity\":\"moderate\"}}]");
        final List<SerializedCohortMember> members = SerializedCohortMember.fromJson("inline", array);
        Assert.assertEquals(members, Arrays.asList(
                member("P1", "CODEINE", RiskLabel.TOXIC, Severity.CRITICAL),
                member("P2", "WARFARIN", RiskLabel.ADJUST_DOSAGE, Severity.MODERATE)));

        final JsonNode single = JsonUtils.outputMapper().readTree(
                "{\"patient_id\":\"P3\",\"drug\":\"CODEINE\",\"risk_assessment\":{\"risk_label\":\"Safe\",\"severity\":\"none\"}}");
        Assert.assertEquals(SerializedCohortMember.fromJson("inline", single).size(), 1);
    }

    @DataProvider(name = "malformedResults")
    public Object[][] malformedResults() {
        return new Object[][]{
                {"{\"drug\":\"CODEINE\",\"risk_assessment\":{\"risk_label\":\"Toxic\",\"severity\":\"critical\"}}"},
                {"{\"patient_id\":\"P1\",\"drug\":\"CODEINE\"}"},
                {"{\"patient_id\":\"P1\",\"drug\":\"CODEINE\",\"risk_assessment\":{\"risk_label\":\"Deadly\",\"severity\":\"critical\"}}"},
                {"{\"patient_id\":\"P1\",\"drug\":\"CODEINE\",\"risk_assessment\":{\"risk_label\":\"Toxic\",\"severity\":3}}"},
        };
    }

    @Test(dataProvider = "malformedResults", expectedExceptions = UserException.MalformedFile.class)
    public void testMalformedSerializedResult(final String json) throws Exception {
        SerializedCohortMember.fromJson("inline", JsonUtils.outputMapper().readTree(json));
    }
}
