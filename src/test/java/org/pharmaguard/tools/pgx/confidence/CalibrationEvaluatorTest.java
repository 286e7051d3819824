package org.pharmaguard.tools.pgx.confidence;

import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.metrics.CalibrationQualityMetrics;
import org.pharmaguard.testutils.PgxBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class CalibrationEvaluatorTest extends PgxBaseTest {

    private List<CalibrationObservation> validationSet() {
        return CalibrationObservation.readJsonLines(getTestFile("validation.jsonl").toPath());
    }

    private static CalibrationObservation obs(final double confidence, final boolean correct) {
        return new CalibrationObservation(confidence, correct);
    }

    @Test
    public void testReadJsonLines() {
        final List<CalibrationObservation> observations = validationSet();
        Assert.assertEquals(observations.size(), 8);
        Assert.assertEquals(observations.get(0), obs(0.95, true));
        Assert.assertEquals(observations.get(2), obs(0.88, false));
        Assert.assertEquals(observations.get(7), obs(0.30, true));
    }

    @Test
    public void testEmptyFileHasNoObservations() {
        Assert.assertTrue(CalibrationObservation.readJsonLines(getTestFile("empty.jsonl").toPath()).isEmpty());
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testNonNumericConfidence() {
        CalibrationObservation.readJsonLines(getTestFile("malformed.jsonl").toPath());
    }

    @Test
    public void testConfidenceIsClamped() {
        assertEqualsDoubleSmart(obs(1.4, true).confidence(), 1.0);
        assertEqualsDoubleSmart(obs(-0.2, false).confidence(), 0.0);
    }

    @DataProvider(name = "binIndices")
    public Object[][] binIndices() {
        return new Object[][]{
                {0.0, 10, 0},
                {0.05, 10, 0},
                {0.1, 10, 1},
                {0.999, 10, 9},
                {1.0, 10, 9},
                {0.5, 3, 1},
                {1.0, 1, 0},
        };
    }

    @Test(dataProvider = "binIndices")
    public void testBinIndex(final double confidence, final int bins, final int expected) {
        Assert.assertEquals(CalibrationEvaluator.binIndex(confidence, bins), expected);
    }

    @Test
    public void testExpectedCalibrationError() {
        assertEqualsDoubleSmart(CalibrationEvaluator.expectedCalibrationError(validationSet(), 10), 0.18, 1e-9);
    }

    @Test
    public void testPerfectCalibration() {
        final List<CalibrationObservation> perfect = Arrays.asList(obs(1.0, true), obs(0.0, false), obs(1.0, true));
        assertEqualsDoubleSmart(CalibrationEvaluator.expectedCalibrationError(perfect, 10), 0.0);
        assertEqualsDoubleSmart(CalibrationEvaluator.brierScore(perfect), 0.0);
    }

    @Test
    public void testBrierScore() {
        assertEqualsDoubleSmart(CalibrationEvaluator.brierScore(validationSet()), 0.24235, 1e-9);
        assertEqualsDoubleSmart(CalibrationEvaluator.brierScore(Arrays.asList(obs(0.5, true), obs(0.5, false))), 0.25);
    }

    @Test
    public void testNoObservations() {
        assertEqualsDoubleSmart(CalibrationEvaluator.expectedCalibrationError(Collections.emptyList(), 10), 0.0);
        assertEqualsDoubleSmart(CalibrationEvaluator.brierScore(Collections.emptyList()), 0.0);
    }

    @Test
    public void testEvaluate() {
        final CalibrationQualityMetrics metrics = CalibrationEvaluator.evaluate(validationSet(), 10);
        Assert.assertEquals(metrics.OBSERVATIONS, 8);
        Assert.assertEquals(metrics.BINS, 10);
        assertEqualsDoubleSmart(metrics.ACCURACY, 0.625);
        assertEqualsDoubleSmart(metrics.MEAN_CONFIDENCE, 0.685);
        assertEqualsDoubleSmart(metrics.EXPECTED_CALIBRATION_ERROR, 0.18);
        assertEqualsDoubleSmart(metrics.BRIER_SCORE, 0.24235);
    }

    @Test
    public void testFitBinsFillsEmptyBins() {
        final List<CalibrationBin> bins = CalibrationEvaluator.fitBins(validationSet(), 10);
        Assert.assertEquals(bins.size(), 10);
        assertEqualsDoubleSmart(bins.get(0).lower(), 0.0);
        assertEqualsDoubleSmart(bins.get(9).upper(), 1.0);
        for (int i = 0; i < 9; i++) {
            assertEqualsDoubleSmart(bins.get(i).calibrated(), 0.5);
        }
        assertEqualsDoubleSmart(bins.get(9).calibrated(), 1.0);
    }

    @Test
    public void testFitBinsPoolsAdjacentViolators() {
        final List<CalibrationObservation> observations = Arrays.asList(
                obs(0.25, true), obs(0.25, true),
                obs(0.75, false), obs(0.75, false), obs(0.75, true));
        final List<CalibrationBin> bins = CalibrationEvaluator.fitBins(observations, 4);
        Assert.assertEquals(bins.size(), 4);
        for (final CalibrationBin bin : bins) {
            assertEqualsDoubleSmart(bin.calibrated(), 0.6);
        }
        assertEqualsDoubleSmart(bins.get(1).lower(), 0.25);
        assertEqualsDoubleSmart(bins.get(3).lower(), 0.75);
    }

    @Test
    public void testTrailingEmptyBinsTakeThePreviousValue() {
        final List<CalibrationBin> bins = CalibrationEvaluator.fitBins(
                Arrays.asList(obs(0.1, false), obs(0.5, true), obs(0.5, false)), 3);
        assertEqualsDoubleSmart(bins.get(0).calibrated(), 0.0);
        assertEqualsDoubleSmart(bins.get(1).calibrated(), 0.5);
        assertEqualsDoubleSmart(bins.get(2).calibrated(), 0.5);
        assertEqualsDoubleSmart(bins.get(1).lower(), 0.3333);
    }

    @Test
    public void testFittedBinsAreUsableByTheCalibrator() {
        final PostHocCalibrator fitted = new PostHocCalibrator(CalibrationEvaluator.fitBins(validationSet(), 10));
        assertEqualsDoubleSmart(fitted.calibrate(0.95), 1.0);
        assertEqualsDoubleSmart(fitted.calibrate(0.2), 0.5);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testFitBinsNeedsObservations() {
        CalibrationEvaluator.fitBins(Collections.emptyList(), 10);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testBinsMustBePositive() {
        CalibrationEvaluator.expectedCalibrationError(validationSet(), 0);
    }
}
