package org.pharmaguard.tools.pgx.confidence;

import org.pharmaguard.testutils.PgxBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;

public final class PostHocCalibratorTest extends PgxBaseTest {

    private final PostHocCalibrator calibrator = PostHocCalibrator.fromCatalog(defaultCatalog());

    @DataProvider(name = "scores")
    public Object[][] scores() {
        return new Object[][]{
                {0.0, 0.30},
                {0.3999, 0.30},
                {0.40, 0.45},
                {0.65, 0.68},
                {0.8999, 0.87},
                {0.9335, 0.95},
                {1.0, 0.95},
                {-0.3, 0.30},
                {1.7, 0.95},
        };
    }

    @Test(dataProvider = "scores")
    public void testCatalogMap(final double raw, final double expected) {
        assertEqualsDoubleSmart(calibrator.calibrate(raw), expected);
    }

    @Test
    public void testCalibrationIsMonotonic() {
        double previous = calibrator.calibrate(0.0);
        for (int i = 1; i <= 1000; i++) {
            final double current = calibrator.calibrate(i / 1000.0);
            Assert.assertTrue(current >= previous, "calibration decreased at " + (i / 1000.0));
            previous = current;
        }
    }

    @Test
    public void testIdentity() {
        final PostHocCalibrator identity = PostHocCalibrator.identity();
        Assert.assertTrue(identity.isIdentity());
        assertEqualsDoubleSmart(identity.calibrate(0.456), 0.46);
        assertEqualsDoubleSmart(identity.calibrate(2.0), 1.0);
        Assert.assertFalse(calibrator.isIdentity());
    }

    @Test
    public void testBinsAreSorted() {
        final List<CalibrationBin> bins = PostHocCalibrator.validateBins(Arrays.asList(
                new CalibrationBin(0.5, 1.0, 0.8), new CalibrationBin(0.0, 0.5, 0.2)));
        assertEqualsDoubleSmart(bins.get(0).lower(), 0.0);
        assertEqualsDoubleSmart(new PostHocCalibrator(bins).calibrate(0.5), 0.8);
    }

    @DataProvider(name = "invalidBins")
    public Object[][] invalidBins() {
        return new Object[][]{
                {Arrays.asList(new CalibrationBin(0.1, 1.0, 0.5))},
                {Arrays.asList(new CalibrationBin(0.0, 0.9, 0.5))},
                {Arrays.asList(new CalibrationBin(0.0, 0.4, 0.3), new CalibrationBin(0.5, 1.0, 0.8))},
                {Arrays.asList(new CalibrationBin(0.0, 0.6, 0.3), new CalibrationBin(0.5, 1.0, 0.8))},
                {Arrays.asList(new CalibrationBin(0.0, 0.5, 0.8), new CalibrationBin(0.5, 1.0, 0.3))},
        };
    }

    @Test(dataProvider = "invalidBins", expectedExceptions = IllegalArgumentException.class)
    public void testInvalidBins(final List<CalibrationBin> bins) {
        new PostHocCalibrator(bins);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEmptyBinInterval() {
        new CalibrationBin(0.5, 0.5, 0.5);
    }
}
