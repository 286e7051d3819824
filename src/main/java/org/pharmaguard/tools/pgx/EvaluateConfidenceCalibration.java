package org.pharmaguard.tools.pgx;

import htsjdk.samtools.metrics.MetricsFile;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.pharmaguard.cmdline.CommandLineProgram;
import org.pharmaguard.cmdline.StandardArgumentDefinitions;
import org.pharmaguard.cmdline.programgroups.PharmacogenomicsProgramGroup;
import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.metrics.CalibrationQualityMetrics;
import org.pharmaguard.tools.pgx.confidence.CalibrationBin;
import org.pharmaguard.tools.pgx.confidence.CalibrationEvaluator;
import org.pharmaguard.tools.pgx.confidence.CalibrationObservation;
import org.pharmaguard.utils.json.JsonUtils;

import java.io.File;
import java.util.Collections;
import java.util.List;

/**
 * Measures how well reported confidence matches observed correctness.
 *
 * <p>The input is a JSON Lines file of {@code {"confidence": 0.96, "correct": 1}} observations.
 * The tool writes expected calibration error and Brier score as a metrics file and can also fit a monotonic
 * calibration bin map, ready to be pasted into the {@code calibration_bins} section of a rule catalog.</p>
 */
@CommandLineProgramProperties(
        summary = "Computes expected calibration error and Brier score of confidence scores against labeled outcomes, " +
                "and optionally fits a monotonic calibration bin map",
        oneLineSummary = "Evaluate confidence calibration",
        programGroup = PharmacogenomicsProgramGroup.class
)
public final class EvaluateConfidenceCalibration extends CommandLineProgram {

    public static final String BINS_LONG_NAME = "bins";
    public static final String FITTED_BINS_LONG_NAME = "fitted-bins-output";

    @Argument(fullName = StandardArgumentDefinitions.INPUT_LONG_NAME, shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "JSON Lines file of labeled confidence observations")
    public File INPUT;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME, shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Where to write the calibration metrics")
    public File OUTPUT;

    @Argument(fullName = BINS_LONG_NAME, doc = "Number of equal-width confidence bins", optional = true, minValue = 1)
    public int BINS = CalibrationEvaluator.DEFAULT_BINS;

    @Argument(fullName = FITTED_BINS_LONG_NAME, doc = "If given, write a fitted calibration bin map as JSON here", optional = true)
    public File FITTED_BINS_OUTPUT = null;

    @Override
    protected Object doWork() {
        final List<CalibrationObservation> observations = CalibrationObservation.readJsonLines(INPUT.toPath());
        if (observations.isEmpty()) {
            throw new UserException.BadInput("no calibration observations found in " + INPUT);
        }

        final CalibrationQualityMetrics metrics = CalibrationEvaluator.evaluate(observations, BINS);
        logger.info(String.format("%d observations: ECE %.6f, Brier score %.6f",
                metrics.OBSERVATIONS, metrics.EXPECTED_CALIBRATION_ERROR, metrics.BRIER_SCORE));

        final MetricsFile<CalibrationQualityMetrics, Integer> metricsFile = getMetricsFile();
        metricsFile.addMetric(metrics);
        metricsFile.write(OUTPUT);

        if (FITTED_BINS_OUTPUT != null) {
            final List<CalibrationBin> bins = CalibrationEvaluator.fitBins(observations, BINS);
            JsonUtils.writeJson(FITTED_BINS_OUTPUT, Collections.singletonMap("calibration_bins", bins));
        }
        return metrics;
    }
}
