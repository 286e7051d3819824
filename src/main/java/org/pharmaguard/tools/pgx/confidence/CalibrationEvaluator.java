package org.pharmaguard.tools.pgx.confidence;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.pharmaguard.metrics.CalibrationQualityMetrics;
import org.pharmaguard.utils.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Audit-time calibration utilities: expected calibration error and Brier score over labeled observations, and
 * fitting of a monotonic bin map by pool-adjacent-violators. Inference never calls these.
 */
public final class CalibrationEvaluator {

    public static final int DEFAULT_BINS = 10;

    private static final int FIT_PRECISION = 4;

    private CalibrationEvaluator() {}

    static int binIndex(final double confidence, final int bins) {
        return Math.min((int) (confidence * bins), bins - 1);
    }

    /**
     * @return 0 for no observations
     */
    public static double expectedCalibrationError(final List<CalibrationObservation> observations, final int bins) {
        Utils.nonNull(observations, "observations");
        Utils.validateArg(bins > 0, "the number of bins must be positive");
        if (observations.isEmpty()) {
            return 0.0;
        }
        final SummaryStatistics[] confidences = newStatistics(bins);
        final SummaryStatistics[] outcomes = newStatistics(bins);
        for (final CalibrationObservation observation : observations) {
            final int bin = binIndex(observation.confidence(), bins);
            confidences[bin].addValue(observation.confidence());
            outcomes[bin].addValue(observation.outcome());
        }
        double ece = 0.0;
        for (int i = 0; i < bins; i++) {
            if (confidences[i].getN() > 0) {
                ece += ((double) confidences[i].getN() / observations.size()) * Math.abs(confidences[i].getMean() - outcomes[i].getMean());
            }
        }
        return ece;
    }

    /**
     * @return 0 for no observations
     */
    public static double brierScore(final List<CalibrationObservation> observations) {
        Utils.nonNull(observations, "observations");
        if (observations.isEmpty()) {
            return 0.0;
        }
        final SummaryStatistics squaredErrors = new SummaryStatistics();
        observations.forEach(o -> squaredErrors.addValue(Math.pow(o.confidence() - o.outcome(), 2)));
        return squaredErrors.getMean();
    }

    public static CalibrationQualityMetrics evaluate(final List<CalibrationObservation> observations, final int bins) {
        final CalibrationQualityMetrics metrics = new CalibrationQualityMetrics();
        final SummaryStatistics confidence = new SummaryStatistics();
        final SummaryStatistics accuracy = new SummaryStatistics();
        observations.forEach(o -> {
            confidence.addValue(o.confidence());
            accuracy.addValue(o.outcome());
        });
        metrics.OBSERVATIONS = observations.size();
        metrics.BINS = bins;
        metrics.ACCURACY = observations.isEmpty() ? 0.0 : Utils.round(accuracy.getMean(), 6);
        metrics.MEAN_CONFIDENCE = observations.isEmpty() ? 0.0 : Utils.round(confidence.getMean(), 6);
        metrics.EXPECTED_CALIBRATION_ERROR = Utils.round(expectedCalibrationError(observations, bins), 6);
        metrics.BRIER_SCORE = Utils.round(brierScore(observations), 6);
        return metrics;
    }

    /**
     * Fits a calibration map of {@code bins} equal-width bins whose values are the observed accuracy per bin, made
     * non-decreasing by pooling adjacent violators (weighted by bin size). Empty bins take the value of the nearest
     * non-empty bin below them, or above them for leading empty bins.
     *
     * @throws IllegalArgumentException if there are no observations
     */
    public static List<CalibrationBin> fitBins(final List<CalibrationObservation> observations, final int bins) {
        Utils.nonEmpty(observations, "cannot fit a calibration map without observations");
        Utils.validateArg(bins > 0, "the number of bins must be positive");
        final long[] counts = new long[bins];
        final double[] correct = new double[bins];
        for (final CalibrationObservation observation : observations) {
            final int bin = binIndex(observation.confidence(), bins);
            counts[bin]++;
            correct[bin] += observation.outcome();
        }

        // blocks of pooled non-empty bins: {first bin, last bin, weight, mean}
        final List<double[]> blocks = new ArrayList<>();
        for (int i = 0; i < bins; i++) {
            if (counts[i] == 0) {
                continue;
            }
            blocks.add(new double[]{i, i, counts[i], correct[i] / counts[i]});
            while (blocks.size() > 1 && blocks.get(blocks.size() - 2)[3] > blocks.get(blocks.size() - 1)[3]) {
                final double[] last = blocks.remove(blocks.size() - 1);
                final double[] previous = blocks.get(blocks.size() - 1);
                final double weight = previous[2] + last[2];
                previous[3] = (previous[3] * previous[2] + last[3] * last[2]) / weight;
                previous[2] = weight;
                previous[1] = last[1];
            }
        }

        final double[] values = new double[bins];
        final boolean[] assigned = new boolean[bins];
        for (final double[] block : blocks) {
            for (int i = (int) block[0]; i <= (int) block[1]; i++) {
                values[i] = block[3];
                assigned[i] = true;
            }
        }
        final int firstAssigned = firstAssigned(assigned);
        for (int i = 0; i < bins; i++) {
            if (!assigned[i]) {
                values[i] = i < firstAssigned ? values[firstAssigned] : values[i - 1];
            }
        }

        final List<CalibrationBin> fitted = new ArrayList<>(bins);
        for (int i = 0; i < bins; i++) {
            final double lower = i == 0 ? 0.0 : Utils.round((double) i / bins, FIT_PRECISION);
            final double upper = i == bins - 1 ? 1.0 : Utils.round((double) (i + 1) / bins, FIT_PRECISION);
            fitted.add(new CalibrationBin(lower, upper, Utils.round(values[i], FIT_PRECISION)));
        }
        return PostHocCalibrator.validateBins(fitted);
    }

    private static int firstAssigned(final boolean[] assigned) {
        for (int i = 0; i < assigned.length; i++) {
            if (assigned[i]) {
                return i;
            }
        }
        throw new IllegalStateException("no observation fell into any bin");
    }

    private static SummaryStatistics[] newStatistics(final int bins) {
        final SummaryStatistics[] statistics = new SummaryStatistics[bins];
        for (int i = 0; i < bins; i++) {
            statistics[i] = new SummaryStatistics();
        }
        return statistics;
    }
}
