package org.pharmaguard.tools.pgx.confidence;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pharmaguard.tools.pgx.catalog.RuleCatalog;
import org.pharmaguard.utils.Utils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps a raw confidence score to a calibrated one through a monotonic, piecewise-constant bin map.
 * <p>
 * Bins are contiguous over [0, 1], half-open except the last, and their calibrated values never decrease, so
 * {@code calibrate(a) <= calibrate(b)} whenever {@code a <= b}. Without bins the calibrator is the identity
 * (rounded to two decimals, which is still monotonic).
 * </p>
 */
public final class PostHocCalibrator {

    private static final Logger logger = LogManager.getLogger(PostHocCalibrator.class);

    private static final double BOUNDARY_TOLERANCE = 1e-9;

    private final List<CalibrationBin> bins;

    public PostHocCalibrator(final List<CalibrationBin> bins) {
        this.bins = validateBins(Utils.nonNull(bins, "bins"));
    }

    public static PostHocCalibrator identity() {
        return new PostHocCalibrator(List.of());
    }

    /**
     * Builds the calibrator described by the catalog, falling back to identity when the catalog has no bins.
     */
    public static PostHocCalibrator fromCatalog(final RuleCatalog catalog) {
        if (catalog.getCalibrationBins().isEmpty()) {
            logger.warn("Rule catalog " + catalog.getVersion() + " has no calibration map; confidence scores are not calibrated");
            return identity();
        }
        return new PostHocCalibrator(catalog.getCalibrationBins());
    }

    /**
     * Sorts and checks a bin map.
     * @return the bins ordered by lower bound
     * @throws IllegalArgumentException if the bins leave gaps, overlap, miss [0, 1] or are not non-decreasing
     */
    public static List<CalibrationBin> validateBins(final List<CalibrationBin> bins) {
        Utils.containsNoNull(bins, "calibration bins cannot contain null");
        if (bins.isEmpty()) {
            return List.of();
        }
        final List<CalibrationBin> sorted = new ArrayList<>(bins);
        sorted.sort(Comparator.comparingDouble(CalibrationBin::lower));
        Utils.validateArg(Math.abs(sorted.get(0).lower()) < BOUNDARY_TOLERANCE, "calibration bins must start at 0");
        Utils.validateArg(Math.abs(sorted.get(sorted.size() - 1).upper() - 1.0) < BOUNDARY_TOLERANCE, "calibration bins must end at 1");
        for (int i = 1; i < sorted.size(); i++) {
            final CalibrationBin previous = sorted.get(i - 1);
            final CalibrationBin current = sorted.get(i);
            Utils.validateArg(Math.abs(previous.upper() - current.lower()) < BOUNDARY_TOLERANCE,
                    String.format("calibration bins must be contiguous but [%s, %s) is followed by [%s, %s)",
                            previous.lower(), previous.upper(), current.lower(), current.upper()));
            Utils.validateArg(current.calibrated() >= previous.calibrated(),
                    String.format("calibration map must be non-decreasing but %s follows %s", current.calibrated(), previous.calibrated()));
        }
        return List.copyOf(sorted);
    }

    public boolean isIdentity() {
        return bins.isEmpty();
    }

    public List<CalibrationBin> getBins() {
        return bins;
    }

    /**
     * @param rawScore any score; values outside [0, 1] are clamped first
     * @return the calibrated score, rounded to two decimals
     */
    public double calibrate(final double rawScore) {
        final double score = Utils.clampToUnitInterval(rawScore);
        for (int i = 0; i < bins.size(); i++) {
            final CalibrationBin bin = bins.get(i);
            if (bin.contains(score, i == bins.size() - 1)) {
                return Utils.round(bin.calibrated(), 2);
            }
        }
        return Utils.round(score, 2);
    }
}
