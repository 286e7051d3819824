package org.pharmaguard.metrics;

import htsjdk.samtools.metrics.MetricBase;

import java.io.Serializable;

/** Calibration quality of confidence scores measured against labeled outcomes. */
public final class CalibrationQualityMetrics extends MetricBase implements Serializable {
    private static final long serialVersionUID = 1;

    //Note: those fields must be public and upper case because code in the superclass finds them only if they are.

    /** The number of labeled observations */
    public long OBSERVATIONS;

    /** The number of equal-width confidence bins used for ECE */
    public int BINS;

    /** The fraction of observations labeled correct */
    public double ACCURACY;

    /** The mean reported confidence */
    public double MEAN_CONFIDENCE;

    /** Expected calibration error: count-weighted mean of |mean confidence - accuracy| over the bins */
    public double EXPECTED_CALIBRATION_ERROR;

    /** Mean squared difference between confidence and outcome */
    public double BRIER_SCORE;
}
