package com.sensorsentinel.core.ml;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * Centres each feature on its median and divides by its inter-quartile range.
 *
 * <p>
 * Robust to the outliers the model is meant to find. A feature with zero IQR
 * is only centred.
 * </p>
 */
public class RobustScaler implements FeatureScaler {

    private final double[] centers;
    private final double[] scales;

    @JsonCreator
    public RobustScaler(@JsonProperty("centers") double[] centers,
            @JsonProperty("scales") double[] scales) {
        Objects.requireNonNull(centers, "centers must not be null");
        Objects.requireNonNull(scales, "scales must not be null");
        if (centers.length != scales.length) {
            throw new IllegalArgumentException("centers and scales differ in length: "
                    + centers.length + " vs " + scales.length);
        }
        this.centers = centers.clone();
        this.scales = scales.clone();
    }

    /**
     * Fit a scaler on training rows.
     *
     * @param rows training samples, all of equal length; at least one row
     */
    public static RobustScaler fit(double[][] rows) {
        if (rows == null || rows.length == 0) {
            throw new IllegalArgumentException("Cannot fit a scaler on no data");
        }
        int dims = rows[0].length;
        double[] centers = new double[dims];
        double[] scales = new double[dims];
        double[] column = new double[rows.length];
        for (int j = 0; j < dims; j++) {
            for (int i = 0; i < rows.length; i++) {
                column[i] = rows[i][j];
            }
            Arrays.sort(column);
            centers[j] = percentile(column, 50);
            double iqr = percentile(column, 75) - percentile(column, 25);
            scales[j] = iqr > 0 ? iqr : 1.0;
        }
        return new RobustScaler(centers, scales);
    }

    /** Linear-interpolated percentile of an already sorted array. */
    static double percentile(double[] sorted, double p) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = p / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        return sorted[lo] + (rank - lo) * (sorted[hi] - sorted[lo]);
    }

    @Override
    public double[] transform(double[] raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        if (raw.length != centers.length) {
            throw new IllegalArgumentException("Expected " + centers.length + " features, got " + raw.length);
        }
        double[] scaled = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            scaled[i] = (raw[i] - centers[i]) / scales[i];
        }
        return scaled;
    }

    @Override
    public int dimension() {
        return centers.length;
    }

    public double[] getCenters() {
        return centers.clone();
    }

    public double[] getScales() {
        return scales.clone();
    }
}
