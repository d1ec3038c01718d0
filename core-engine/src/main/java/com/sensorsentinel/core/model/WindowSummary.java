package com.sensorsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate of one monitor's sliding window at the moment it was emitted.
 *
 * <p>
 * Statistics are indexed by position in {@link #getSensorNames()}, which is
 * sorted. A sensor's statistics only cover the readings that carried it.
 * The model feature vector is {@link #featureVector()}: the per-sensor means.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String monitorId;
    private final long windowStartMillis;
    private final long windowEndMillis;
    private final int sampleCount;
    private final ArrayList<String> sensorNames;
    private final double[] means;
    private final double[] stdDevs;
    private final double[] mins;
    private final double[] maxs;
    private final double[] latest;

    public WindowSummary(String monitorId, long windowStartMillis, long windowEndMillis, int sampleCount,
            List<String> sensorNames, double[] means, double[] stdDevs, double[] mins, double[] maxs,
            double[] latest) {
        this.monitorId = Objects.requireNonNull(monitorId, "monitorId must not be null");
        this.windowStartMillis = windowStartMillis;
        this.windowEndMillis = windowEndMillis;
        this.sampleCount = sampleCount;
        this.sensorNames = new ArrayList<>(sensorNames);
        int n = this.sensorNames.size();
        this.means = checked(means, n, "means");
        this.stdDevs = checked(stdDevs, n, "stdDevs");
        this.mins = checked(mins, n, "mins");
        this.maxs = checked(maxs, n, "maxs");
        this.latest = checked(latest, n, "latest");
    }

    private static double[] checked(double[] values, int expected, String name) {
        Objects.requireNonNull(values, name + " must not be null");
        if (values.length != expected) {
            throw new IllegalArgumentException(name + " has " + values.length
                    + " entries, expected " + expected);
        }
        return values.clone();
    }

    public String getMonitorId() {
        return monitorId;
    }

    public Instant getWindowStart() {
        return Instant.ofEpochMilli(windowStartMillis);
    }

    public Instant getWindowEnd() {
        return Instant.ofEpochMilli(windowEndMillis);
    }

    public long getWindowEndMillis() {
        return windowEndMillis;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public List<String> getSensorNames() {
        return Collections.unmodifiableList(sensorNames);
    }

    public double mean(String sensor) {
        return means[indexOf(sensor)];
    }

    public double stdDev(String sensor) {
        return stdDevs[indexOf(sensor)];
    }

    public double min(String sensor) {
        return mins[indexOf(sensor)];
    }

    public double max(String sensor) {
        return maxs[indexOf(sensor)];
    }

    public double latest(String sensor) {
        return latest[indexOf(sensor)];
    }

    /** @return per-sensor means in sensor-name order (a copy) */
    public double[] featureVector() {
        return means.clone();
    }

    /** @return sensor name to window mean, in sensor-name order */
    public Map<String, Double> sensorMeans() {
        Map<String, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < sensorNames.size(); i++) {
            result.put(sensorNames.get(i), means[i]);
        }
        return result;
    }

    private int indexOf(String sensor) {
        int idx = sensorNames.indexOf(sensor);
        if (idx < 0) {
            throw new IllegalArgumentException("Sensor not in window: " + sensor);
        }
        return idx;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WindowSummary that)) {
            return false;
        }
        return windowStartMillis == that.windowStartMillis
                && windowEndMillis == that.windowEndMillis
                && sampleCount == that.sampleCount
                && monitorId.equals(that.monitorId)
                && sensorNames.equals(that.sensorNames)
                && Arrays.equals(means, that.means)
                && Arrays.equals(stdDevs, that.stdDevs)
                && Arrays.equals(mins, that.mins)
                && Arrays.equals(maxs, that.maxs)
                && Arrays.equals(latest, that.latest);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(monitorId, windowStartMillis, windowEndMillis, sampleCount, sensorNames);
        result = 31 * result + Arrays.hashCode(means);
        return result;
    }

    @Override
    public String toString() {
        return "WindowSummary{monitorId='" + monitorId + "', start=" + getWindowStart()
                + ", end=" + getWindowEnd() + ", samples=" + sampleCount
                + ", means=" + sensorMeans() + '}';
    }
}
