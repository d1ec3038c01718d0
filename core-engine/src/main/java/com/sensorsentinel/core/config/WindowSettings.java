package com.sensorsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sliding-window policy, the {@code window} section of the engine YAML.
 *
 * <p>
 * A window is bounded by time span, by reading count, or both. A bound of
 * {@code 0} disables it; at least one must be set.
 * </p>
 */
public class WindowSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Maximum event-time span of retained readings. */
    private long spanSeconds = 300;

    /** Maximum number of retained readings. */
    private int maxCount = 100;

    /** Windows holding fewer readings produce no summary. */
    private int minSamples = 5;

    /** How far behind the newest timestamp a reading may arrive and still be used. */
    private long allowedLatenessSeconds = 5;

    /** Emit a summary after this many released timestamps (count-driven emission). */
    private int emitEvery = 1;

    /** Event-time tick for emission; when positive it replaces {@link #emitEvery}. */
    private long tickIntervalSeconds = 0;

    /** Optional whitelist of sensors to keep; empty keeps all. */
    private List<String> sensors = new ArrayList<>();

    void validate(List<String> errors) {
        if (spanSeconds < 0) {
            errors.add("window.spanSeconds must be >= 0");
        }
        if (maxCount < 0) {
            errors.add("window.maxCount must be >= 0");
        }
        if (spanSeconds == 0 && maxCount == 0) {
            errors.add("window requires spanSeconds > 0 or maxCount > 0");
        }
        if (minSamples < 1) {
            errors.add("window.minSamples must be >= 1");
        }
        if (maxCount > 0 && minSamples > maxCount) {
            errors.add("window.minSamples (" + minSamples + ") exceeds window.maxCount (" + maxCount + ")");
        }
        if (allowedLatenessSeconds < 0) {
            errors.add("window.allowedLatenessSeconds must be >= 0");
        }
        if (emitEvery < 1) {
            errors.add("window.emitEvery must be >= 1");
        }
        if (tickIntervalSeconds < 0) {
            errors.add("window.tickIntervalSeconds must be >= 0");
        }
    }

    public long getSpanSeconds() {
        return spanSeconds;
    }

    public void setSpanSeconds(long spanSeconds) {
        this.spanSeconds = spanSeconds;
    }

    public int getMaxCount() {
        return maxCount;
    }

    public void setMaxCount(int maxCount) {
        this.maxCount = maxCount;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public long getAllowedLatenessSeconds() {
        return allowedLatenessSeconds;
    }

    public void setAllowedLatenessSeconds(long allowedLatenessSeconds) {
        this.allowedLatenessSeconds = allowedLatenessSeconds;
    }

    public int getEmitEvery() {
        return emitEvery;
    }

    public void setEmitEvery(int emitEvery) {
        this.emitEvery = emitEvery;
    }

    public long getTickIntervalSeconds() {
        return tickIntervalSeconds;
    }

    public void setTickIntervalSeconds(long tickIntervalSeconds) {
        this.tickIntervalSeconds = tickIntervalSeconds;
    }

    public List<String> getSensors() {
        return Collections.unmodifiableList(sensors);
    }

    public void setSensors(List<String> sensors) {
        this.sensors = sensors != null ? new ArrayList<>(sensors) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "WindowSettings{spanSeconds=" + spanSeconds + ", maxCount=" + maxCount
                + ", minSamples=" + minSamples + ", allowedLatenessSeconds=" + allowedLatenessSeconds
                + ", emitEvery=" + emitEvery + ", tickIntervalSeconds=" + tickIntervalSeconds
                + ", sensors=" + sensors + '}';
    }
}
