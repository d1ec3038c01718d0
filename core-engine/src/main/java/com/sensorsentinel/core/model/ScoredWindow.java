package com.sensorsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A window summary together with the model score it received.
 *
 * <p>
 * Hand-off between the (asynchronous) scoring stage and the per-monitor
 * decision stage.
 * </p>
 */
public final class ScoredWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final WindowSummary summary;
    private final double score;
    private final boolean degraded;
    private final String modelVersion;
    private final ArrayList<String> topSensors;

    public ScoredWindow(WindowSummary summary, double score, boolean degraded, String modelVersion,
            List<String> topSensors) {
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
        this.score = score;
        this.degraded = degraded;
        this.modelVersion = modelVersion;
        this.topSensors = new ArrayList<>(topSensors != null ? topSensors : List.of());
    }

    public String getMonitorId() {
        return summary.getMonitorId();
    }

    public WindowSummary getSummary() {
        return summary;
    }

    public double getScore() {
        return score;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public List<String> getTopSensors() {
        return Collections.unmodifiableList(topSensors);
    }

    @Override
    public String toString() {
        return "ScoredWindow{monitorId='" + getMonitorId() + "', end=" + summary.getWindowEnd()
                + ", score=" + score + ", degraded=" + degraded
                + ", modelVersion='" + modelVersion + "'}";
    }
}
