package com.sensorsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Alert published when a monitor's verdict is anomalous.
 *
 * <p>
 * Serialized to JSON and published to the configured alerts channel.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}, or {@link #fromVerdict(AnomalyVerdict)} for the
 * usual path. The builder enforces that {@code monitorId} and
 * {@code timestamp} are present; omitting either will throw a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Monitor whose window was flagged. */
    private String monitorId;

    /** Event time of the newest reading in the flagged window. */
    private Instant timestamp;

    /** Model anomaly score of the window. */
    private double score;

    /** Always {@code true} for published alerts; kept for consumers that read verdicts too. */
    private boolean anomaly;

    /** Scored with a stale model after a failed refresh. */
    private boolean degraded;

    /** Sensor name to window mean. */
    private Map<String, Double> features;

    /** Sensors that deviated most from the model's centre, strongest first. */
    private List<String> topSensors;

    /** Version of the artifact that produced the score. */
    private String modelVersion;

    /** Threshold that was in force for the monitor. */
    private double threshold;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public Alert() {
    }

    private Alert(Builder builder) {
        this.monitorId = Objects.requireNonNull(builder.monitorId, "monitorId must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.score = builder.score;
        this.anomaly = builder.anomaly;
        this.degraded = builder.degraded;
        this.features = builder.features != null ? new LinkedHashMap<>(builder.features) : null;
        this.topSensors = builder.topSensors != null ? new ArrayList<>(builder.topSensors) : null;
        this.modelVersion = builder.modelVersion;
        this.threshold = builder.threshold;
    }

    /**
     * Build the alert for a verdict.
     *
     * @param verdict an anomalous verdict; must not be {@code null}
     * @return alert carrying the verdict's score, features and model version
     */
    public static Alert fromVerdict(AnomalyVerdict verdict) {
        return fromVerdict(verdict, Collections.emptyMap());
    }

    /**
     * Build the alert for a verdict, showing sensors under their display
     * names. Sensors without a label keep their id.
     *
     * @param verdict      an anomalous verdict; must not be {@code null}
     * @param sensorLabels sensor id to display name; must not be {@code null}
     */
    public static Alert fromVerdict(AnomalyVerdict verdict, Map<String, String> sensorLabels) {
        Objects.requireNonNull(verdict, "verdict must not be null");
        Objects.requireNonNull(sensorLabels, "sensorLabels must not be null");
        Map<String, Double> features = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : verdict.getSensorMeans().entrySet()) {
            features.put(sensorLabels.getOrDefault(e.getKey(), e.getKey()), e.getValue());
        }
        List<String> topSensors = new ArrayList<>();
        for (String sensor : verdict.getTopSensors()) {
            topSensors.add(sensorLabels.getOrDefault(sensor, sensor));
        }
        return builder()
                .monitorId(verdict.getMonitorId())
                .timestamp(verdict.getTimestamp())
                .score(verdict.getScore())
                .anomaly(verdict.isAnomaly())
                .degraded(verdict.isDegraded())
                .features(features)
                .topSensors(topSensors)
                .modelVersion(verdict.getModelVersion())
                .threshold(verdict.getThreshold())
                .build();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     *
     * <p>
     * {@code monitorId} and {@code timestamp} are <strong>required</strong>.
     * </p>
     */
    public static class Builder {
        private String monitorId;
        private Instant timestamp;
        private double score;
        private boolean anomaly = true;
        private boolean degraded;
        private Map<String, Double> features;
        private List<String> topSensors;
        private String modelVersion;
        private double threshold;

        public Builder monitorId(String monitorId) {
            this.monitorId = monitorId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder anomaly(boolean anomaly) {
            this.anomaly = anomaly;
            return this;
        }

        public Builder degraded(boolean degraded) {
            this.degraded = degraded;
            return this;
        }

        public Builder features(Map<String, Double> features) {
            this.features = features;
            return this;
        }

        public Builder topSensors(List<String> topSensors) {
            this.topSensors = topSensors;
            return this;
        }

        public Builder modelVersion(String modelVersion) {
            this.modelVersion = modelVersion;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getMonitorId() {
        return monitorId;
    }

    public void setMonitorId(String monitorId) {
        this.monitorId = monitorId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public void setAnomaly(boolean anomaly) {
        this.anomaly = anomaly;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public void setDegraded(boolean degraded) {
        this.degraded = degraded;
    }

    /**
     * @return unmodifiable sensor-mean map, or {@code null} if not set
     */
    public Map<String, Double> getFeatures() {
        return features != null ? Collections.unmodifiableMap(features) : null;
    }

    public void setFeatures(Map<String, Double> features) {
        this.features = features != null ? new LinkedHashMap<>(features) : null;
    }

    public List<String> getTopSensors() {
        return topSensors != null ? Collections.unmodifiableList(topSensors) : null;
    }

    public void setTopSensors(List<String> topSensors) {
        this.topSensors = topSensors != null ? new ArrayList<>(topSensors) : null;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public void setModelVersion(String modelVersion) {
        this.modelVersion = modelVersion;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(monitorId, alert.monitorId)
                && Objects.equals(timestamp, alert.timestamp)
                && Objects.equals(modelVersion, alert.modelVersion)
                && Double.compare(score, alert.score) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(monitorId, timestamp, modelVersion, score);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "monitorId='" + monitorId + '\'' +
                ", timestamp=" + timestamp +
                ", score=" + score +
                ", degraded=" + degraded +
                ", topSensors=" + topSensors +
                ", modelVersion='" + modelVersion + '\'' +
                '}';
    }
}
