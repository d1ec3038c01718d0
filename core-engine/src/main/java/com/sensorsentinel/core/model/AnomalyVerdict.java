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
 * Outcome of the anomaly decision for one scored window.
 *
 * <p>
 * Only verdicts with {@link #isAnomaly()} set are turned into an
 * {@link Alert}. {@code degraded} marks a verdict scored with a stale model
 * after a failed refresh.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyVerdict implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String monitorId;
    private final long timestampMillis;
    private final double score;
    private final boolean anomaly;
    private final boolean degraded;
    private final double threshold;
    private final int consecutiveBreaches;
    private final String modelVersion;
    private final LinkedHashMap<String, Double> sensorMeans;
    private final ArrayList<String> topSensors;

    private AnomalyVerdict(Builder builder) {
        this.monitorId = Objects.requireNonNull(builder.monitorId, "monitorId must not be null");
        this.timestampMillis = Objects.requireNonNull(builder.timestamp, "timestamp must not be null")
                .toEpochMilli();
        this.score = builder.score;
        this.anomaly = builder.anomaly;
        this.degraded = builder.degraded;
        this.threshold = builder.threshold;
        this.consecutiveBreaches = builder.consecutiveBreaches;
        this.modelVersion = builder.modelVersion;
        this.sensorMeans = new LinkedHashMap<>(builder.sensorMeans);
        this.topSensors = new ArrayList<>(builder.topSensors);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getMonitorId() {
        return monitorId;
    }

    public Instant getTimestamp() {
        return Instant.ofEpochMilli(timestampMillis);
    }

    public double getScore() {
        return score;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getConsecutiveBreaches() {
        return consecutiveBreaches;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    /** @return per-sensor window means the score was computed from */
    public Map<String, Double> getSensorMeans() {
        return Collections.unmodifiableMap(sensorMeans);
    }

    public List<String> getTopSensors() {
        return Collections.unmodifiableList(topSensors);
    }

    @Override
    public String toString() {
        return "AnomalyVerdict{monitorId='" + monitorId + "', timestamp=" + getTimestamp()
                + ", score=" + score + ", anomaly=" + anomaly + ", degraded=" + degraded
                + ", threshold=" + threshold + ", consecutiveBreaches=" + consecutiveBreaches
                + ", modelVersion='" + modelVersion + "', topSensors=" + topSensors + '}';
    }

    public static class Builder {
        private String monitorId;
        private Instant timestamp;
        private double score;
        private boolean anomaly;
        private boolean degraded;
        private double threshold;
        private int consecutiveBreaches;
        private String modelVersion;
        private Map<String, Double> sensorMeans = Map.of();
        private List<String> topSensors = List.of();

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

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder consecutiveBreaches(int consecutiveBreaches) {
            this.consecutiveBreaches = consecutiveBreaches;
            return this;
        }

        public Builder modelVersion(String modelVersion) {
            this.modelVersion = modelVersion;
            return this;
        }

        public Builder sensorMeans(Map<String, Double> sensorMeans) {
            this.sensorMeans = Objects.requireNonNull(sensorMeans, "sensorMeans must not be null");
            return this;
        }

        public Builder topSensors(List<String> topSensors) {
            this.topSensors = Objects.requireNonNull(topSensors, "topSensors must not be null");
            return this;
        }

        public AnomalyVerdict build() {
            return new AnomalyVerdict(this);
        }
    }
}
