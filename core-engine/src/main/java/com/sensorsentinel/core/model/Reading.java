package com.sensorsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One multi-sensor measurement reported by a monitor.
 *
 * <p>
 * Immutable. Sensor values are kept sorted by sensor name so that every
 * derived structure (summaries, feature vectors) iterates sensors in the same
 * order. The timestamp is the source (event) time, held as epoch millis so
 * the object stays cheap to ship through Flink.
 * </p>
 *
 * @since 1.0.0
 */
public final class Reading implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String monitorId;
    private final long timestampMillis;
    private final TreeMap<String, Double> sensors;

    public Reading(String monitorId, Instant timestamp, Map<String, Double> sensors) {
        this(monitorId, Objects.requireNonNull(timestamp, "timestamp must not be null").toEpochMilli(), sensors);
    }

    public Reading(String monitorId, long timestampMillis, Map<String, Double> sensors) {
        this.monitorId = Objects.requireNonNull(monitorId, "monitorId must not be null");
        this.timestampMillis = timestampMillis;
        this.sensors = new TreeMap<>(Objects.requireNonNull(sensors, "sensors must not be null"));
    }

    public String getMonitorId() {
        return monitorId;
    }

    public long getTimestampMillis() {
        return timestampMillis;
    }

    public Instant getTimestamp() {
        return Instant.ofEpochMilli(timestampMillis);
    }

    /** @return sensor name to value, sorted by name; never {@code null} */
    public Map<String, Double> getSensors() {
        return Collections.unmodifiableMap(sensors);
    }

    /**
     * Restrict this reading to the given sensors.
     *
     * @param keep sensor names to retain; an empty collection keeps everything
     * @return this instance when nothing is removed, otherwise a projected copy
     */
    public Reading project(Collection<String> keep) {
        if (keep == null || keep.isEmpty() || keep.containsAll(sensors.keySet())) {
            return this;
        }
        TreeMap<String, Double> projected = new TreeMap<>(sensors);
        projected.keySet().retainAll(keep);
        return new Reading(monitorId, timestampMillis, projected);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Reading that)) {
            return false;
        }
        return timestampMillis == that.timestampMillis
                && monitorId.equals(that.monitorId)
                && sensors.equals(that.sensors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(monitorId, timestampMillis, sensors);
    }

    @Override
    public String toString() {
        return "Reading{monitorId='" + monitorId + "', timestamp=" + getTimestamp()
                + ", sensors=" + sensors + '}';
    }
}
