package com.sensorsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Anomaly decision policy, the {@code detection} section of the engine YAML.
 */
public class DetectionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Default anomaly threshold {@code T}; scores at or above it breach. */
    private double threshold = 0.6;

    /** Default consecutive breaches {@code K} required to flag. */
    private int breachCount = 1;

    /** Number of contributing sensors reported per verdict. */
    private int topSensors = 2;

    private List<MonitorOverride> overrides = new ArrayList<>();

    /** Display names for sensor ids, used in published alerts only. */
    private LinkedHashMap<String, String> sensorLabels = new LinkedHashMap<>();

    /**
     * Resolve the policy for a monitor, applying its override when present.
     *
     * @param monitorId monitor id; must not be {@code null}
     * @return effective threshold and breach count
     */
    public MonitorPolicy policyFor(String monitorId) {
        Objects.requireNonNull(monitorId, "monitorId must not be null");
        double t = threshold;
        int k = breachCount;
        for (MonitorOverride override : overrides) {
            if (monitorId.equals(override.getMonitorId())) {
                if (override.getThreshold() != null) {
                    t = override.getThreshold();
                }
                if (override.getBreachCount() != null) {
                    k = override.getBreachCount();
                }
                break;
            }
        }
        return new MonitorPolicy(t, k);
    }

    void validate(List<String> errors) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            errors.add("detection.threshold must be within [0, 1]");
        }
        if (breachCount < 1) {
            errors.add("detection.breachCount must be >= 1");
        }
        if (topSensors < 0) {
            errors.add("detection.topSensors must be >= 0");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < overrides.size(); i++) {
            MonitorOverride override = Objects.requireNonNull(overrides.get(i),
                    "Override at index " + i + " is null");
            try {
                override.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (override.getMonitorId() != null && !seen.add(override.getMonitorId())) {
                errors.add("Duplicate override for monitor '" + override.getMonitorId() + "'");
            }
        }
        for (Map.Entry<String, String> label : sensorLabels.entrySet()) {
            if (label.getKey() == null || label.getKey().isBlank()) {
                errors.add("detection.sensorLabels must not contain a blank sensor id");
            } else if (label.getValue() == null || label.getValue().isBlank()) {
                errors.add("detection.sensorLabels['" + label.getKey() + "'] must not be blank");
            }
        }
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getBreachCount() {
        return breachCount;
    }

    public void setBreachCount(int breachCount) {
        this.breachCount = breachCount;
    }

    public int getTopSensors() {
        return topSensors;
    }

    public void setTopSensors(int topSensors) {
        this.topSensors = topSensors;
    }

    public List<MonitorOverride> getOverrides() {
        return Collections.unmodifiableList(overrides);
    }

    public void setOverrides(List<MonitorOverride> overrides) {
        this.overrides = overrides != null ? new ArrayList<>(overrides) : new ArrayList<>();
    }

    public Map<String, String> getSensorLabels() {
        return Collections.unmodifiableMap(sensorLabels);
    }

    public void setSensorLabels(Map<String, String> sensorLabels) {
        this.sensorLabels = sensorLabels != null ? new LinkedHashMap<>(sensorLabels) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "DetectionSettings{threshold=" + threshold + ", breachCount=" + breachCount
                + ", topSensors=" + topSensors + ", overrides=" + overrides
                + ", sensorLabels=" + sensorLabels.size() + '}';
    }
}
