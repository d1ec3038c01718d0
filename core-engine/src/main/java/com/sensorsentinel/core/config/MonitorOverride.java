package com.sensorsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-monitor replacement of the default detection threshold and/or breach
 * count.
 *
 * <pre>
 * detection:
 *   overrides:
 *     - monitorId: pump-7
 *       threshold: 0.72
 *       breachCount: 3
 * </pre>
 *
 * <p>
 * Unset fields fall back to the defaults of the {@code detection} section.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorOverride implements Serializable {

    private static final long serialVersionUID = 1L;

    private String monitorId;

    private Double threshold;

    private Integer breachCount;

    /**
     * Validate the override.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (monitorId == null || monitorId.isBlank()) {
            errors.add("Override 'monitorId' is required");
        }
        if (threshold == null && breachCount == null) {
            errors.add("Override '" + monitorId + "' sets neither 'threshold' nor 'breachCount'");
        }
        if (threshold != null && (threshold.isNaN() || threshold < 0.0 || threshold > 1.0)) {
            errors.add("Override '" + monitorId + "' requires 0 <= 'threshold' <= 1");
        }
        if (breachCount != null && breachCount < 1) {
            errors.add("Override '" + monitorId + "' requires 'breachCount' >= 1");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    public String getMonitorId() {
        return monitorId;
    }

    public void setMonitorId(String monitorId) {
        this.monitorId = monitorId != null ? monitorId.trim() : null;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public Integer getBreachCount() {
        return breachCount;
    }

    public void setBreachCount(Integer breachCount) {
        this.breachCount = breachCount;
    }

    @Override
    public String toString() {
        return "MonitorOverride{monitorId='" + monitorId + "', threshold=" + threshold
                + ", breachCount=" + breachCount + '}';
    }
}
