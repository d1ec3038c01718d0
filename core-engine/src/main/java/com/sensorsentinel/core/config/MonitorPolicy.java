package com.sensorsentinel.core.config;

import java.io.Serializable;

/**
 * Effective detection parameters for one monitor: threshold {@code T} and
 * breach count {@code K}.
 */
public final class MonitorPolicy implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double threshold;
    private final int breachCount;

    public MonitorPolicy(double threshold, int breachCount) {
        if (breachCount < 1) {
            throw new IllegalArgumentException("breachCount must be >= 1, got " + breachCount);
        }
        this.threshold = threshold;
        this.breachCount = breachCount;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getBreachCount() {
        return breachCount;
    }

    @Override
    public String toString() {
        return "MonitorPolicy{threshold=" + threshold + ", breachCount=" + breachCount + '}';
    }
}
