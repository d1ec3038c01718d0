package com.sensorsentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Alert publishing policy, the {@code publish} section of the engine YAML.
 */
public class PublishSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Total publish attempts per alert, first try included. */
    private int maxAttempts = 3;

    private long retryWaitMillis = 500;

    void validate(List<String> errors) {
        if (maxAttempts < 1) {
            errors.add("publish.maxAttempts must be >= 1");
        }
        if (retryWaitMillis < 0) {
            errors.add("publish.retryWaitMillis must be >= 0");
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getRetryWaitMillis() {
        return retryWaitMillis;
    }

    public void setRetryWaitMillis(long retryWaitMillis) {
        this.retryWaitMillis = retryWaitMillis;
    }

    @Override
    public String toString() {
        return "PublishSettings{maxAttempts=" + maxAttempts + ", retryWaitMillis=" + retryWaitMillis + '}';
    }
}
