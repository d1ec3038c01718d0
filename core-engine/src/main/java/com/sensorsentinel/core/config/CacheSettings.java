package com.sensorsentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Model cache policy, the {@code cache} section of the engine YAML.
 */
public class CacheSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Maximum number of resident monitor entries before LRU eviction. */
    private int capacity = 32;

    /** Age after which a loaded artifact is refreshed from the store. */
    private long freshnessSeconds = 3600;

    private long fetchTimeoutMillis = 30_000;

    private long buildTimeoutMillis = 600_000;

    /** Maximum number of trend records requested for a rebuild. */
    private int historyLimit = 5000;

    /** Attempts per store read when the store reports an I/O error. */
    private int storeMaxAttempts = 3;

    private long storeRetryWaitMillis = 200;

    private long backoffInitialSeconds = 30;

    private long backoffMaxSeconds = 1800;

    private double backoffMultiplier = 2.0;

    /** Threads per I/O pool; store I/O and builds each get a pool of this size. */
    private int ioThreads = 4;

    void validate(List<String> errors) {
        if (capacity < 1) {
            errors.add("cache.capacity must be >= 1");
        }
        if (freshnessSeconds <= 0) {
            errors.add("cache.freshnessSeconds must be > 0");
        }
        if (fetchTimeoutMillis <= 0) {
            errors.add("cache.fetchTimeoutMillis must be > 0");
        }
        if (buildTimeoutMillis <= 0) {
            errors.add("cache.buildTimeoutMillis must be > 0");
        }
        if (historyLimit < 1) {
            errors.add("cache.historyLimit must be >= 1");
        }
        if (storeMaxAttempts < 1) {
            errors.add("cache.storeMaxAttempts must be >= 1");
        }
        if (storeRetryWaitMillis < 0) {
            errors.add("cache.storeRetryWaitMillis must be >= 0");
        }
        if (backoffInitialSeconds <= 0) {
            errors.add("cache.backoffInitialSeconds must be > 0");
        }
        if (backoffMaxSeconds < backoffInitialSeconds) {
            errors.add("cache.backoffMaxSeconds must be >= cache.backoffInitialSeconds");
        }
        if (backoffMultiplier < 1.0) {
            errors.add("cache.backoffMultiplier must be >= 1.0");
        }
        if (ioThreads < 1) {
            errors.add("cache.ioThreads must be >= 1");
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public long getFreshnessSeconds() {
        return freshnessSeconds;
    }

    public void setFreshnessSeconds(long freshnessSeconds) {
        this.freshnessSeconds = freshnessSeconds;
    }

    public long getFetchTimeoutMillis() {
        return fetchTimeoutMillis;
    }

    public void setFetchTimeoutMillis(long fetchTimeoutMillis) {
        this.fetchTimeoutMillis = fetchTimeoutMillis;
    }

    public long getBuildTimeoutMillis() {
        return buildTimeoutMillis;
    }

    public void setBuildTimeoutMillis(long buildTimeoutMillis) {
        this.buildTimeoutMillis = buildTimeoutMillis;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public int getStoreMaxAttempts() {
        return storeMaxAttempts;
    }

    public void setStoreMaxAttempts(int storeMaxAttempts) {
        this.storeMaxAttempts = storeMaxAttempts;
    }

    public long getStoreRetryWaitMillis() {
        return storeRetryWaitMillis;
    }

    public void setStoreRetryWaitMillis(long storeRetryWaitMillis) {
        this.storeRetryWaitMillis = storeRetryWaitMillis;
    }

    public long getBackoffInitialSeconds() {
        return backoffInitialSeconds;
    }

    public void setBackoffInitialSeconds(long backoffInitialSeconds) {
        this.backoffInitialSeconds = backoffInitialSeconds;
    }

    public long getBackoffMaxSeconds() {
        return backoffMaxSeconds;
    }

    public void setBackoffMaxSeconds(long backoffMaxSeconds) {
        this.backoffMaxSeconds = backoffMaxSeconds;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public int getIoThreads() {
        return ioThreads;
    }

    public void setIoThreads(int ioThreads) {
        this.ioThreads = ioThreads;
    }

    @Override
    public String toString() {
        return "CacheSettings{capacity=" + capacity + ", freshnessSeconds=" + freshnessSeconds
                + ", fetchTimeoutMillis=" + fetchTimeoutMillis + ", buildTimeoutMillis=" + buildTimeoutMillis
                + ", historyLimit=" + historyLimit + ", storeMaxAttempts=" + storeMaxAttempts
                + ", backoffInitialSeconds=" + backoffInitialSeconds + ", backoffMaxSeconds=" + backoffMaxSeconds
                + ", backoffMultiplier=" + backoffMultiplier + ", ioThreads=" + ioThreads + '}';
    }
}
