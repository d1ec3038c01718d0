package com.sensorsentinel.core.cache;

import com.sensorsentinel.core.model.ModelArtifact;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntFunction;

/**
 * Per-monitor cache slot.
 *
 * <p>
 * Written only by the single in-flight resolution of its monitor; read by
 * any caller. Methods synchronize on the entry, never on the cache.
 * </p>
 */
final class CacheEntry {

    private final String monitorId;

    private ModelArtifact artifact;
    private Instant loadedAt;
    private Instant lastBuildAttempt;
    private int consecutiveFailures;
    private Instant nextAttemptAt;
    private CompletableFuture<Void> runningBuild;

    private volatile long recency;

    CacheEntry(String monitorId) {
        this.monitorId = monitorId;
    }

    String monitorId() {
        return monitorId;
    }

    void touch(long tick) {
        recency = tick;
    }

    long recency() {
        return recency;
    }

    synchronized ModelArtifact artifact() {
        return artifact;
    }

    synchronized boolean isFresh(Instant now, Duration freshness) {
        return artifact != null && loadedAt != null && now.isBefore(loadedAt.plus(freshness));
    }

    synchronized boolean isBackingOff(Instant now) {
        return nextAttemptAt != null && now.isBefore(nextAttemptAt);
    }

    synchronized void admit(ModelArtifact newArtifact, Instant now) {
        artifact = newArtifact;
        loadedAt = now;
        consecutiveFailures = 0;
        nextAttemptAt = null;
    }

    /**
     * Register a build about to start.
     *
     * @param build completes when the build task returns
     * @return {@code false} if an earlier build is still running
     */
    synchronized boolean beginBuild(CompletableFuture<Void> build) {
        if (runningBuild != null && !runningBuild.isDone()) {
            return false;
        }
        runningBuild = build;
        return true;
    }

    synchronized void endBuild(CompletableFuture<Void> build) {
        if (runningBuild == build) {
            runningBuild = null;
        }
    }

    synchronized boolean isBuilding() {
        return runningBuild != null && !runningBuild.isDone();
    }

    synchronized void markBuildAttempt(Instant now) {
        lastBuildAttempt = now;
    }

    /**
     * @return the failure count including this one
     */
    synchronized int recordFailure(Instant now, IntFunction<Duration> backoffForFailures) {
        consecutiveFailures++;
        nextAttemptAt = now.plus(backoffForFailures.apply(consecutiveFailures));
        return consecutiveFailures;
    }

    synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    synchronized Instant nextAttemptAt() {
        return nextAttemptAt;
    }

    synchronized Instant lastBuildAttempt() {
        return lastBuildAttempt;
    }
}
