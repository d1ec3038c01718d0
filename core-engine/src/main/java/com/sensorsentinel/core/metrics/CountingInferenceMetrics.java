package com.sensorsentinel.core.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link InferenceMetrics}.
 */
public class CountingInferenceMetrics implements InferenceMetrics {

    private final AtomicLong readingsAccepted = new AtomicLong();
    private final AtomicLong readingsRejected = new AtomicLong();
    private final AtomicLong readingsLateDropped = new AtomicLong();
    private final AtomicLong summariesEmitted = new AtomicLong();
    private final AtomicLong modelsUnavailable = new AtomicLong();
    private final AtomicLong schemaMismatches = new AtomicLong();
    private final AtomicLong degradedVerdicts = new AtomicLong();
    private final AtomicLong alertsPublished = new AtomicLong();
    private final AtomicLong publishFailures = new AtomicLong();
    private final AtomicLong latencySamples = new AtomicLong();

    @Override
    public void readingAccepted() {
        readingsAccepted.incrementAndGet();
    }

    @Override
    public void readingRejected() {
        readingsRejected.incrementAndGet();
    }

    @Override
    public void readingLateDropped() {
        readingsLateDropped.incrementAndGet();
    }

    @Override
    public void summaryEmitted() {
        summariesEmitted.incrementAndGet();
    }

    @Override
    public void modelUnavailable() {
        modelsUnavailable.incrementAndGet();
    }

    @Override
    public void schemaMismatch() {
        schemaMismatches.incrementAndGet();
    }

    @Override
    public void degradedVerdict() {
        degradedVerdicts.incrementAndGet();
    }

    @Override
    public void alertPublished() {
        alertsPublished.incrementAndGet();
    }

    @Override
    public void publishFailed() {
        publishFailures.incrementAndGet();
    }

    @Override
    public void recordLatency(long milliseconds) {
        latencySamples.incrementAndGet();
    }

    public long getReadingsAccepted() {
        return readingsAccepted.get();
    }

    public long getReadingsRejected() {
        return readingsRejected.get();
    }

    public long getReadingsLateDropped() {
        return readingsLateDropped.get();
    }

    public long getSummariesEmitted() {
        return summariesEmitted.get();
    }

    public long getModelsUnavailable() {
        return modelsUnavailable.get();
    }

    public long getSchemaMismatches() {
        return schemaMismatches.get();
    }

    public long getDegradedVerdicts() {
        return degradedVerdicts.get();
    }

    public long getAlertsPublished() {
        return alertsPublished.get();
    }

    public long getPublishFailures() {
        return publishFailures.get();
    }

    public long getLatencySamples() {
        return latencySamples.get();
    }
}
