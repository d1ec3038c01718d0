package com.sensorsentinel.core.metrics;

/**
 * Counters and timings reported by the pipeline stages.
 *
 * <p>
 * The Flink job backs this with Flink metrics; the embedded engine and tests
 * use {@link CountingInferenceMetrics}. All methods must be cheap and
 * thread-safe.
 * </p>
 */
public interface InferenceMetrics {

    /** Does nothing. */
    InferenceMetrics NOOP = new InferenceMetrics() {
    };

    default void readingAccepted() {
    }

    default void readingRejected() {
    }

    default void readingLateDropped() {
    }

    default void summaryEmitted() {
    }

    default void modelUnavailable() {
    }

    default void schemaMismatch() {
    }

    default void degradedVerdict() {
    }

    default void alertPublished() {
    }

    default void publishFailed() {
    }

    default void recordLatency(long milliseconds) {
    }
}
