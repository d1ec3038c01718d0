package com.sensorsentinel.flink;

import com.sensorsentinel.core.metrics.InferenceMetrics;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metric definitions for Sensor Sentinel.
 * <p>
 * Flink exposes these via its configured metric reporters (e.g. Prometheus).
 * The metric reporter is configured in {@code flink-conf.yaml} at cluster
 * level; the job only defines the metrics. Each operator registers its own
 * instance, so a counter only moves in the operator that owns that stage.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code readings_accepted_total}, {@code readings_rejected_total},
 *   {@code readings_late_total}</li>
 *   <li>{@code windows_emitted_total}</li>
 *   <li>{@code models_unavailable_total}, {@code schema_mismatches_total},
 *   {@code degraded_verdicts_total}</li>
 *   <li>{@code alerts_published_total}, {@code alert_publish_failures_total}</li>
 *   <li>{@code processing_latency_ms} - histogram of per-window scoring latency</li>
 * </ul>
 */
public class InferenceJobMetrics implements InferenceMetrics {

    private final Counter readingsAccepted;
    private final Counter readingsRejected;
    private final Counter readingsLate;
    private final Counter windowsEmitted;
    private final Counter modelsUnavailable;
    private final Counter schemaMismatches;
    private final Counter degradedVerdicts;
    private final Counter alertsPublished;
    private final Counter publishFailures;
    private final Histogram processingLatency;

    public InferenceJobMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("sensor_sentinel");

        this.readingsAccepted = group.counter("readings_accepted_total");
        this.readingsRejected = group.counter("readings_rejected_total");
        this.readingsLate = group.counter("readings_late_total");
        this.windowsEmitted = group.counter("windows_emitted_total");
        this.modelsUnavailable = group.counter("models_unavailable_total");
        this.schemaMismatches = group.counter("schema_mismatches_total");
        this.degradedVerdicts = group.counter("degraded_verdicts_total");
        this.alertsPublished = group.counter("alerts_published_total");
        this.publishFailures = group.counter("alert_publish_failures_total");

        // sliding window of 350 samples, exposes p50/p95/p99
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    @Override
    public void readingAccepted() {
        readingsAccepted.inc();
    }

    @Override
    public void readingRejected() {
        readingsRejected.inc();
    }

    @Override
    public void readingLateDropped() {
        readingsLate.inc();
    }

    @Override
    public void summaryEmitted() {
        windowsEmitted.inc();
    }

    @Override
    public void modelUnavailable() {
        modelsUnavailable.inc();
    }

    @Override
    public void schemaMismatch() {
        schemaMismatches.inc();
    }

    @Override
    public void degradedVerdict() {
        degradedVerdicts.inc();
    }

    @Override
    public void alertPublished() {
        alertsPublished.inc();
    }

    @Override
    public void publishFailed() {
        publishFailures.inc();
    }

    @Override
    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
