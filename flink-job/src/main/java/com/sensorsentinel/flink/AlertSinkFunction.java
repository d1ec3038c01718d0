package com.sensorsentinel.flink;

import com.sensorsentinel.core.config.PublishSettings;
import com.sensorsentinel.core.emit.AlertEmitter;
import com.sensorsentinel.core.model.AnomalyVerdict;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.runtime.state.FunctionInitializationContext;
import org.apache.flink.runtime.state.FunctionSnapshotContext;
import org.apache.flink.streaming.api.checkpoint.CheckpointedFunction;
import org.apache.flink.streaming.api.functions.sink.RichSinkFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sends anomalous verdicts to the alerts topic through an {@link AlertEmitter}.
 *
 * <p>
 * {@link #invoke} only hands the verdict to the emitter, which publishes and
 * retries off the task thread. Alerts still in flight are awaited before a
 * checkpoint completes and when the sink closes, so a checkpoint never covers
 * an alert that was not yet published or given up on.
 * </p>
 *
 * <p>
 * A publish that still fails after its retries is logged and counted by the
 * emitter; the sink never fails the job for it.
 * </p>
 */
public class AlertSinkFunction extends RichSinkFunction<AnomalyVerdict> implements CheckpointedFunction {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AlertSinkFunction.class);

    private final JobConfig jobConfig;
    private final PublishSettings publishSettings;
    private final HashMap<String, String> sensorLabels;

    private transient KafkaAlertPublisher publisher;
    private transient AlertEmitter emitter;
    private transient Set<CompletableFuture<Boolean>> pending;

    public AlertSinkFunction(JobConfig jobConfig, PublishSettings publishSettings, Map<String, String> sensorLabels) {
        this.jobConfig = Objects.requireNonNull(jobConfig, "Job config must not be null");
        this.publishSettings = Objects.requireNonNull(publishSettings, "Publish settings must not be null");
        this.sensorLabels = new HashMap<>(Objects.requireNonNull(sensorLabels, "Sensor labels must not be null"));
    }

    @Override
    public void open(Configuration parameters) {
        pending = ConcurrentHashMap.newKeySet();
        publisher = KafkaAlertPublisher.create(jobConfig);
        emitter = new AlertEmitter(publisher, publishSettings, sensorLabels,
                new InferenceJobMetrics(getRuntimeContext().getMetricGroup()));
        LOG.info("AlertSinkFunction opened: topic={} labelledSensors={}",
                jobConfig.getKafkaAlertTopic(), sensorLabels.size());
    }

    @Override
    public void invoke(AnomalyVerdict verdict, Context context) {
        CompletableFuture<Boolean> emitted = emitter.emit(verdict);
        pending.add(emitted);
        emitted.whenComplete((published, error) -> pending.remove(emitted));
    }

    @Override
    public void initializeState(FunctionInitializationContext context) {
        // alerts are not replayed from state; in-flight ones are flushed at every checkpoint
    }

    @Override
    public void snapshotState(FunctionSnapshotContext context) {
        flush();
    }

    @Override
    public void close() {
        if (pending != null) {
            flush();
        }
        if (emitter != null) {
            emitter.close();
        }
        if (publisher != null) {
            publisher.close();
        }
    }

    private void flush() {
        int inFlight = pending.size();
        if (inFlight == 0) {
            return;
        }
        LOG.debug("Waiting for {} in-flight alert(s)", inFlight);
        // emit futures never fail, they complete with false instead
        CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])).join();
    }
}
