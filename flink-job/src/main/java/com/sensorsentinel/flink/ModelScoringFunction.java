package com.sensorsentinel.flink;

import com.sensorsentinel.core.cache.ModelCache;
import com.sensorsentinel.core.config.EngineConfig;
import com.sensorsentinel.core.engine.ScoringResult;
import com.sensorsentinel.core.engine.ScoringStage;
import com.sensorsentinel.core.io.HttpTrendHistoryClient;
import com.sensorsentinel.core.io.S3ModelStore;
import com.sensorsentinel.core.metrics.InferenceMetrics;
import com.sensorsentinel.core.ml.IsolationForestModelBuilder;
import com.sensorsentinel.core.ml.JsonArtifactCodec;
import com.sensorsentinel.core.model.ScoredWindow;
import com.sensorsentinel.core.model.WindowSummary;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.async.ResultFuture;
import org.apache.flink.streaming.api.functions.async.RichAsyncFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.Objects;

/**
 * Resolves each window's model through a {@link ModelCache} and scores it,
 * without blocking the task thread.
 *
 * <p>
 * Each parallel instance owns one cache. Windows that cannot be scored
 * (no model, schema mismatch, scoring error) complete with no output; the
 * reason is logged and counted by the {@link ScoringStage}.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelScoringFunction extends RichAsyncFunction<WindowSummary, ScoredWindow> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ModelScoringFunction.class);

    private final EngineConfig engineConfig;
    private final JobConfig jobConfig;

    private transient ModelCache cache;
    private transient S3ModelStore store;
    private transient ScoringStage scoring;
    private transient InferenceMetrics metrics;

    public ModelScoringFunction(EngineConfig engineConfig, JobConfig jobConfig) {
        this.engineConfig = Objects.requireNonNull(engineConfig, "Engine config must not be null");
        this.jobConfig = Objects.requireNonNull(jobConfig, "Job config must not be null");
    }

    @Override
    public void open(Configuration parameters) {
        metrics = new InferenceJobMetrics(getRuntimeContext().getMetricGroup());

        JsonArtifactCodec codec = new JsonArtifactCodec();
        store = S3ModelStore.create(jobConfig.getModelBucket(), jobConfig.getModelPrefix(),
                jobConfig.getAwsRegion(), Duration.ofMillis(engineConfig.getCache().getFetchTimeoutMillis()));
        HttpTrendHistoryClient history = new HttpTrendHistoryClient(jobConfig.getTrendApiBaseUrl(),
                Duration.ofSeconds(jobConfig.getTrendApiTimeoutSeconds()), jobConfig.getTrendHistoryMonths(),
                jobConfig.getTrendApiMaxAttempts(), jobConfig.getTrendApiRetryWaitMs());
        IsolationForestModelBuilder builder = new IsolationForestModelBuilder(engineConfig.getTraining(),
                engineConfig.getWindow().getSensors(), codec);

        cache = new ModelCache(store, builder, history, codec, engineConfig.getCache());
        scoring = new ScoringStage(cache, engineConfig.getDetection().getTopSensors(), metrics);
        LOG.info("ModelScoringFunction opened: subtask={} cacheCapacity={}",
                getRuntimeContext().getIndexOfThisSubtask(), engineConfig.getCache().getCapacity());
    }

    @Override
    public void asyncInvoke(WindowSummary summary, ResultFuture<ScoredWindow> resultFuture) {
        long startNanos = System.nanoTime();
        scoring.scoreAsync(summary).whenComplete((result, error) -> {
            metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
            if (error != null) {
                LOG.error("Scoring failed unexpectedly: monitor={} end={}",
                        summary.getMonitorId(), summary.getWindowEnd(), error);
                resultFuture.complete(Collections.emptyList());
            } else if (result.getStatus() == ScoringResult.Status.SCORED) {
                resultFuture.complete(Collections.singletonList(result.getScored()));
            } else {
                resultFuture.complete(Collections.emptyList());
            }
        });
    }

    @Override
    public void timeout(WindowSummary summary, ResultFuture<ScoredWindow> resultFuture) {
        LOG.warn("Scoring timed out, window skipped: monitor={} end={}",
                summary.getMonitorId(), summary.getWindowEnd());
        metrics.modelUnavailable();
        resultFuture.complete(Collections.emptyList());
    }

    @Override
    public void close() {
        if (cache != null) {
            cache.close();
        }
        if (store != null) {
            store.close();
        }
        LOG.info("ModelScoringFunction closed");
    }
}
