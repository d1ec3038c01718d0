package com.sensorsentinel.core.engine;

import com.sensorsentinel.core.cache.ModelCache;
import com.sensorsentinel.core.cache.Resolution;
import com.sensorsentinel.core.detection.Predictor;
import com.sensorsentinel.core.detection.Preprocessor;
import com.sensorsentinel.core.error.SchemaMismatchException;
import com.sensorsentinel.core.metrics.InferenceMetrics;
import com.sensorsentinel.core.model.FeatureVector;
import com.sensorsentinel.core.model.ModelArtifact;
import com.sensorsentinel.core.model.ScoredWindow;
import com.sensorsentinel.core.model.WindowSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves a summary's model, preprocesses and scores it.
 *
 * <p>
 * Shared by the embedded {@link InferenceEngine} and the Flink async scoring
 * function. Never completes exceptionally: every failure is mapped to a
 * {@link ScoringResult} status and counted.
 * </p>
 */
public class ScoringStage {

    private static final Logger LOG = LoggerFactory.getLogger(ScoringStage.class);

    private final ModelCache cache;
    private final Preprocessor preprocessor;
    private final Predictor predictor;
    private final int topSensors;
    private final InferenceMetrics metrics;

    public ScoringStage(ModelCache cache, int topSensors, InferenceMetrics metrics) {
        this(cache, new Preprocessor(), new Predictor(), topSensors, metrics);
    }

    public ScoringStage(ModelCache cache, Preprocessor preprocessor, Predictor predictor, int topSensors,
            InferenceMetrics metrics) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor must not be null");
        this.predictor = Objects.requireNonNull(predictor, "predictor must not be null");
        this.topSensors = topSensors;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public CompletableFuture<ScoringResult> scoreAsync(WindowSummary summary) {
        Objects.requireNonNull(summary, "summary must not be null");
        return cache.resolveAsync(summary.getMonitorId())
                .thenApply(resolution -> score(summary, resolution));
    }

    ScoringResult score(WindowSummary summary, Resolution resolution) {
        String monitorId = summary.getMonitorId();
        if (!resolution.isUsable()) {
            metrics.modelUnavailable();
            LOG.warn("No model, window skipped: monitor={} end={} reason={}",
                    monitorId, summary.getWindowEnd(), resolution.getReason());
            return ScoringResult.notScored(ScoringResult.Status.MODEL_UNAVAILABLE, summary, resolution.getReason());
        }

        ModelArtifact artifact = resolution.getArtifact();
        try {
            FeatureVector features = preprocessor.transform(artifact, summary);
            double score = predictor.score(artifact, features);
            List<String> top = features.topFeatures(topSensors);
            LOG.debug("Scored window: monitor={} end={} score={} version={}",
                    monitorId, summary.getWindowEnd(), score, artifact.getVersion());
            return ScoringResult.scored(new ScoredWindow(summary, score, resolution.isDegraded(),
                    artifact.getVersion(), top));
        } catch (SchemaMismatchException e) {
            metrics.schemaMismatch();
            LOG.warn("Window skipped: {}", e.getMessage());
            return ScoringResult.notScored(ScoringResult.Status.SCHEMA_MISMATCH, summary, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Scoring failed, window skipped: monitor={} version={}", monitorId, artifact.getVersion(), e);
            return ScoringResult.notScored(ScoringResult.Status.FAILED, summary, e.getMessage());
        }
    }
}
