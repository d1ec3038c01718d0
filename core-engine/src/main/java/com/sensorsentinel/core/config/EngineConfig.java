package com.sensorsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional and defaults as shown in
 * the section classes):
 * </p>
 *
 * <pre>
 * workerThreads: 4
 * window:
 *   spanSeconds: 300
 *   maxCount: 100
 *   minSamples: 5
 *   allowedLatenessSeconds: 5
 * cache:
 *   capacity: 32
 *   freshnessSeconds: 3600
 * detection:
 *   threshold: 0.6
 *   breachCount: 1
 *   overrides:
 *     - monitorId: pump-7
 *       threshold: 0.72
 * publish:
 *   maxAttempts: 3
 * training:
 *   trees: 200
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Worker pool size of the embedded engine's monitor lanes. */
    private int workerThreads = 4;

    private WindowSettings window = new WindowSettings();
    private CacheSettings cache = new CacheSettings();
    private DetectionSettings detection = new DetectionSettings();
    private PublishSettings publish = new PublishSettings();
    private TrainingSettings training = new TrainingSettings();

    /**
     * Validate every section of this configuration.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (workerThreads < 1) {
            errors.add("workerThreads must be >= 1");
        }
        window.validate(errors);
        cache.validate(errors);
        detection.validate(errors);
        publish.validate(errors);
        training.validate(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public WindowSettings getWindow() {
        return window;
    }

    public void setWindow(WindowSettings window) {
        this.window = window != null ? window : new WindowSettings();
    }

    public CacheSettings getCache() {
        return cache;
    }

    public void setCache(CacheSettings cache) {
        this.cache = cache != null ? cache : new CacheSettings();
    }

    public DetectionSettings getDetection() {
        return detection;
    }

    public void setDetection(DetectionSettings detection) {
        this.detection = detection != null ? detection : new DetectionSettings();
    }

    public PublishSettings getPublish() {
        return publish;
    }

    public void setPublish(PublishSettings publish) {
        this.publish = publish != null ? publish : new PublishSettings();
    }

    public TrainingSettings getTraining() {
        return training;
    }

    public void setTraining(TrainingSettings training) {
        this.training = training != null ? training : new TrainingSettings();
    }

    @Override
    public String toString() {
        return "EngineConfig{workerThreads=" + workerThreads + ", window=" + window + ", cache=" + cache
                + ", detection=" + detection + ", publish=" + publish + ", training=" + training + '}';
    }
}
