package com.sensorsentinel.core.engine;

import com.sensorsentinel.core.cache.ModelCache;
import com.sensorsentinel.core.config.EngineConfig;
import com.sensorsentinel.core.detection.AnomalyDetector;
import com.sensorsentinel.core.detection.HysteresisState;
import com.sensorsentinel.core.emit.AlertEmitter;
import com.sensorsentinel.core.error.ValidationException;
import com.sensorsentinel.core.io.ReadingParser;
import com.sensorsentinel.core.metrics.InferenceMetrics;
import com.sensorsentinel.core.model.AnomalyVerdict;
import com.sensorsentinel.core.model.Reading;
import com.sensorsentinel.core.model.WindowSummary;
import com.sensorsentinel.core.window.SlidingWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Embedded, runtime-independent inference pipeline.
 *
 * <p>
 * Each submitted reading runs through window ingest, model resolution,
 * preprocessing, scoring, the hysteresis decision and alert emission on its
 * monitor's {@link MonitorLanes lane}: readings of one monitor are handled
 * strictly in submission order, different monitors concurrently. Waiting for
 * model I/O or for an alert to be published does not hold a lane worker.
 * </p>
 *
 * <p>
 * Failures are contained per reading and reported through the returned
 * {@link ProcessingOutcome}; the engine itself keeps running.
 * </p>
 *
 * @since 1.0.0
 */
public class InferenceEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(InferenceEngine.class);

    private final EngineConfig config;
    private final ModelCache cache;
    private final ScoringStage scoring;
    private final AnomalyDetector detector = new AnomalyDetector();
    private final AlertEmitter emitter;
    private final InferenceMetrics metrics;
    private final ReadingParser parser = new ReadingParser();
    private final ExecutorService workers;
    private final MonitorLanes lanes;

    private final ConcurrentHashMap<String, MonitorState> states = new ConcurrentHashMap<>();

    /**
     * @param cache   model cache; closed together with the engine
     * @param emitter alert emitter; closed together with the engine
     */
    public InferenceEngine(EngineConfig config, ModelCache cache, AlertEmitter emitter, InferenceMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.emitter = Objects.requireNonNull(emitter, "emitter must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.scoring = new ScoringStage(cache, config.getDetection().getTopSensors(), metrics);
        this.workers = Executors.newFixedThreadPool(config.getWorkerThreads(), laneThreadFactory());
        this.lanes = new MonitorLanes(workers);
    }

    private static ThreadFactory laneThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "monitor-lane-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Submit a parsed reading.
     *
     * @return completes when the reading has been fully processed
     */
    public CompletableFuture<ProcessingOutcome> submit(Reading reading) {
        Objects.requireNonNull(reading, "reading must not be null");
        return lanes.submit(reading.getMonitorId(), () -> process(reading));
    }

    /**
     * Parse and submit a raw JSON message. Invalid messages complete
     * immediately as {@link ProcessingOutcome.Status#REJECTED}.
     */
    public CompletableFuture<ProcessingOutcome> submitRaw(byte[] message) {
        Reading reading;
        try {
            reading = parser.parse(message);
        } catch (ValidationException e) {
            metrics.readingRejected();
            LOG.warn("Rejected reading: monitor={} reason={}", e.getMonitorId(), e.getMessage());
            return CompletableFuture.completedFuture(
                    ProcessingOutcome.of(e.getMonitorId(), ProcessingOutcome.Status.REJECTED, e.getMessage()));
        }
        return submit(reading);
    }

    /** @return number of monitors with window state */
    public int trackedMonitors() {
        return states.size();
    }

    @Override
    public void close() {
        lanes.close();
        emitter.close();
        cache.close();
        LOG.info("Inference engine stopped, {} monitor(s) tracked", states.size());
    }

    // ---------------------------------------------------------------
    // Processing (runs on the reading's lane)
    // ---------------------------------------------------------------

    private CompletableFuture<ProcessingOutcome> process(Reading reading) {
        long startNanos = System.nanoTime();
        String monitorId = reading.getMonitorId();
        MonitorState state = states.computeIfAbsent(monitorId,
                id -> new MonitorState(new SlidingWindow(id, config.getWindow())));

        if (state.window.isLate(reading)) {
            state.window.ingest(reading);
            metrics.readingLateDropped();
            return CompletableFuture.completedFuture(
                    ProcessingOutcome.of(monitorId, ProcessingOutcome.Status.LATE_DROPPED, null));
        }
        List<WindowSummary> summaries = state.window.ingest(reading);
        metrics.readingAccepted();
        if (summaries.isEmpty()) {
            return CompletableFuture.completedFuture(
                    ProcessingOutcome.of(monitorId, ProcessingOutcome.Status.NOT_ENOUGH_DATA, null));
        }

        CompletableFuture<ProcessingOutcome> chain = null;
        for (WindowSummary summary : summaries) {
            metrics.summaryEmitted();
            if (chain == null) {
                chain = handle(state, summary);
            } else {
                chain = chain.thenCompose(acc -> handle(state, summary).thenApply(acc::then));
            }
        }
        return chain.whenComplete((outcome, error) ->
                metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000));
    }

    private CompletableFuture<ProcessingOutcome> handle(MonitorState state, WindowSummary summary) {
        return scoring.scoreAsync(summary).thenComposeAsync(result -> {
            ProcessingOutcome.Status skipped = switch (result.getStatus()) {
                case MODEL_UNAVAILABLE -> ProcessingOutcome.Status.MODEL_UNAVAILABLE;
                case SCHEMA_MISMATCH -> ProcessingOutcome.Status.SCHEMA_MISMATCH;
                case FAILED -> ProcessingOutcome.Status.SCORING_FAILED;
                case SCORED -> null;
            };
            if (skipped != null) {
                return CompletableFuture.completedFuture(
                        ProcessingOutcome.of(summary.getMonitorId(), skipped, result.getReason()));
            }
            AnomalyVerdict verdict = detector.decide(result.getScored(),
                    config.getDetection().policyFor(summary.getMonitorId()), state.hysteresis);
            if (verdict.isDegraded()) {
                metrics.degradedVerdict();
            }
            if (!verdict.isAnomaly()) {
                return CompletableFuture.completedFuture(ProcessingOutcome.decided(verdict, false));
            }
            return emitter.emit(verdict).thenApply(published -> ProcessingOutcome.decided(verdict, published));
        }, workers);
    }

    /** Window and hysteresis state of one monitor; touched only from its lane. */
    private static final class MonitorState {
        private final SlidingWindow window;
        private final HysteresisState hysteresis = new HysteresisState();

        private MonitorState(SlidingWindow window) {
            this.window = window;
        }
    }
}
