package com.sensorsentinel.core.emit;

import com.sensorsentinel.core.config.PublishSettings;
import com.sensorsentinel.core.error.TransportException;
import com.sensorsentinel.core.metrics.InferenceMetrics;
import com.sensorsentinel.core.model.Alert;
import com.sensorsentinel.core.model.AnomalyVerdict;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Publishes alerts for anomalous verdicts.
 *
 * <p>
 * Publishing never runs on the caller's thread: every attempt, and the wait
 * between attempts, is scheduled on the emitter's own scheduler, so a slow or
 * unreachable channel delays only the alert concerned.
 * {@link TransportException}s are retried with a fixed wait up to
 * {@code publish.maxAttempts}. A publish that still fails is logged and
 * counted and the verdict is dropped; the stream carries on.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertEmitter implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertEmitter.class);

    private final AlertPublisher publisher;
    private final Map<String, String> sensorLabels;
    private final InferenceMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final Retry retry;
    private final int maxAttempts;

    public AlertEmitter(AlertPublisher publisher, PublishSettings settings, InferenceMetrics metrics) {
        this(publisher, settings, Map.of(), metrics);
    }

    /**
     * @param sensorLabels display names for sensor ids in published alerts;
     *                     unmapped sensors keep their id
     */
    public AlertEmitter(AlertPublisher publisher, PublishSettings settings, Map<String, String> sensorLabels,
            InferenceMetrics metrics) {
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.sensorLabels = Map.copyOf(Objects.requireNonNull(sensorLabels, "sensorLabels must not be null"));
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.maxAttempts = settings.getMaxAttempts();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread t = new Thread(runnable, "alert-publish");
            t.setDaemon(true);
            return t;
        });
        this.retry = Retry.of("alert-publish", RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .waitDuration(Duration.ofMillis(settings.getRetryWaitMillis()))
                .retryExceptions(TransportException.class)
                .build());
        this.retry.getEventPublisher().onRetry(event ->
                LOG.warn("Retrying alert publish: attempt={} reason={}",
                        event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    /**
     * Emit the alert for a verdict.
     *
     * @param verdict verdict to emit; negative verdicts are ignored
     * @return completes with {@code true} once the alert was published, or
     *         {@code false} if it was not; never completes exceptionally
     */
    public CompletableFuture<Boolean> emit(AnomalyVerdict verdict) {
        Objects.requireNonNull(verdict, "verdict must not be null");
        if (!verdict.isAnomaly()) {
            return CompletableFuture.completedFuture(false);
        }

        Alert alert = Alert.fromVerdict(verdict, sensorLabels);
        CompletableFuture<Void> delivered;
        try {
            delivered = CompletableFuture.supplyAsync(
                            () -> retry.executeCompletionStage(scheduler, () -> attempt(alert)), scheduler)
                    .thenCompose(CompletionStage::toCompletableFuture);
        } catch (RejectedExecutionException e) {
            delivered = CompletableFuture.failedFuture(e);
        }
        return delivered.handle((ignored, error) -> {
            if (error == null) {
                metrics.alertPublished();
                LOG.info("Alert published: monitor={} score={} degraded={} topSensors={}",
                        alert.getMonitorId(), alert.getScore(), alert.isDegraded(), alert.getTopSensors());
                return true;
            }
            metrics.publishFailed();
            Throwable cause = unwrap(error);
            if (cause instanceof TransportException) {
                LOG.error("Alert publish failed after {} attempt(s): monitor={} timestamp={} reason={}",
                        maxAttempts, alert.getMonitorId(), alert.getTimestamp(), cause.getMessage());
            } else {
                LOG.error("Alert publisher failed unexpectedly: monitor={} timestamp={}",
                        alert.getMonitorId(), alert.getTimestamp(), cause);
            }
            return false;
        });
    }

    private CompletionStage<Void> attempt(Alert alert) {
        try {
            return publisher.publish(alert);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Stop accepting alerts and give pending ones up to five seconds to
     * finish, including their scheduled retries.
     */
    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Pending alerts did not finish in time, dropping them");
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
