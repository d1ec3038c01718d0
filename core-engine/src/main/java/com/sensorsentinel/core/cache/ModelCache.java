package com.sensorsentinel.core.cache;

import com.sensorsentinel.core.config.CacheSettings;
import com.sensorsentinel.core.error.ModelBuildException;
import com.sensorsentinel.core.error.StorageException;
import com.sensorsentinel.core.ml.ArtifactCodec;
import com.sensorsentinel.core.model.ModelArtifact;
import com.sensorsentinel.core.model.Reading;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Bounded per-monitor cache of model artifacts.
 *
 * <h3>Resolution</h3>
 * <ol>
 * <li>A valid artifact admitted less than {@code freshness} ago is returned
 * without I/O.</li>
 * <li>Otherwise the artifact is loaded from the {@link ModelStore}; store I/O
 * errors are retried up to {@code storeMaxAttempts}.</li>
 * <li>If loading fails (missing, unreadable, invalid or for another monitor),
 * trend history is fetched and the {@link ModelBuilder} asked for a new
 * artifact, which is persisted best-effort.</li>
 * <li>If both fail the previous artifact, if any, is served as
 * {@link Resolution.Status#DEGRADED}; otherwise the result is
 * {@link Resolution.Status#UNAVAILABLE}.</li>
 * </ol>
 *
 * <h3>Backoff</h3>
 * <p>
 * Each failed resolution pushes the monitor's next attempt out by
 * {@code backoffInitial * multiplier^(failures-1)}, capped at
 * {@code backoffMax}. Until then, calls answer from the entry without I/O.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * At most one resolution per monitor is in flight; concurrent callers share
 * its future. There is no cache-wide lock. Store I/O and builds run on
 * separate executors, so long builds never queue ahead of another monitor's
 * store load. Each call's timeout starts when the call starts running, not
 * while it waits in the queue. A timed-out call is interrupted; a build that
 * keeps running anyway stays registered on its entry until it returns, no
 * second build for that monitor starts meanwhile, and its late result is
 * neither admitted nor persisted. Entries with an in-flight resolution are
 * never evicted.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelCache implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ModelCache.class);

    private final ModelStore store;
    private final ModelBuilder builder;
    private final TrendHistorySource history;
    private final ArtifactCodec codec;
    private final CacheSettings settings;
    private final Clock clock;
    private final ExecutorService fetchExecutor;
    private final ExecutorService buildExecutor;

    private final Duration freshness;
    private final IntervalFunction backoff;
    private final Retry storeRetry;

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<Resolution>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong recencyTicks = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    private volatile boolean closed;

    public ModelCache(ModelStore store, ModelBuilder builder, TrendHistorySource history,
            ArtifactCodec codec, CacheSettings settings) {
        this(store, builder, history, codec, settings, Clock.systemUTC(),
                Executors.newFixedThreadPool(settings.getIoThreads(), ioThreadFactory("fetch")),
                Executors.newFixedThreadPool(settings.getIoThreads(), ioThreadFactory("build")));
    }

    /**
     * @param fetchExecutor executor for store reads and writes; owned (and shut
     *                      down) by this cache
     * @param buildExecutor executor for history fetches and builds; owned (and
     *                      shut down) by this cache
     */
    public ModelCache(ModelStore store, ModelBuilder builder, TrendHistorySource history,
            ArtifactCodec codec, CacheSettings settings, Clock clock,
            ExecutorService fetchExecutor, ExecutorService buildExecutor) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetchExecutor must not be null");
        this.buildExecutor = Objects.requireNonNull(buildExecutor, "buildExecutor must not be null");

        this.freshness = Duration.ofSeconds(settings.getFreshnessSeconds());
        this.backoff = IntervalFunction.ofExponentialBackoff(
                Duration.ofSeconds(settings.getBackoffInitialSeconds()).toMillis(),
                settings.getBackoffMultiplier(),
                Duration.ofSeconds(settings.getBackoffMaxSeconds()).toMillis());
        this.storeRetry = Retry.of("model-store", RetryConfig.custom()
                .maxAttempts(settings.getStoreMaxAttempts())
                .waitDuration(Duration.ofMillis(settings.getStoreRetryWaitMillis()))
                .retryExceptions(StorageException.class)
                .build());
    }

    private static ThreadFactory ioThreadFactory(String role) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "model-cache-" + role + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Resolve a monitor's model, blocking until the resolution completes.
     *
     * @param monitorId monitor id; must not be blank
     * @return the resolution; never {@code null}
     */
    public Resolution resolve(String monitorId) {
        return resolveAsync(monitorId).join();
    }

    /**
     * Resolve a monitor's model without blocking the caller.
     *
     * <p>
     * The returned future always completes normally.
     * </p>
     *
     * @param monitorId monitor id; must not be blank
     */
    public CompletableFuture<Resolution> resolveAsync(String monitorId) {
        if (monitorId == null || monitorId.isBlank()) {
            throw new IllegalArgumentException("monitorId must not be blank");
        }
        CacheEntry entry = entries.computeIfAbsent(monitorId, CacheEntry::new);
        entry.touch(recencyTicks.incrementAndGet());

        Instant now = clock.instant();
        if (entry.isFresh(now, freshness)) {
            return CompletableFuture.completedFuture(Resolution.fresh(entry.artifact()));
        }
        if (closed) {
            evictIfNeeded();
            return CompletableFuture.completedFuture(fallback(entry, "model cache is closed"));
        }
        if (entry.isBackingOff(now)) {
            LOG.debug("Model resolution backing off: monitor={} until={}", monitorId, entry.nextAttemptAt());
            return CompletableFuture.completedFuture(fallback(entry,
                    "backing off after " + entry.consecutiveFailures() + " failure(s)"));
        }

        CompletableFuture<Resolution> promise = new CompletableFuture<>();
        CompletableFuture<Resolution> existing = inFlight.putIfAbsent(monitorId, promise);
        if (existing != null) {
            return existing;
        }
        startResolution(entry, promise);
        return promise;
    }

    /** @return number of resident entries */
    public int size() {
        return entries.size();
    }

    public boolean isResident(String monitorId) {
        return entries.containsKey(monitorId);
    }

    public boolean isInFlight(String monitorId) {
        return inFlight.containsKey(monitorId);
    }

    public long evictionCount() {
        return evictions.get();
    }

    /**
     * @return {@code true} while a build for the monitor is still running,
     *         including one whose resolution already timed out
     */
    public boolean isBuilding(String monitorId) {
        CacheEntry entry = entries.get(monitorId);
        return entry != null && entry.isBuilding();
    }

    /**
     * Stop the I/O executors. Running resolutions fail without admitting
     * anything; later calls answer from resident entries only.
     */
    @Override
    public void close() {
        closed = true;
        shutdown(buildExecutor);
        shutdown(fetchExecutor);
        LOG.info("Model cache closed with {} resident entries", entries.size());
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------------------------------------------------------------
    // Resolution chain
    // ---------------------------------------------------------------

    private void startResolution(CacheEntry entry, CompletableFuture<Resolution> promise) {
        String monitorId = entry.monitorId();
        CompletableFuture<Resolution> chain;
        if (entry.isFresh(clock.instant(), freshness)) {
            // admitted by a resolution that finished after our freshness check
            chain = CompletableFuture.completedFuture(Resolution.fresh(entry.artifact()));
        } else {
            chain = timed(() -> loadFromStore(monitorId), fetchExecutor, settings.getFetchTimeoutMillis(),
                    new CompletableFuture<>())
                    .thenApply(artifact -> admit(entry, artifact, "store"))
                    .exceptionallyCompose(loadError -> {
                        LOG.info("Model load failed, rebuilding: monitor={} reason={}",
                                monitorId, describe(loadError));
                        return build(entry);
                    })
                    .exceptionally(buildError -> fail(entry, buildError));
        }

        chain.whenComplete((resolution, error) -> {
            Resolution outcome = error == null ? resolution : fail(entry, error);
            inFlight.remove(monitorId, promise);
            evictIfNeeded();
            promise.complete(outcome);
        });
    }

    private CompletableFuture<Resolution> build(CacheEntry entry) {
        String monitorId = entry.monitorId();
        CompletableFuture<Void> finished = new CompletableFuture<>();
        if (!entry.beginBuild(finished)) {
            LOG.warn("Previous build still running, not starting another: monitor={}", monitorId);
            return CompletableFuture.failedFuture(
                    new ModelBuildException(monitorId, "Previous build still running after its timeout"));
        }
        finished.whenComplete((ignored, error) -> entry.endBuild(finished));
        // runs only when the build beat its timeout
        return timed(() -> buildFromHistory(entry), buildExecutor, settings.getBuildTimeoutMillis(), finished)
                .thenApply(built -> {
                    persist(monitorId, built.encoded);
                    return admit(entry, built.artifact, "build");
                });
    }

    /**
     * Run {@code task} on {@code executor}, failing the returned future with a
     * {@link TimeoutException} once the task has been running for
     * {@code timeoutMillis}. On timeout the task is interrupted.
     *
     * @param finished completed when the task body has returned, whether or
     *                 not the returned future timed out first
     */
    private <T> CompletableFuture<T> timed(Supplier<T> task, ExecutorService executor, long timeoutMillis,
            CompletableFuture<Void> finished) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Future<?> running;
        try {
            running = executor.submit(() -> {
                result.orTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
                try {
                    result.complete(task.get());
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                } finally {
                    finished.complete(null);
                }
            });
        } catch (RejectedExecutionException e) {
            finished.complete(null);
            return CompletableFuture.failedFuture(e);
        }
        result.whenComplete((value, error) -> {
            if (error instanceof TimeoutException) {
                running.cancel(true);
            }
        });
        return result;
    }

    private ModelArtifact loadFromStore(String monitorId) {
        Optional<byte[]> bytes = Retry.decorateSupplier(storeRetry, () -> store.get(monitorId)).get();
        if (bytes.isEmpty()) {
            throw new StorageException(monitorId, "No model artifact stored");
        }
        ModelArtifact artifact = codec.decode(monitorId, bytes.get());
        if (!artifact.isUsableFor(monitorId)) {
            throw new StorageException(monitorId, "Stored artifact unusable: valid=" + artifact.isValid()
                    + " owner=" + artifact.getMonitorId());
        }
        return artifact;
    }

    private Built buildFromHistory(CacheEntry entry) {
        String monitorId = entry.monitorId();
        entry.markBuildAttempt(clock.instant());
        List<Reading> records = history.fetchHistory(monitorId, settings.getHistoryLimit());
        LOG.info("Building model: monitor={} historyRecords={}", monitorId, records.size());

        byte[] encoded = builder.build(monitorId, records);
        ModelArtifact artifact;
        try {
            artifact = codec.decode(monitorId, encoded);
        } catch (StorageException e) {
            throw new ModelBuildException(monitorId, "Builder produced an unreadable artifact", e);
        }
        if (!artifact.isUsableFor(monitorId)) {
            throw new ModelBuildException(monitorId, "Builder produced an unusable artifact: " + artifact);
        }
        return new Built(artifact, encoded);
    }

    private void persist(String monitorId, byte[] encoded) {
        try {
            CompletableFuture.runAsync(() -> store.put(monitorId, encoded), fetchExecutor)
                    .orTimeout(settings.getFetchTimeoutMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            LOG.warn("Failed to persist rebuilt model, continuing with in-memory copy: monitor={} reason={}",
                                    monitorId, describe(error));
                        } else {
                            LOG.info("Persisted rebuilt model: monitor={}", monitorId);
                        }
                    });
        } catch (RejectedExecutionException e) {
            LOG.warn("Cache closing, rebuilt model not persisted: monitor={}", monitorId);
        }
    }

    private Resolution admit(CacheEntry entry, ModelArtifact artifact, String source) {
        entry.admit(artifact, clock.instant());
        LOG.info("Model admitted: monitor={} version={} source={}", entry.monitorId(), artifact.getVersion(), source);
        return Resolution.fresh(artifact);
    }

    private Resolution fail(CacheEntry entry, Throwable error) {
        Instant now = clock.instant();
        int failures = entry.recordFailure(now, n -> Duration.ofMillis(backoff.apply(n)));
        String reason = describe(error);
        LOG.error("Model resolution failed: monitor={} failures={} retryAt={} reason={}",
                entry.monitorId(), failures, entry.nextAttemptAt(), reason);
        return fallback(entry, reason);
    }

    private Resolution fallback(CacheEntry entry, String reason) {
        ModelArtifact previous = entry.artifact();
        if (previous != null) {
            LOG.warn("Serving stale model: monitor={} version={} reason={}",
                    entry.monitorId(), previous.getVersion(), reason);
            return Resolution.degraded(previous, reason);
        }
        return Resolution.unavailable(reason);
    }

    // ---------------------------------------------------------------
    // Eviction
    // ---------------------------------------------------------------

    private void evictIfNeeded() {
        while (entries.size() > settings.getCapacity()) {
            CacheEntry victim = null;
            for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
                if (inFlight.containsKey(e.getKey())) {
                    continue;
                }
                if (victim == null || e.getValue().recency() < victim.recency()) {
                    victim = e.getValue();
                }
            }
            if (victim == null) {
                // everything over capacity is in flight; retried when those complete
                return;
            }
            if (entries.remove(victim.monitorId(), victim)) {
                evictions.incrementAndGet();
                LOG.warn("Evicted model entry: monitor={} capacity={}", victim.monitorId(), settings.getCapacity());
            }
        }
    }

    /** A built artifact together with the bytes to persist. */
    private static final class Built {
        private final ModelArtifact artifact;
        private final byte[] encoded;

        private Built(ModelArtifact artifact, byte[] encoded) {
            this.artifact = artifact;
            this.encoded = encoded;
        }
    }

    private static String describe(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        if (cause.getMessage() != null) {
            return cause.getClass().getSimpleName() + ": " + cause.getMessage();
        }
        return cause.getClass().getSimpleName();
    }
}
