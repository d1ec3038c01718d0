package com.sensorsentinel.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Serial execution lanes keyed by monitor id over a shared worker pool.
 *
 * <p>
 * Tasks submitted under one key run strictly one after another, in
 * submission order, each starting only once the previous task's future has
 * completed. Tasks of different keys run in parallel. A task's future may
 * complete on another thread (for example after asynchronous model I/O)
 * without holding a worker meanwhile.
 * </p>
 *
 * <p>
 * A failed task does not stop its lane.
 * </p>
 */
public class MonitorLanes implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorLanes.class);

    private final ExecutorService workers;
    private final ConcurrentHashMap<String, CompletableFuture<?>> tails = new ConcurrentHashMap<>();

    /**
     * @param workers pool the lane tasks start on; owned by this instance
     */
    public MonitorLanes(ExecutorService workers) {
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
    }

    /**
     * Append a task to a key's lane.
     *
     * @param key  lane key; must not be {@code null}
     * @param task produces the task's future when its turn comes
     * @return completes with the task's result
     */
    public <T> CompletableFuture<T> submit(String key, Supplier<CompletableFuture<T>> task) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(task, "task must not be null");

        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture<?> previous = tails.put(key, result);
        CompletableFuture<?> start = previous != null ? previous : CompletableFuture.completedFuture(null);
        start.handle((ignored, error) -> null)
                .thenComposeAsync(ignored -> invoke(task), workers)
                .whenComplete((value, error) -> {
                    tails.remove(key, result);
                    if (error != null) {
                        result.completeExceptionally(error);
                    } else {
                        result.complete(value);
                    }
                });
        return result.copy();
    }

    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> task) {
        try {
            CompletableFuture<T> future = task.get();
            return future != null ? future : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /** @return number of keys with queued or running work */
    public int activeLanes() {
        return tails.size();
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Monitor lanes did not drain in time, forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
