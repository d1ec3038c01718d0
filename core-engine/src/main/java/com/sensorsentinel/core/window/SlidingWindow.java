package com.sensorsentinel.core.window;

import com.sensorsentinel.core.config.WindowSettings;
import com.sensorsentinel.core.model.Reading;
import com.sensorsentinel.core.model.WindowSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Event-time sliding window over one monitor's readings.
 *
 * <h3>Ordering</h3>
 * <p>
 * Readings do not enter the window on arrival. They wait in a pending buffer
 * sorted by timestamp until the watermark ({@code maxSeen - allowedLateness})
 * has moved strictly past them, and are then released in timestamp order.
 * Readings behind the watermark on arrival are dropped and counted; a reading
 * exactly at the watermark is still accepted, so its timestamp group is held
 * back until a newer timestamp arrives. The released sequence, and so every
 * summary, is therefore the same for any arrival order within the lateness
 * tolerance.
 * </p>
 *
 * <h3>Bounds</h3>
 * <p>
 * After each release the window evicts readings older than
 * {@code now - span} and trims to the newest {@code maxCount}, where
 * {@code now} is the timestamp just released.
 * </p>
 *
 * <h3>Emission</h3>
 * <p>
 * With a tick interval configured, a summary is produced whenever a released
 * timestamp crosses the next event-time tick; otherwise after every
 * {@code emitEvery} released timestamps. Windows with fewer than
 * {@code minSamples} readings produce nothing.
 * </p>
 *
 * <p>
 * Not thread-safe: one instance belongs to one monitor and is driven by that
 * monitor's serial lane (or Flink keyed state).
 * </p>
 *
 * @since 1.0.0
 */
public class SlidingWindow implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SlidingWindow.class);

    private static final long UNSET = Long.MIN_VALUE;

    private final String monitorId;
    private final long spanMillis;
    private final int maxCount;
    private final int minSamples;
    private final long latenessMillis;
    private final int emitEvery;
    private final long tickMillis;
    private final TreeSet<String> sensorWhitelist;

    /** Finalized readings in timestamp order. */
    private final ArrayDeque<Reading> retained = new ArrayDeque<>();

    /** Readings waiting for the watermark, sorted by timestamp (arrival order among equals). */
    private final ArrayList<Reading> pending = new ArrayList<>();

    private long maxSeenMillis = UNSET;
    private long nextTickMillis = UNSET;
    private int releasedSinceEmit;
    private long lateDrops;

    public SlidingWindow(String monitorId, WindowSettings settings) {
        this.monitorId = Objects.requireNonNull(monitorId, "monitorId must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.spanMillis = settings.getSpanSeconds() * 1000L;
        this.maxCount = settings.getMaxCount();
        this.minSamples = settings.getMinSamples();
        this.latenessMillis = settings.getAllowedLatenessSeconds() * 1000L;
        this.emitEvery = settings.getEmitEvery();
        this.tickMillis = settings.getTickIntervalSeconds() * 1000L;
        this.sensorWhitelist = new TreeSet<>(settings.getSensors());
        if (spanMillis <= 0 && maxCount <= 0) {
            throw new IllegalArgumentException("Window needs a span or a count bound");
        }
    }

    // ---------------------------------------------------------------
    // Ingest
    // ---------------------------------------------------------------

    /**
     * Offer a reading to the window.
     *
     * @param reading reading of this window's monitor; must not be {@code null}
     * @return summaries produced by the readings this call released, in
     *         event-time order; empty when nothing qualified
     * @throws IllegalArgumentException if the reading belongs to another monitor
     */
    public List<WindowSummary> ingest(Reading reading) {
        Objects.requireNonNull(reading, "reading must not be null");
        if (!monitorId.equals(reading.getMonitorId())) {
            throw new IllegalArgumentException("Reading for monitor " + reading.getMonitorId()
                    + " offered to window of " + monitorId);
        }

        Reading projected = reading.project(sensorWhitelist);
        if (projected.getSensors().isEmpty()) {
            LOG.debug("Reading carries none of the tracked sensors, ignoring: monitor={}", monitorId);
            return Collections.emptyList();
        }

        long ts = projected.getTimestampMillis();
        if (maxSeenMillis != UNSET && ts < maxSeenMillis - latenessMillis) {
            lateDrops++;
            LOG.debug("Late reading dropped: monitor={} ts={} watermark={}",
                    monitorId, ts, maxSeenMillis - latenessMillis);
            return Collections.emptyList();
        }

        insertPending(projected);
        maxSeenMillis = maxSeenMillis == UNSET ? ts : Math.max(maxSeenMillis, ts);
        return release(maxSeenMillis - latenessMillis);
    }

    /**
     * @return {@code true} if {@code reading} would be dropped as late right now
     */
    public boolean isLate(Reading reading) {
        return maxSeenMillis != UNSET && reading.getTimestampMillis() < maxSeenMillis - latenessMillis;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void insertPending(Reading reading) {
        int i = pending.size();
        while (i > 0 && pending.get(i - 1).getTimestampMillis() > reading.getTimestampMillis()) {
            i--;
        }
        pending.add(i, reading);
    }

    private List<WindowSummary> release(long watermark) {
        List<WindowSummary> summaries = new ArrayList<>();
        // strict: a reading at the watermark may still arrive for this group
        while (!pending.isEmpty() && pending.get(0).getTimestampMillis() < watermark) {
            long groupTs = pending.get(0).getTimestampMillis();
            while (!pending.isEmpty() && pending.get(0).getTimestampMillis() == groupTs) {
                retained.addLast(pending.remove(0));
            }
            evict(groupTs);
            if (emissionDue(groupTs)) {
                if (retained.size() >= minSamples) {
                    summaries.add(summarize());
                    releasedSinceEmit = 0;
                } else {
                    LOG.debug("Not enough data yet: monitor={} samples={} required={}",
                            monitorId, retained.size(), minSamples);
                }
            }
        }
        return summaries;
    }

    private void evict(long now) {
        if (spanMillis > 0) {
            long cutoff = now - spanMillis;
            while (!retained.isEmpty() && retained.peekFirst().getTimestampMillis() < cutoff) {
                retained.pollFirst();
            }
        }
        if (maxCount > 0) {
            while (retained.size() > maxCount) {
                retained.pollFirst();
            }
        }
    }

    private boolean emissionDue(long groupTs) {
        if (tickMillis > 0) {
            if (nextTickMillis == UNSET) {
                nextTickMillis = Math.floorDiv(groupTs, tickMillis) * tickMillis + tickMillis;
                return false;
            }
            if (groupTs >= nextTickMillis) {
                nextTickMillis = Math.floorDiv(groupTs, tickMillis) * tickMillis + tickMillis;
                return true;
            }
            return false;
        }
        releasedSinceEmit++;
        return releasedSinceEmit >= emitEvery;
    }

    private WindowSummary summarize() {
        TreeSet<String> names = new TreeSet<>();
        for (Reading r : retained) {
            names.addAll(r.getSensors().keySet());
        }
        List<String> sensorNames = new ArrayList<>(names);
        int n = sensorNames.size();
        double[] sum = new double[n];
        double[] sumSq = new double[n];
        double[] min = new double[n];
        double[] max = new double[n];
        double[] latest = new double[n];
        int[] count = new int[n];
        for (int i = 0; i < n; i++) {
            min[i] = Double.POSITIVE_INFINITY;
            max[i] = Double.NEGATIVE_INFINITY;
        }

        for (Reading r : retained) {
            for (Map.Entry<String, Double> e : r.getSensors().entrySet()) {
                int i = Collections.binarySearch(sensorNames, e.getKey());
                double v = e.getValue();
                sum[i] += v;
                sumSq[i] += v * v;
                min[i] = Math.min(min[i], v);
                max[i] = Math.max(max[i], v);
                latest[i] = v;
                count[i]++;
            }
        }

        double[] mean = new double[n];
        double[] stdDev = new double[n];
        for (int i = 0; i < n; i++) {
            mean[i] = sum[i] / count[i];
            // population variance; clamp tiny negatives from rounding
            double variance = Math.max(0.0, sumSq[i] / count[i] - mean[i] * mean[i]);
            stdDev[i] = Math.sqrt(variance);
        }

        return new WindowSummary(monitorId,
                retained.peekFirst().getTimestampMillis(),
                retained.peekLast().getTimestampMillis(),
                retained.size(), sensorNames, mean, stdDev, min, max, latest);
    }

    // ---------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------

    public String getMonitorId() {
        return monitorId;
    }

    /** @return finalized readings, oldest first (a copy) */
    public List<Reading> getRetained() {
        return new ArrayList<>(retained);
    }

    public int size() {
        return retained.size();
    }

    public int getPendingCount() {
        return pending.size();
    }

    public long getLateDrops() {
        return lateDrops;
    }
}
