package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.config.MonitorPolicy;
import com.sensorsentinel.core.model.AnomalyVerdict;
import com.sensorsentinel.core.model.ScoredWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Objects;

/**
 * Threshold-with-hysteresis anomaly decision.
 *
 * <p>
 * A score at or above the monitor's threshold {@code T} is a breach; any
 * lower score resets the count. The verdict is anomalous once {@code K}
 * consecutive breaches have been seen, and stays anomalous for every further
 * breach.
 * </p>
 *
 * <p>
 * The detector itself is stateless; the per-monitor {@link HysteresisState}
 * is passed in so that it can live wherever the runtime keeps keyed state.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    /**
     * Decide on a scored window and advance the hysteresis state.
     *
     * @param scored scored window; must not be {@code null}
     * @param policy threshold and breach count of the window's monitor
     * @param state  the monitor's hysteresis state; mutated
     * @return the verdict
     */
    public AnomalyVerdict decide(ScoredWindow scored, MonitorPolicy policy, HysteresisState state) {
        Objects.requireNonNull(scored, "scored must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(state, "state must not be null");

        boolean breach = scored.getScore() >= policy.getThreshold();
        int breaches = state.record(breach);
        boolean anomaly = breach && breaches >= policy.getBreachCount();

        if (breach && !anomaly) {
            LOG.debug("Threshold breached, holding: monitor={} breaches={}/{}",
                    scored.getMonitorId(), breaches, policy.getBreachCount());
        }

        return AnomalyVerdict.builder()
                .monitorId(scored.getMonitorId())
                .timestamp(scored.getSummary().getWindowEnd())
                .score(scored.getScore())
                .anomaly(anomaly)
                .degraded(scored.isDegraded())
                .threshold(policy.getThreshold())
                .consecutiveBreaches(breaches)
                .modelVersion(scored.getModelVersion())
                .sensorMeans(scored.getSummary().sensorMeans())
                .topSensors(scored.getTopSensors())
                .build();
    }
}
