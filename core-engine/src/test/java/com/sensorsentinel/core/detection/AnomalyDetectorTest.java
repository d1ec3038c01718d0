package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.config.MonitorPolicy;
import com.sensorsentinel.core.model.AnomalyVerdict;
import com.sensorsentinel.core.model.ScoredWindow;
import com.sensorsentinel.core.support.Readings;
import com.sensorsentinel.core.support.Summaries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnomalyDetector}.
 */
class AnomalyDetectorTest {

    private AnomalyDetector detector;
    private HysteresisState state;

    @BeforeEach
    void setUp() {
        detector = new AnomalyDetector();
        state = new HysteresisState();
    }

    @Test
    @DisplayName("Should flag only after K consecutive breaches and reset on a normal score")
    void shouldApplyHysteresis() {
        MonitorPolicy policy = new MonitorPolicy(0.8, 3);
        double[] scores = { 0.9, 0.9, 0.5, 0.9, 0.9, 0.9, 0.9 };

        List<Boolean> anomalies = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            anomalies.add(detector.decide(scored(i, scores[i], false), policy, state).isAnomaly());
        }

        assertThat(anomalies).containsExactly(false, false, false, false, false, true, true);
        assertThat(state.getConsecutiveBreaches()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should treat a score equal to the threshold as a breach")
    void shouldBreachAtThreshold() {
        AnomalyVerdict verdict = detector.decide(scored(0, 0.8, false), new MonitorPolicy(0.8, 1), state);

        assertThat(verdict.isAnomaly()).isTrue();
        assertThat(verdict.getConsecutiveBreaches()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should flag every breach when K is one")
    void shouldFlagImmediatelyWithSingleBreach() {
        MonitorPolicy policy = new MonitorPolicy(0.6, 1);

        assertThat(detector.decide(scored(0, 0.61, false), policy, state).isAnomaly()).isTrue();
        assertThat(detector.decide(scored(1, 0.59, false), policy, state).isAnomaly()).isFalse();
        assertThat(detector.decide(scored(2, 0.99, false), policy, state).isAnomaly()).isTrue();
    }

    @Test
    @DisplayName("Should carry window, model and degradation details into the verdict")
    void shouldPopulateVerdict() {
        AnomalyVerdict verdict = detector.decide(scored(120, 0.95, true), new MonitorPolicy(0.7, 1), state);

        assertThat(verdict.getMonitorId()).isEqualTo("m1");
        assertThat(verdict.getTimestamp()).isEqualTo(Readings.T0.plusSeconds(120));
        assertThat(verdict.getScore()).isEqualTo(0.95);
        assertThat(verdict.isDegraded()).isTrue();
        assertThat(verdict.getThreshold()).isEqualTo(0.7);
        assertThat(verdict.getModelVersion()).isEqualTo("v1");
        assertThat(verdict.getSensorMeans()).containsEntry("temperature", 71.5);
        assertThat(verdict.getTopSensors()).containsExactly("temperature");
    }

    // ---- Helpers

    private static ScoredWindow scored(long endSeconds, double score, boolean degraded) {
        return new ScoredWindow(Summaries.withMeans("m1", endSeconds, Map.of("temperature", 71.5)),
                score, degraded, "v1", List.of("temperature"));
    }
}
