package com.sensorsentinel.flink;

import com.sensorsentinel.core.config.DetectionSettings;
import com.sensorsentinel.core.detection.AnomalyDetector;
import com.sensorsentinel.core.detection.HysteresisState;
import com.sensorsentinel.core.metrics.InferenceMetrics;
import com.sensorsentinel.core.model.AnomalyVerdict;
import com.sensorsentinel.core.model.ScoredWindow;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Applies the hysteresis decision per monitor and forwards anomalous
 * verdicts.
 *
 * <p>
 * The consecutive-breach counter lives in keyed state, so it is checkpointed
 * together with the window state.
 * </p>
 *
 * @since 1.0.0
 */
public class VerdictFunction extends KeyedProcessFunction<String, ScoredWindow, AnomalyVerdict> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(VerdictFunction.class);

    private final DetectionSettings detection;
    private final AnomalyDetector detector = new AnomalyDetector();

    private transient ValueState<HysteresisState> hysteresisState;
    private transient InferenceMetrics metrics;

    public VerdictFunction(DetectionSettings detection) {
        this.detection = Objects.requireNonNull(detection, "Detection settings must not be null");
    }

    @Override
    public void open(Configuration parameters) {
        hysteresisState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("hysteresis", TypeInformation.of(HysteresisState.class)));
        metrics = new InferenceJobMetrics(getRuntimeContext().getMetricGroup());
    }

    @Override
    public void processElement(ScoredWindow scored,
            KeyedProcessFunction<String, ScoredWindow, AnomalyVerdict>.Context ctx,
            Collector<AnomalyVerdict> out) throws Exception {
        HysteresisState state = hysteresisState.value();
        if (state == null) {
            state = new HysteresisState();
        }

        AnomalyVerdict verdict = detector.decide(scored, detection.policyFor(ctx.getCurrentKey()), state);
        hysteresisState.update(state);

        if (verdict.isDegraded()) {
            metrics.degradedVerdict();
        }
        if (verdict.isAnomaly()) {
            LOG.info("Anomaly detected: monitor={} score={} breaches={}",
                    verdict.getMonitorId(), verdict.getScore(), verdict.getConsecutiveBreaches());
            out.collect(verdict);
        }
    }
}
