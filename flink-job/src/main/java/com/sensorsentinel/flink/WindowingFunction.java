package com.sensorsentinel.flink;

import com.sensorsentinel.core.config.WindowSettings;
import com.sensorsentinel.core.metrics.InferenceMetrics;
import com.sensorsentinel.core.model.Reading;
import com.sensorsentinel.core.model.WindowSummary;
import com.sensorsentinel.core.window.SlidingWindow;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Keeps one {@link SlidingWindow} per monitor in Flink keyed state and emits
 * its summaries.
 *
 * <p>
 * The window is {@link java.io.Serializable} and is snapshotted with every
 * checkpoint, so retained and pending readings survive restarts.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowingFunction extends KeyedProcessFunction<String, Reading, WindowSummary> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(WindowingFunction.class);

    private final WindowSettings settings;

    private transient ValueState<SlidingWindow> windowState;
    private transient InferenceMetrics metrics;

    public WindowingFunction(WindowSettings settings) {
        this.settings = Objects.requireNonNull(settings, "Window settings must not be null");
    }

    @Override
    public void open(Configuration parameters) {
        windowState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("sliding-window", TypeInformation.of(SlidingWindow.class)));
        metrics = new InferenceJobMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("WindowingFunction opened: {}", settings);
    }

    @Override
    public void processElement(Reading reading,
            KeyedProcessFunction<String, Reading, WindowSummary>.Context ctx,
            Collector<WindowSummary> out) throws Exception {
        SlidingWindow window = windowState.value();
        if (window == null) {
            window = new SlidingWindow(ctx.getCurrentKey(), settings);
        }

        if (window.isLate(reading)) {
            metrics.readingLateDropped();
            LOG.debug("Late reading dropped: monitor={} timestamp={}", reading.getMonitorId(), reading.getTimestamp());
        } else {
            metrics.readingAccepted();
        }
        List<WindowSummary> summaries = window.ingest(reading);
        windowState.update(window);

        for (WindowSummary summary : summaries) {
            metrics.summaryEmitted();
            out.collect(summary);
        }
    }
}
