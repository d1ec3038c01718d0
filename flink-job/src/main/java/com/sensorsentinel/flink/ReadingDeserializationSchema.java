package com.sensorsentinel.flink;

import com.sensorsentinel.core.error.ValidationException;
import com.sensorsentinel.core.io.ReadingParser;
import com.sensorsentinel.core.metrics.InferenceMetrics;
import com.sensorsentinel.core.model.Reading;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes to a
 * {@link Reading}.
 * <p>
 * Invalid messages are logged, counted and dropped (returns {@code null}), so
 * that a single bad record does not crash the pipeline.
 * </p>
 */
public class ReadingDeserializationSchema implements DeserializationSchema<Reading> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ReadingDeserializationSchema.class);

    private transient ReadingParser parser;
    private transient InferenceMetrics metrics;

    @Override
    public void open(InitializationContext context) {
        metrics = new InferenceJobMetrics(context.getMetricGroup());
    }

    @Override
    public Reading deserialize(byte[] message) {
        try {
            return parser().parse(message);
        } catch (ValidationException e) {
            metrics().readingRejected();
            LOG.warn("Rejected reading, skipping: monitor={} reason={}", e.getMonitorId(), e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(Reading nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<Reading> getProducedType() {
        return TypeInformation.of(Reading.class);
    }

    private ReadingParser parser() {
        if (parser == null) {
            parser = new ReadingParser();
        }
        return parser;
    }

    private InferenceMetrics metrics() {
        if (metrics == null) {
            metrics = InferenceMetrics.NOOP;
        }
        return metrics;
    }
}
