package com.sensorsentinel.flink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sensorsentinel.core.model.Alert;
import org.apache.flink.api.common.serialization.SerializationSchema;

/**
 * Flink {@link SerializationSchema} that converts an {@link Alert} to JSON
 * bytes for the Kafka alerts topic.
 */
public class AlertSerializationSchema implements SerializationSchema<Alert> {

    private static final long serialVersionUID = 1L;

    private transient ObjectMapper mapper;

    /**
     * @throws IllegalStateException if the alert cannot be rendered as JSON
     */
    @Override
    public byte[] serialize(Alert alert) {
        try {
            return objectMapper().writeValueAsBytes(alert);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize alert for monitor " + alert.getMonitorId(), e);
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
