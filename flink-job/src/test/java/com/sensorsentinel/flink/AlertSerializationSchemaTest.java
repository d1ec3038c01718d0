package com.sensorsentinel.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorsentinel.core.model.Alert;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertSerializationSchema}.
 */
class AlertSerializationSchemaTest {

    private final AlertSerializationSchema schema = new AlertSerializationSchema();

    @Test
    @DisplayName("Should render the alert as JSON with an ISO timestamp")
    void shouldSerializeAlert() throws Exception {
        Alert alert = Alert.builder()
                .monitorId("pump-7")
                .timestamp(Instant.parse("2024-06-10T08:05:00Z"))
                .score(0.91)
                .degraded(true)
                .features(Map.of("temperature", 98.2))
                .topSensors(List.of("temperature"))
                .modelVersion("1717200000000")
                .threshold(0.8)
                .build();

        JsonNode json = new ObjectMapper().readTree(schema.serialize(alert));

        assertThat(json.get("monitorId").asText()).isEqualTo("pump-7");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-06-10T08:05:00Z");
        assertThat(json.get("score").asDouble()).isEqualTo(0.91);
        assertThat(json.get("anomaly").asBoolean()).isTrue();
        assertThat(json.get("degraded").asBoolean()).isTrue();
        assertThat(json.get("features").get("temperature").asDouble()).isEqualTo(98.2);
        assertThat(json.get("topSensors").get(0).asText()).isEqualTo("temperature");
        assertThat(json.get("modelVersion").asText()).isEqualTo("1717200000000");
    }
}
