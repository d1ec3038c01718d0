package com.sensorsentinel.flink;

import com.sensorsentinel.core.model.Reading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReadingDeserializationSchema}.
 */
class ReadingDeserializationSchemaTest {

    private final ReadingDeserializationSchema schema = new ReadingDeserializationSchema();

    @Test
    @DisplayName("Should deserialize a valid reading")
    void shouldDeserializeReading() {
        Reading reading = schema.deserialize(bytes(
                "{\"monitorId\":\"pump-7\",\"timestamp\":1718000000000,\"sensors\":{\"temperature\":71.5}}"));

        assertThat(reading).isNotNull();
        assertThat(reading.getMonitorId()).isEqualTo("pump-7");
        assertThat(reading.getSensors()).containsEntry("temperature", 71.5);
    }

    @Test
    @DisplayName("Should drop invalid records instead of failing")
    void shouldDropInvalidRecords() {
        assertThat(schema.deserialize(bytes("not json"))).isNull();
        assertThat(schema.deserialize(bytes("{\"monitorId\":\"m1\",\"timestamp\":1,\"sensors\":{}}"))).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
    }

    @Test
    @DisplayName("Should never signal end of stream")
    void shouldBeUnbounded() {
        assertThat(schema.isEndOfStream(null)).isFalse();
        assertThat(schema.getProducedType().getTypeClass()).isEqualTo(Reading.class);
    }

    // ---- Helpers

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
