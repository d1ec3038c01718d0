package com.sensorsentinel.core.io;

import com.sensorsentinel.core.error.ValidationException;
import com.sensorsentinel.core.model.Reading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit tests for {@link ReadingParser}.
 */
class ReadingParserTest {

    private final ReadingParser parser = new ReadingParser();

    @Test
    @DisplayName("Should parse a well-formed reading")
    void shouldParseReading() {
        Reading reading = parse("{\"monitorId\":\"pump-7\",\"timestamp\":1718000000000,"
                + "\"sensors\":{\"temperature\":71.5,\"pressure\":\"2.31\"}}");

        assertThat(reading.getMonitorId()).isEqualTo("pump-7");
        assertThat(reading.getTimestampMillis()).isEqualTo(1718000000000L);
        assertThat(reading.getSensors()).containsOnly(entry("temperature", 71.5), entry("pressure", 2.31));
    }

    @Test
    @DisplayName("Should accept trend API field names and ISO timestamps")
    void shouldAcceptAliases() {
        Reading reading = parse("{\"MONITORID\":\"fan-2\",\"TIMESTAMP\":\"2024-06-10T08:00:00Z\","
                + "\"PROCESS_PARAMETER\":{\"rpm\":1200}}");

        assertThat(reading.getMonitorId()).isEqualTo("fan-2");
        assertThat(reading.getTimestamp()).isEqualTo(Instant.parse("2024-06-10T08:00:00Z"));
        assertThat(reading.getSensors()).containsOnly(entry("rpm", 1200.0));
    }

    @Test
    @DisplayName("Should accept epoch millis given as a string")
    void shouldParseNumericStringTimestamp() {
        Reading reading = parse("{\"monitorId\":\"m1\",\"timestamp\":\"1718000000000\",\"sensors\":{\"a\":1}}");

        assertThat(reading.getTimestampMillis()).isEqualTo(1718000000000L);
    }

    @Test
    @DisplayName("Should leave out null and blank sensor values")
    void shouldSkipMissingValues() {
        Reading reading = parse("{\"monitorId\":\"m1\",\"timestamp\":1,"
                + "\"sensors\":{\"a\":1.0,\"b\":null,\"c\":\"  \"}}");

        assertThat(reading.getSensors()).containsOnlyKeys("a");
    }

    @Test
    @DisplayName("Should reject readings without any sensor value")
    void shouldRejectEmptySensors() {
        assertInvalid("{\"monitorId\":\"m1\",\"timestamp\":1,\"sensors\":{\"a\":null}}", "no sensor values");
        assertInvalid("{\"monitorId\":\"m1\",\"timestamp\":1}", "no sensors object");
    }

    @Test
    @DisplayName("Should reject non-numeric and non-finite sensor values")
    void shouldRejectBadSensorValues() {
        assertInvalid("{\"monitorId\":\"m1\",\"timestamp\":1,\"sensors\":{\"a\":\"hot\"}}", "non-numeric");
        assertInvalid("{\"monitorId\":\"m1\",\"timestamp\":1,\"sensors\":{\"a\":true}}", "non-numeric");
        assertInvalid("{\"monitorId\":\"m1\",\"timestamp\":1,\"sensors\":{\"a\":\"NaN\"}}", "not finite");
    }

    @Test
    @DisplayName("Should reject missing identity and timestamp")
    void shouldRejectMissingFields() {
        assertInvalid("{\"timestamp\":1,\"sensors\":{\"a\":1}}", "no monitorId");
        assertInvalid("{\"monitorId\":\"m1\",\"sensors\":{\"a\":1}}", "no timestamp");
        assertInvalid("{\"monitorId\":\"m1\",\"timestamp\":\"yesterday\",\"sensors\":{\"a\":1}}", "Unparsable timestamp");
    }

    @Test
    @DisplayName("Should reject integral timestamps beyond the epoch millis range")
    void shouldRejectOutOfRangeTimestamp() {
        assertInvalid("{\"monitorId\":\"m1\",\"timestamp\":92233720368547758070,\"sensors\":{\"a\":1}}",
                "Timestamp out of range");
        assertInvalid("{\"monitorId\":\"m1\",\"timestamp\":\"92233720368547758070\",\"sensors\":{\"a\":1}}",
                "Unparsable timestamp");
    }

    @Test
    @DisplayName("Should reject payloads that are not JSON objects")
    void shouldRejectMalformedPayloads() {
        assertInvalid("{\"monitorId\":", "Malformed JSON");
        assertInvalid("[1,2]", "JSON object");
        assertThatThrownBy(() -> parser.parse(new byte[0]))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Should carry the monitor id on validation errors when known")
    void shouldReportMonitorIdOnError() {
        assertThatThrownBy(() -> parse("{\"monitorId\":\"m9\",\"timestamp\":1,\"sensors\":{}}"))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getMonitorId()).isEqualTo("m9"));
    }

    // ---- Helpers

    private Reading parse(String json) {
        return parser.parse(json.getBytes(StandardCharsets.UTF_8));
    }

    private void assertInvalid(String json, String message) {
        assertThatThrownBy(() -> parse(json))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining(message);
    }
}
