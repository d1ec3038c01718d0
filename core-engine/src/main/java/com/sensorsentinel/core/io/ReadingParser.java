package com.sensorsentinel.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorsentinel.core.error.ValidationException;
import com.sensorsentinel.core.model.Reading;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Parses JSON readings.
 *
 * <pre>
 * {"monitorId": "pump-7", "timestamp": 1718000000000,
 *  "sensors": {"temperature": 71.5, "pressure": "2.31", "flow": null}}
 * </pre>
 *
 * <p>
 * {@code MONITORID}, {@code TIMESTAMP} and {@code PROCESS_PARAMETER} are
 * accepted as aliases, as emitted by the trend API. The timestamp is epoch
 * millis (number or numeric string) or ISO-8601. Sensor values may be numbers
 * or numeric strings; {@code null} and blank values are left out.
 * </p>
 *
 * <p>
 * Thread-safe.
 * </p>
 */
public class ReadingParser {

    private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d{1,18}");

    private final ObjectMapper mapper;

    public ReadingParser() {
        this(new ObjectMapper());
    }

    public ReadingParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws ValidationException if the message is not a valid reading
     */
    public Reading parse(byte[] message) {
        if (message == null || message.length == 0) {
            throw new ValidationException(null, "Empty message");
        }
        JsonNode node;
        try {
            node = mapper.readTree(message);
        } catch (IOException e) {
            throw new ValidationException(null, "Malformed JSON: " + e.getMessage(), e);
        }
        return parse(node, null);
    }

    /**
     * Parse an already decoded record.
     *
     * @param node             JSON object
     * @param defaultMonitorId used when the record carries no monitor id; may
     *                         be {@code null}
     * @throws ValidationException if the record is not a valid reading
     */
    public Reading parse(JsonNode node, String defaultMonitorId) {
        if (node == null || !node.isObject()) {
            throw new ValidationException(defaultMonitorId, "Reading must be a JSON object");
        }

        String monitorId = text(field(node, "monitorId", "MONITORID"));
        if (monitorId == null) {
            monitorId = defaultMonitorId;
        }
        if (monitorId == null || monitorId.isBlank()) {
            throw new ValidationException(null, "Reading has no monitorId");
        }

        long timestamp = timestamp(monitorId, field(node, "timestamp", "TIMESTAMP"));

        JsonNode sensorsNode = field(node, "sensors", "PROCESS_PARAMETER");
        if (sensorsNode == null || !sensorsNode.isObject()) {
            throw new ValidationException(monitorId, "Reading has no sensors object");
        }
        Map<String, Double> sensors = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = sensorsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            Double value = sensorValue(monitorId, e.getKey(), e.getValue());
            if (value != null) {
                sensors.put(e.getKey(), value);
            }
        }
        if (sensors.isEmpty()) {
            throw new ValidationException(monitorId, "Reading has no sensor values");
        }
        return new Reading(monitorId.trim(), timestamp, sensors);
    }

    private static JsonNode field(JsonNode node, String name, String alias) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            value = node.get(alias);
        }
        return value == null || value.isNull() ? null : value;
    }

    private static String text(JsonNode node) {
        if (node == null || !(node.isTextual() || node.isNumber())) {
            return null;
        }
        String s = node.asText();
        return s.isBlank() ? null : s;
    }

    private static long timestamp(String monitorId, JsonNode node) {
        if (node == null) {
            throw new ValidationException(monitorId, "Reading has no timestamp");
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new ValidationException(monitorId, "Timestamp out of range: " + node);
            }
            return node.asLong();
        }
        if (node.isTextual()) {
            String s = node.asText().trim();
            if (EPOCH_MILLIS.matcher(s).matches()) {
                return Long.parseLong(s);
            }
            try {
                return Instant.parse(s).toEpochMilli();
            } catch (DateTimeParseException e) {
                throw new ValidationException(monitorId, "Unparsable timestamp: " + s, e);
            }
        }
        throw new ValidationException(monitorId, "Unparsable timestamp: " + node);
    }

    private static Double sensorValue(String monitorId, String sensor, JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            String s = node.asText().trim();
            if (s.isEmpty()) {
                return null;
            }
            try {
                value = Double.parseDouble(s);
            } catch (NumberFormatException e) {
                throw new ValidationException(monitorId, "Sensor '" + sensor + "' has non-numeric value: " + s, e);
            }
        } else {
            throw new ValidationException(monitorId, "Sensor '" + sensor + "' has non-numeric value: " + node);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ValidationException(monitorId, "Sensor '" + sensor + "' is not finite");
        }
        return value;
    }
}
