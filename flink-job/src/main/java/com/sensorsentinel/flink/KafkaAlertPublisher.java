package com.sensorsentinel.flink;

import com.sensorsentinel.core.emit.AlertPublisher;
import com.sensorsentinel.core.error.TransportException;
import com.sensorsentinel.core.model.Alert;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArraySerializer;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes alerts to a Kafka topic, keyed by monitor id.
 *
 * <p>
 * {@link #publish(Alert)} hands the record to the producer and returns; the
 * returned stage completes from the producer callback once the broker
 * acknowledged the alert, or fails with a {@link TransportException} when the
 * broker rejected it or did not answer within the send timeout.
 * </p>
 */
public class KafkaAlertPublisher implements AlertPublisher, AutoCloseable {

    private final Producer<byte[], byte[]> producer;
    private final String topic;
    private final SerializationSchema<Alert> serializer;
    private final long sendTimeoutMs;

    public KafkaAlertPublisher(Producer<byte[], byte[]> producer, String topic,
            SerializationSchema<Alert> serializer, long sendTimeoutMs) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
        this.sendTimeoutMs = sendTimeoutMs;
    }

    /** Publisher with its own producer built from the job's producer properties. */
    public static KafkaAlertPublisher create(JobConfig config) {
        Properties props = config.kafkaProducerProperties();
        Producer<byte[], byte[]> producer = new KafkaProducer<>(props, new ByteArraySerializer(), new ByteArraySerializer());
        return new KafkaAlertPublisher(producer, config.getKafkaAlertTopic(), new AlertSerializationSchema(),
                config.getAlertSendTimeoutMs());
    }

    @Override
    public CompletionStage<Void> publish(Alert alert) {
        String monitorId = alert.getMonitorId();
        byte[] key = monitorId.getBytes(StandardCharsets.UTF_8);
        ProducerRecord<byte[], byte[]> record = new ProducerRecord<>(topic, key, serializer.serialize(alert));

        CompletableFuture<Void> acknowledged = new CompletableFuture<>();
        try {
            producer.send(record, (metadata, error) -> {
                if (error == null) {
                    acknowledged.complete(null);
                } else {
                    acknowledged.completeExceptionally(error);
                }
            });
        } catch (KafkaException e) {
            acknowledged.completeExceptionally(e);
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        acknowledged.orTimeout(sendTimeoutMs, TimeUnit.MILLISECONDS).whenComplete((ignored, error) -> {
            if (error == null) {
                result.complete(null);
            } else if (error instanceof TimeoutException) {
                result.completeExceptionally(new TransportException(monitorId,
                        "Kafka did not acknowledge alert within " + sendTimeoutMs + " ms", error));
            } else {
                result.completeExceptionally(new TransportException(monitorId,
                        "Kafka rejected alert: " + error.getMessage(), error));
            }
        });
        return result;
    }

    @Override
    public void close() {
        producer.close();
    }
}
