package com.sensorsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should apply defaults for everything but the model bucket")
    void shouldApplyDefaults() {
        JobConfig config = new JobConfig.Builder().modelBucket("models").build();

        assertThat(config.getKafkaInputTopic()).isEqualTo("sensor-readings");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("sensor-alerts");
        assertThat(config.getKafkaGroupId()).isEqualTo("sensor-sentinel");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getAsyncCapacity()).isEqualTo(100);
        assertThat(config.getModelPrefix()).isEqualTo("models");
        assertThat(config.getTrendHistoryMonths()).isEqualTo(6);
        assertThat(config.getTrendApiMaxAttempts()).isEqualTo(3);
        assertThat(config.getTrendApiRetryWaitMs()).isEqualTo(1_000);
    }

    @Test
    @DisplayName("Should require a model bucket")
    void shouldRequireModelBucket() {
        assertThatThrownBy(() -> new JobConfig.Builder().build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("modelBucket");
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> builder().asyncTimeoutMs(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("asyncTimeoutMs");
        assertThatThrownBy(() -> builder().asyncCapacity(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("asyncCapacity");
        assertThatThrownBy(() -> builder().kafkaAlertTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaAlertTopic");
        assertThatThrownBy(() -> builder().trendApiBaseUrl("").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("trendApiBaseUrl");
        assertThatThrownBy(() -> builder().trendApiMaxAttempts(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("trendApiMaxAttempts");
    }

    @Test
    @DisplayName("Should build producer properties with acknowledged, bounded delivery")
    void shouldBuildProducerProperties() {
        Properties props = builder().kafkaBootstrapServers("broker:9092").alertSendTimeoutMs(5_000).build()
                .kafkaProducerProperties();

        assertThat(props.getProperty("bootstrap.servers")).isEqualTo("broker:9092");
        assertThat(props.getProperty("acks")).isEqualTo("all");
        assertThat(props.getProperty("delivery.timeout.ms")).isEqualTo("5000");
        assertThat(Long.parseLong(props.getProperty("delivery.timeout.ms")))
                .isGreaterThanOrEqualTo(Long.parseLong(props.getProperty("request.timeout.ms")));
        assertThat(props.getProperty("max.block.ms")).isEqualTo("5000");
    }

    // ---- Helpers

    private static JobConfig.Builder builder() {
        return new JobConfig.Builder().modelBucket("models");
    }
}
