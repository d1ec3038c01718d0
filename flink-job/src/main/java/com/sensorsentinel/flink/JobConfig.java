package com.sensorsentinel.flink;

import java.io.Serializable;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration object for the Sensor Sentinel Flink job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configured through Kubernetes Deployment env vars, Docker
 * {@code -e} flags, or a shell environment. Engine settings (windowing,
 * cache, thresholds) live in the YAML file named by {@code ENGINE_CONFIG_PATH}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaAlertTopic;
    private final String kafkaGroupId;
    private final long alertSendTimeoutMs;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final long asyncTimeoutMs;
    private final int asyncCapacity;

    // ---------------------------------------------------------------
    // Engine
    // ---------------------------------------------------------------
    private final String engineConfigPath;

    // ---------------------------------------------------------------
    // Model store / trend API
    // ---------------------------------------------------------------
    private final String modelBucket;
    private final String modelPrefix;
    private final String awsRegion;
    private final String trendApiBaseUrl;
    private final long trendApiTimeoutSeconds;
    private final int trendHistoryMonths;
    private final int trendApiMaxAttempts;
    private final long trendApiRetryWaitMs;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.alertSendTimeoutMs = b.alertSendTimeoutMs;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.asyncTimeoutMs = b.asyncTimeoutMs;
        this.asyncCapacity = b.asyncCapacity;
        this.engineConfigPath = b.engineConfigPath;
        this.modelBucket = b.modelBucket;
        this.modelPrefix = b.modelPrefix;
        this.awsRegion = b.awsRegion;
        this.trendApiBaseUrl = b.trendApiBaseUrl;
        this.trendApiTimeoutSeconds = b.trendApiTimeoutSeconds;
        this.trendHistoryMonths = b.trendHistoryMonths;
        this.trendApiMaxAttempts = b.trendApiMaxAttempts;
        this.trendApiRetryWaitMs = b.trendApiRetryWaitMs;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env("KAFKA_INPUT_TOPIC", "sensor-readings"))
                    .kafkaAlertTopic(env("KAFKA_ALERT_TOPIC", "sensor-alerts"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "sensor-sentinel"))
                    .alertSendTimeoutMs(parseLongEnv("KAFKA_ALERT_SEND_TIMEOUT_MS", "10000"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .asyncTimeoutMs(parseLongEnv("ASYNC_TIMEOUT_MS", "660000"))
                    .asyncCapacity(parseIntEnv("ASYNC_CAPACITY", "100"))
                    .engineConfigPath(env("ENGINE_CONFIG_PATH", ""))
                    .modelBucket(env("MODEL_BUCKET", ""))
                    .modelPrefix(env("MODEL_PREFIX", "models"))
                    .awsRegion(env("AWS_REGION", ""))
                    .trendApiBaseUrl(env("TREND_API_BASE_URL", "http://localhost:8000"))
                    .trendApiTimeoutSeconds(parseLongEnv("TREND_API_TIMEOUT_SECONDS", "30"))
                    .trendHistoryMonths(parseIntEnv("TREND_HISTORY_MONTHS", "6"))
                    .trendApiMaxAttempts(parseIntEnv("TREND_API_MAX_ATTEMPTS", "3"))
                    .trendApiRetryWaitMs(parseLongEnv("TREND_API_RETRY_WAIT_MS", "1000"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Build Kafka producer {@link Properties} for the alert publisher.
     *
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("acks", "all");
        props.setProperty("enable.idempotence", "true");
        props.setProperty("delivery.timeout.ms", String.valueOf(Math.max(alertSendTimeoutMs, 1_000L)));
        props.setProperty("request.timeout.ms", String.valueOf(Math.min(alertSendTimeoutMs, 30_000L)));
        props.setProperty("linger.ms", "0");
        props.setProperty("max.block.ms", String.valueOf(alertSendTimeoutMs));
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public long getAlertSendTimeoutMs() {
        return alertSendTimeoutMs;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public long getAsyncTimeoutMs() {
        return asyncTimeoutMs;
    }

    public int getAsyncCapacity() {
        return asyncCapacity;
    }

    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    public String getModelBucket() {
        return modelBucket;
    }

    public String getModelPrefix() {
        return modelPrefix;
    }

    public String getAwsRegion() {
        return awsRegion;
    }

    public String getTrendApiBaseUrl() {
        return trendApiBaseUrl;
    }

    public long getTrendApiTimeoutSeconds() {
        return trendApiTimeoutSeconds;
    }

    public int getTrendHistoryMonths() {
        return trendHistoryMonths;
    }

    public int getTrendApiMaxAttempts() {
        return trendApiMaxAttempts;
    }

    /** Wait before the first retry of a trend API call; the n-th retry waits n times as long. */
    public long getTrendApiRetryWaitMs() {
        return trendApiRetryWaitMs;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (positive parallelism, intervals and timeouts, non-blank topic
     * names, bucket and trend API URL).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "sensor-readings";
        private String kafkaAlertTopic = "sensor-alerts";
        private String kafkaGroupId = "sensor-sentinel";
        private long alertSendTimeoutMs = 10_000;
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private long asyncTimeoutMs = 660_000;
        private int asyncCapacity = 100;
        private String engineConfigPath = "";
        private String modelBucket;
        private String modelPrefix = "models";
        private String awsRegion = "";
        private String trendApiBaseUrl = "http://localhost:8000";
        private long trendApiTimeoutSeconds = 30;
        private int trendHistoryMonths = 6;
        private int trendApiMaxAttempts = 3;
        private long trendApiRetryWaitMs = 1_000;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder alertSendTimeoutMs(long v) {
            this.alertSendTimeoutMs = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder asyncTimeoutMs(long v) {
            this.asyncTimeoutMs = v;
            return this;
        }

        public Builder asyncCapacity(int v) {
            this.asyncCapacity = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder modelBucket(String v) {
            this.modelBucket = v;
            return this;
        }

        public Builder modelPrefix(String v) {
            this.modelPrefix = v;
            return this;
        }

        public Builder awsRegion(String v) {
            this.awsRegion = v;
            return this;
        }

        public Builder trendApiBaseUrl(String v) {
            this.trendApiBaseUrl = v;
            return this;
        }

        public Builder trendApiTimeoutSeconds(long v) {
            this.trendApiTimeoutSeconds = v;
            return this;
        }

        public Builder trendHistoryMonths(int v) {
            this.trendHistoryMonths = v;
            return this;
        }

        public Builder trendApiMaxAttempts(int v) {
            this.trendApiMaxAttempts = v;
            return this;
        }

        public Builder trendApiRetryWaitMs(long v) {
            this.trendApiRetryWaitMs = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(modelBucket, "modelBucket");
            requireNonBlank(trendApiBaseUrl, "trendApiBaseUrl");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (asyncTimeoutMs < 1) {
                throw new IllegalArgumentException("asyncTimeoutMs must be >= 1, got: " + asyncTimeoutMs);
            }
            if (asyncCapacity < 1) {
                throw new IllegalArgumentException("asyncCapacity must be >= 1, got: " + asyncCapacity);
            }
            if (alertSendTimeoutMs < 1) {
                throw new IllegalArgumentException(
                        "alertSendTimeoutMs must be >= 1, got: " + alertSendTimeoutMs);
            }
            if (trendApiTimeoutSeconds < 1) {
                throw new IllegalArgumentException(
                        "trendApiTimeoutSeconds must be >= 1, got: " + trendApiTimeoutSeconds);
            }
            if (trendHistoryMonths < 1) {
                throw new IllegalArgumentException(
                        "trendHistoryMonths must be >= 1, got: " + trendHistoryMonths);
            }
            if (trendApiMaxAttempts < 1) {
                throw new IllegalArgumentException(
                        "trendApiMaxAttempts must be >= 1, got: " + trendApiMaxAttempts);
            }
            if (trendApiRetryWaitMs < 0) {
                throw new IllegalArgumentException(
                        "trendApiRetryWaitMs must be >= 0, got: " + trendApiRetryWaitMs);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", asyncTimeoutMs=" + asyncTimeoutMs +
                ", asyncCapacity=" + asyncCapacity +
                ", modelBucket='" + modelBucket + '\'' +
                ", modelPrefix='" + modelPrefix + '\'' +
                ", trendApiBaseUrl='" + trendApiBaseUrl + '\'' +
                ", trendApiMaxAttempts=" + trendApiMaxAttempts +
                '}';
    }
}
