package com.sensorsentinel.flink;

import com.sensorsentinel.core.config.EngineConfig;
import com.sensorsentinel.core.config.EngineConfigLoader;
import com.sensorsentinel.core.model.Reading;
import com.sensorsentinel.core.model.ScoredWindow;
import com.sensorsentinel.core.model.WindowSummary;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.AsyncDataStream;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the Sensor Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (readings topic)
 *     → Parse JSON → Reading (invalid records dropped)
 *     → Key by monitorId
 *     → WindowingFunction (sliding window per monitor)
 *     → ModelScoringFunction (async: model cache, preprocess, score)
 *     → Key by monitorId
 *     → VerdictFunction (threshold with hysteresis)
 *     → AlertSinkFunction (retrying Kafka publish)
 * </pre>
 *
 * <p>
 * The scoring step uses ordered async I/O, so windows of a monitor reach the
 * verdict step in the order they were emitted while other monitors keep
 * flowing during a slow model load or build.
 * </p>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job wiring comes from environment variables via {@link JobConfig}; engine
 * behaviour from the YAML file loaded by {@link EngineConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing keeps windows and breach counters consistent
 * with the consumed Kafka offsets across failures.
 * </p>
 *
 * @since 1.0.0
 */
public final class SensorSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(SensorSentinelJob.class);

        private SensorSentinelJob() {
                // entry-point class - not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Sensor Sentinel with config: {}", config);

                EngineConfig engineConfig = EngineConfigLoader.load(config.getEngineConfigPath());
                LOG.info("Engine config: window={} detection={}", engineConfig.getWindow(), engineConfig.getDetection());

                // 2. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 3. Build pipeline
                buildPipeline(env, config, engineConfig);

                // 4. Execute
                env.execute("Sensor Sentinel - Streaming Inference");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        EngineConfig engineConfig) {
                KafkaSource<Reading> kafkaSource = KafkaSource.<Reading>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new ReadingDeserializationSchema())
                                .build();

                DataStream<Reading> readings = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.<Reading>forBoundedOutOfOrderness(Duration.ofSeconds(
                                                engineConfig.getWindow().getAllowedLatenessSeconds()))
                                                .withTimestampAssigner((reading, ts) -> reading.getTimestampMillis())
                                                .withIdleness(Duration.ofMinutes(1)),
                                "kafka-readings-source");

                DataStream<WindowSummary> summaries = readings
                                .filter(Objects::nonNull) // drop rejected records
                                .keyBy(Reading::getMonitorId)
                                .process(new WindowingFunction(engineConfig.getWindow()))
                                .name("sliding-window");

                DataStream<ScoredWindow> scored = AsyncDataStream.orderedWait(
                                summaries,
                                new ModelScoringFunction(engineConfig, config),
                                config.getAsyncTimeoutMs(),
                                TimeUnit.MILLISECONDS,
                                config.getAsyncCapacity())
                                .name("model-scoring");

                scored.keyBy(ScoredWindow::getMonitorId)
                                .process(new VerdictFunction(engineConfig.getDetection()))
                                .name("anomaly-verdict")
                                .addSink(new AlertSinkFunction(config, engineConfig.getPublish(),
                                        engineConfig.getDetection().getSensorLabels()))
                                .name("kafka-alerts-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // Retain checkpoints on cancellation so state can be restored
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
