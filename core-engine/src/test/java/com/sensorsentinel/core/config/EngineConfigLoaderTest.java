package com.sensorsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineConfigLoader}.
 */
class EngineConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load every section from a classpath resource")
    void shouldLoadFromClasspath() {
        EngineConfig config = EngineConfigLoader.fromClasspath("test-engine.yml");

        assertThat(config.getWorkerThreads()).isEqualTo(2);
        assertThat(config.getWindow().getSpanSeconds()).isEqualTo(120);
        assertThat(config.getWindow().getMaxCount()).isEqualTo(20);
        assertThat(config.getWindow().getMinSamples()).isEqualTo(3);
        assertThat(config.getWindow().getAllowedLatenessSeconds()).isEqualTo(10);
        assertThat(config.getWindow().getSensors()).containsExactly("temperature", "vibration");
        assertThat(config.getCache().getCapacity()).isEqualTo(8);
        assertThat(config.getCache().getFreshnessSeconds()).isEqualTo(600);
        assertThat(config.getPublish().getMaxAttempts()).isEqualTo(5);
        assertThat(config.getPublish().getRetryWaitMillis()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should keep defaults for sections the file omits")
    void shouldKeepDefaults() {
        EngineConfig config = EngineConfigLoader.fromClasspath("test-engine.yml");

        assertThat(config.getCache().getFetchTimeoutMillis()).isEqualTo(30_000);
        assertThat(config.getCache().getBackoffMultiplier()).isEqualTo(2.0);
        assertThat(config.getWindow().getEmitEvery()).isEqualTo(1);
        assertThat(config.getTraining().getTrees()).isEqualTo(200);
    }

    @Test
    @DisplayName("Should apply per-monitor overrides on top of the defaults")
    void shouldResolveMonitorPolicies() {
        DetectionSettings detection = EngineConfigLoader.fromClasspath("test-engine.yml").getDetection();

        assertThat(detection.policyFor("pump-7").getThreshold()).isEqualTo(0.85);
        assertThat(detection.policyFor("pump-7").getBreachCount()).isEqualTo(2);
        assertThat(detection.policyFor("fan-2").getThreshold()).isEqualTo(0.7);
        assertThat(detection.policyFor("fan-2").getBreachCount()).isEqualTo(4);
        assertThat(detection.policyFor("other").getThreshold()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("Should load sensor display names")
    void shouldLoadSensorLabels() {
        DetectionSettings detection = EngineConfigLoader.fromClasspath("test-engine.yml").getDetection();

        assertThat(detection.getSensorLabels())
                .containsEntry("001_A", "Oil Temperature")
                .containsEntry("002_A", "Winding Temperature")
                .hasSize(2);
    }

    @Test
    @DisplayName("Should reject blank sensor display names")
    void shouldRejectBlankSensorLabel() throws Exception {
        Path file = write("detection:\n"
                + "  sensorLabels:\n"
                + "    \"001_A\": \"  \"\n");

        assertThatThrownBy(() -> EngineConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("detection.sensorLabels['001_A'] must not be blank");
    }

    @Test
    @DisplayName("Should load the bundled defaults")
    void shouldLoadBundledDefaults() {
        EngineConfig config = EngineConfigLoader.fromClasspath(EngineConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getWindow().getSpanSeconds()).isEqualTo(300);
        assertThat(config.getDetection().getThreshold()).isEqualTo(0.6);
        assertThat(config.getCache().getCapacity()).isEqualTo(32);
    }

    @Test
    @DisplayName("Should report every invalid setting at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("invalid-engine.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Engine configuration validation failed")
                .hasMessageContaining("window requires spanSeconds > 0 or maxCount > 0")
                .hasMessageContaining("window.minSamples must be >= 1")
                .hasMessageContaining("detection.threshold must be within [0, 1]")
                .hasMessageContaining("Override 'monitorId' is required");
    }

    @Test
    @DisplayName("Should reject duplicate overrides for the same monitor")
    void shouldRejectDuplicateOverrides() throws Exception {
        Path file = write("detection:\n"
                + "  overrides:\n"
                + "    - monitorId: m1\n"
                + "      threshold: 0.5\n"
                + "    - monitorId: m1\n"
                + "      breachCount: 2\n");

        assertThatThrownBy(() -> EngineConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate override for monitor 'm1'");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty file")
    void shouldUseDefaultsForEmptyFile() throws Exception {
        Path file = write("");

        EngineConfig config = EngineConfigLoader.fromFile(file.toString());

        assertThat(config.getWorkerThreads()).isEqualTo(4);
        assertThat(config.getDetection().getBreachCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should load from an explicit path")
    void shouldLoadFromExplicitPath() throws Exception {
        Path file = write("workerThreads: 7\n");

        assertThat(EngineConfigLoader.load(file.toString()).getWorkerThreads()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should fail clearly for a missing file or resource")
    void shouldFailForMissingSources() {
        assertThatThrownBy(() -> EngineConfigLoader.fromFile(tempDir.resolve("absent.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("absent.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("absent.yml");
    }

    // ---- Helpers

    private Path write(String yaml) throws Exception {
        Path file = tempDir.resolve("engine.yml");
        Files.writeString(file, yaml, StandardCharsets.UTF_8);
        return file;
    }
}
