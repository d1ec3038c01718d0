package com.sensorsentinel.core.ml;

import com.sensorsentinel.core.config.TrainingSettings;
import com.sensorsentinel.core.error.ModelBuildException;
import com.sensorsentinel.core.model.ModelArtifact;
import com.sensorsentinel.core.model.Reading;
import com.sensorsentinel.core.support.MutableClock;
import com.sensorsentinel.core.support.Readings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IsolationForestModelBuilder}.
 */
class IsolationForestModelBuilderTest {

    private final JsonArtifactCodec codec = new JsonArtifactCodec();
    private final MutableClock clock = new MutableClock(Readings.T0);
    private TrainingSettings settings;

    @BeforeEach
    void setUp() {
        settings = new TrainingSettings();
        settings.setTrees(50);
        settings.setSampleSize(64);
        settings.setMinHistory(10);
    }

    @Test
    @DisplayName("Should train an artifact over every sensor in the history")
    void shouldTrainArtifact() {
        IsolationForestModelBuilder builder = new IsolationForestModelBuilder(settings, List.of(), codec, clock);

        ModelArtifact artifact = codec.decode("m1", builder.build("m1", history("m1", 200)));

        assertThat(artifact.getMonitorId()).isEqualTo("m1");
        assertThat(artifact.getFeatureNames()).containsExactly("pressure", "temperature");
        assertThat(artifact.getTrainingSamples()).isEqualTo(200);
        assertThat(artifact.getBuiltAt()).isEqualTo(Readings.T0);
        assertThat(artifact.getVersion()).isEqualTo(String.valueOf(Readings.T0.toEpochMilli()));

        double normal = artifact.getModel().score(artifact.getScaler().transform(new double[] { 2.0, 70.0 }));
        double extreme = artifact.getModel().score(artifact.getScaler().transform(new double[] { 9.0, 140.0 }));
        assertThat(extreme).isGreaterThan(normal);
    }

    @Test
    @DisplayName("Should restrict features to the sensor whitelist")
    void shouldHonourWhitelist() {
        IsolationForestModelBuilder builder = new IsolationForestModelBuilder(settings, Set.of("temperature"), codec, clock);

        ModelArtifact artifact = codec.decode("m1", builder.build("m1", history("m1", 50)));

        assertThat(artifact.getFeatureNames()).containsExactly("temperature");
        assertThat(artifact.getScaler().dimension()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fill missing sensor values instead of dropping the record")
    void shouldFillGaps() {
        List<Reading> records = new ArrayList<>(history("m1", 20));
        records.add(Readings.at("m1", 500, "temperature", 71.0));
        IsolationForestModelBuilder builder = new IsolationForestModelBuilder(settings, List.of(), codec, clock);

        ModelArtifact artifact = codec.decode("m1", builder.build("m1", records));

        assertThat(artifact.getTrainingSamples()).isEqualTo(21);
        assertThat(artifact.getFeatureNames()).containsExactly("pressure", "temperature");
    }

    @Test
    @DisplayName("Should fail without history")
    void shouldFailOnEmptyHistory() {
        IsolationForestModelBuilder builder = new IsolationForestModelBuilder(settings, List.of(), codec, clock);

        assertThatThrownBy(() -> builder.build("m1", List.of()))
                .isInstanceOf(ModelBuildException.class)
                .hasMessageContaining("No trend history");
    }

    @Test
    @DisplayName("Should fail when history is shorter than the configured minimum")
    void shouldFailOnShortHistory() {
        IsolationForestModelBuilder builder = new IsolationForestModelBuilder(settings, List.of(), codec, clock);

        assertThatThrownBy(() -> builder.build("m1", history("m1", 5)))
                .isInstanceOf(ModelBuildException.class)
                .hasMessageContaining("Insufficient trend history");
    }

    // ---- Helpers

    private static List<Reading> history(String monitorId, int count) {
        Random random = new Random(11);
        List<Reading> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(Readings.at(monitorId, i * 60L,
                    "temperature", 70.0 + random.nextGaussian(),
                    "pressure", 2.0 + 0.1 * random.nextGaussian()));
        }
        return records;
    }
}
