package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.error.SchemaMismatchException;
import com.sensorsentinel.core.ml.RobustScaler;
import com.sensorsentinel.core.model.FeatureVector;
import com.sensorsentinel.core.model.ModelArtifact;
import com.sensorsentinel.core.support.Artifacts;
import com.sensorsentinel.core.support.FixedScoreModel;
import com.sensorsentinel.core.support.Summaries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Preprocessor}.
 */
class PreprocessorTest {

    private final Preprocessor preprocessor = new Preprocessor();

    @Test
    @DisplayName("Should scale window means in the artifact's feature order")
    void shouldScaleMeansInFeatureOrder() {
        ModelArtifact artifact = ModelArtifact.builder()
                .monitorId("m1")
                .builtAt(Artifacts.BUILT_AT)
                .featureNames(List.of("temperature", "pressure"))
                .scaler(new RobustScaler(new double[] { 20.0, 1.0 }, new double[] { 5.0, 0.5 }))
                .model(new FixedScoreModel(0.1))
                .build();

        FeatureVector vector = preprocessor.transform(artifact,
                Summaries.withMeans("m1", 60, Map.of("pressure", 2.0, "temperature", 30.0)));

        assertThat(vector.getNames()).containsExactly("temperature", "pressure");
        assertThat(vector.values()).containsExactly(2.0, 2.0);
    }

    @Test
    @DisplayName("Should give identical vectors for identical inputs")
    void shouldBeDeterministic() {
        ModelArtifact artifact = Artifacts.fixed("m1", 0.2, "a", "b");

        FeatureVector first = preprocessor.transform(artifact, Summaries.withMeans("m1", 10, Map.of("a", 1.5, "b", -3.0)));
        FeatureVector second = preprocessor.transform(artifact, Summaries.withMeans("m1", 10, Map.of("a", 1.5, "b", -3.0)));

        assertThat(first.values()).containsExactly(second.values());
    }

    @Test
    @DisplayName("Should reject a window whose sensors differ from the model's features")
    void shouldRejectSchemaMismatch() {
        ModelArtifact artifact = Artifacts.fixed("m1", 0.2, "a", "b");

        assertThatThrownBy(() -> preprocessor.transform(artifact,
                Summaries.withMeans("m1", 10, Map.of("a", 1.0, "c", 2.0))))
                .isInstanceOf(SchemaMismatchException.class)
                .satisfies(e -> {
                    SchemaMismatchException mismatch = (SchemaMismatchException) e;
                    assertThat(mismatch.getMonitorId()).isEqualTo("m1");
                    assertThat(mismatch.getExpected()).containsExactly("a", "b");
                    assertThat(mismatch.getActual()).containsExactly("a", "c");
                });
    }

    @Test
    @DisplayName("Should reject a window that is missing one of the model's features")
    void shouldRejectMissingFeature() {
        ModelArtifact artifact = Artifacts.fixed("m1", 0.2, "a", "b");

        assertThatThrownBy(() -> preprocessor.transform(artifact, Summaries.withMeans("m1", 10, Map.of("a", 1.0))))
                .isInstanceOf(SchemaMismatchException.class);
    }
}
