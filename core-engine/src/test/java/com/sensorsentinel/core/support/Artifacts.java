package com.sensorsentinel.core.support;

import com.sensorsentinel.core.ml.JsonArtifactCodec;
import com.sensorsentinel.core.ml.RobustScaler;
import com.sensorsentinel.core.model.ModelArtifact;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Artifact fixtures.
 */
public final class Artifacts {

    public static final Instant BUILT_AT = Instant.parse("2024-06-01T00:00:00Z");

    private Artifacts() {
    }

    /** Codec that also understands {@link FixedScoreModel}. */
    public static JsonArtifactCodec codec() {
        return new JsonArtifactCodec().registerType(FixedScoreModel.class, "fixed");
    }

    /** Artifact with an identity scaler and a constant score. */
    public static ModelArtifact fixed(String monitorId, double score, String... features) {
        return fixedBuilder(monitorId, score, features).build();
    }

    public static ModelArtifact.Builder fixedBuilder(String monitorId, double score, String... features) {
        List<String> names = Arrays.asList(features);
        double[] zeros = new double[names.size()];
        double[] ones = new double[names.size()];
        Arrays.fill(ones, 1.0);
        return ModelArtifact.builder()
                .monitorId(monitorId)
                .builtAt(BUILT_AT)
                .featureNames(names)
                .scaler(new RobustScaler(zeros, ones))
                .model(new FixedScoreModel(score))
                .trainingSamples(100);
    }

    public static byte[] encoded(String monitorId, double score, String... features) {
        return codec().encode(fixed(monitorId, score, features));
    }
}
