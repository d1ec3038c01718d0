package com.sensorsentinel.core.ml;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Scoring function of a model artifact.
 *
 * <p>
 * Implementations must be deterministic and safe to call from several
 * threads at once. Scores lie in {@code [0, 1]}; higher means more anomalous.
 * </p>
 *
 * <p>
 * Serialized polymorphically; further implementations are registered with
 * {@link JsonArtifactCodec#registerType(Class, String)}.
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IsolationForest.class, name = "isolation-forest")
})
public interface AnomalyModel {

    /**
     * @param features scaled feature vector, in the artifact's feature order
     * @return anomaly score
     */
    double score(double[] features);
}
