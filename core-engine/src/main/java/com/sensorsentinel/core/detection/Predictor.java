package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.model.FeatureVector;
import com.sensorsentinel.core.model.ModelArtifact;

import java.util.Objects;

/**
 * Scores feature vectors with an artifact's model. Stateless.
 */
public class Predictor {

    public double score(ModelArtifact artifact, FeatureVector features) {
        Objects.requireNonNull(artifact, "artifact must not be null");
        Objects.requireNonNull(features, "features must not be null");
        double score = artifact.getModel().score(features.values());
        if (Double.isNaN(score)) {
            throw new IllegalStateException("Model " + artifact.getVersion() + " of monitor "
                    + artifact.getMonitorId() + " returned NaN");
        }
        return score;
    }
}
