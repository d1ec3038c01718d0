package com.sensorsentinel.core.detection;

import com.sensorsentinel.core.error.SchemaMismatchException;
import com.sensorsentinel.core.model.FeatureVector;
import com.sensorsentinel.core.model.ModelArtifact;
import com.sensorsentinel.core.model.WindowSummary;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Turns a window summary into the scaled feature vector an artifact expects.
 *
 * <p>
 * Pure: the same artifact and summary always give the same vector.
 * </p>
 */
public class Preprocessor {

    /**
     * @throws SchemaMismatchException if the summary's sensors differ from the
     *                                 artifact's feature names
     */
    public FeatureVector transform(ModelArtifact artifact, WindowSummary summary) {
        Objects.requireNonNull(artifact, "artifact must not be null");
        Objects.requireNonNull(summary, "summary must not be null");

        List<String> expected = artifact.getFeatureNames();
        if (!new TreeSet<>(expected).equals(new TreeSet<>(summary.getSensorNames()))) {
            throw new SchemaMismatchException(summary.getMonitorId(), expected, summary.getSensorNames());
        }

        double[] raw = new double[expected.size()];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = summary.mean(expected.get(i));
        }
        if (artifact.getScaler().dimension() != raw.length) {
            throw new SchemaMismatchException(summary.getMonitorId(), expected, summary.getSensorNames());
        }
        return new FeatureVector(expected, artifact.getScaler().transform(raw));
    }
}
