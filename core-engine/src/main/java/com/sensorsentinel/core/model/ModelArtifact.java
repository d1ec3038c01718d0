package com.sensorsentinel.core.model;

import com.sensorsentinel.core.ml.AnomalyModel;
import com.sensorsentinel.core.ml.FeatureScaler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A trained, versioned scoring function for exactly one monitor, together
 * with the scaler it was fitted with and the feature names it expects.
 *
 * <p>
 * Immutable once built. An artifact is only ever used for the monitor it
 * names, and only while {@link #isValid()} holds.
 * </p>
 *
 * @since 1.0.0
 */
public final class ModelArtifact {

    private final String monitorId;
    private final String version;
    private final Instant builtAt;
    private final List<String> featureNames;
    private final FeatureScaler scaler;
    private final AnomalyModel model;
    private final int trainingSamples;
    private final boolean valid;

    private ModelArtifact(Builder builder) {
        this.monitorId = Objects.requireNonNull(builder.monitorId, "monitorId must not be null");
        this.builtAt = Objects.requireNonNull(builder.builtAt, "builtAt must not be null");
        this.version = builder.version != null ? builder.version : String.valueOf(builtAt.toEpochMilli());
        this.featureNames = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(builder.featureNames, "featureNames must not be null")));
        this.scaler = Objects.requireNonNull(builder.scaler, "scaler must not be null");
        this.model = Objects.requireNonNull(builder.model, "model must not be null");
        this.trainingSamples = builder.trainingSamples;
        this.valid = builder.valid;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return {@code true} if this artifact may score windows of {@code requestedMonitorId}
     */
    public boolean isUsableFor(String requestedMonitorId) {
        return valid && monitorId.equals(requestedMonitorId);
    }

    public String getMonitorId() {
        return monitorId;
    }

    public String getVersion() {
        return version;
    }

    public Instant getBuiltAt() {
        return builtAt;
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public FeatureScaler getScaler() {
        return scaler;
    }

    public AnomalyModel getModel() {
        return model;
    }

    public int getTrainingSamples() {
        return trainingSamples;
    }

    public boolean isValid() {
        return valid;
    }

    @Override
    public String toString() {
        return "ModelArtifact{monitorId='" + monitorId + "', version='" + version
                + "', builtAt=" + builtAt + ", features=" + featureNames
                + ", trainingSamples=" + trainingSamples + ", valid=" + valid + '}';
    }

    public static class Builder {
        private String monitorId;
        private String version;
        private Instant builtAt;
        private List<String> featureNames;
        private FeatureScaler scaler;
        private AnomalyModel model;
        private int trainingSamples;
        private boolean valid = true;

        public Builder monitorId(String monitorId) {
            this.monitorId = monitorId;
            return this;
        }

        /** Defaults to the build time in epoch millis when unset. */
        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder builtAt(Instant builtAt) {
            this.builtAt = builtAt;
            return this;
        }

        public Builder featureNames(List<String> featureNames) {
            this.featureNames = featureNames;
            return this;
        }

        public Builder scaler(FeatureScaler scaler) {
            this.scaler = scaler;
            return this;
        }

        public Builder model(AnomalyModel model) {
            this.model = model;
            return this;
        }

        public Builder trainingSamples(int trainingSamples) {
            this.trainingSamples = trainingSamples;
            return this;
        }

        public Builder valid(boolean valid) {
            this.valid = valid;
            return this;
        }

        public ModelArtifact build() {
            return new ModelArtifact(this);
        }
    }
}
