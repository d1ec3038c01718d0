package com.sensorsentinel.core.ml;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Maps raw window statistics into the space the model was trained in.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RobustScaler.class, name = "robust")
})
public interface FeatureScaler {

    /**
     * @param raw unscaled values in feature order
     * @return a new array with the scaled values
     * @throws IllegalArgumentException if {@code raw} has the wrong length
     */
    double[] transform(double[] raw);

    /** @return number of features this scaler was fitted on */
    int dimension();
}
