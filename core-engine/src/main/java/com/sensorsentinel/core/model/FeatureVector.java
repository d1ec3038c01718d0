package com.sensorsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Scaled model input, positionally aligned with the artifact's feature names.
 */
public final class FeatureVector {

    private final List<String> names;
    private final double[] values;

    public FeatureVector(List<String> names, double[] values) {
        Objects.requireNonNull(names, "names must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (names.size() != values.length) {
            throw new IllegalArgumentException("Feature vector has " + values.length
                    + " values for " + names.size() + " names");
        }
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        this.values = values.clone();
    }

    public List<String> getNames() {
        return names;
    }

    public double[] values() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    /**
     * Names of the features furthest from the scaler's centre, largest
     * absolute scaled value first. Ties keep feature-name order.
     *
     * @param limit maximum number of names to return
     */
    public List<String> topFeatures(int limit) {
        return IntStream.range(0, values.length)
                .boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> -Math.abs(values[i])))
                .limit(Math.max(0, limit))
                .map(names::get)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FeatureVector{");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(names.get(i)).append('=').append(values[i]);
        }
        return sb.append('}').toString();
    }
}
