package com.sensorsentinel.core.ml;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Node of an isolation tree. Short JSON names keep stored forests compact.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    @JsonProperty("f")
    private int splitFeature;

    @JsonProperty("v")
    private double splitValue;

    @JsonProperty("l")
    private IsolationNode left;

    @JsonProperty("r")
    private IsolationNode right;

    /** Training samples that ended in this leaf. */
    @JsonProperty("s")
    private int size;

    @JsonProperty("e")
    private boolean external;

    public IsolationNode() {
    }

    static IsolationNode internal(int splitFeature, double splitValue, IsolationNode left, IsolationNode right) {
        IsolationNode node = new IsolationNode();
        node.splitFeature = splitFeature;
        node.splitValue = splitValue;
        node.left = left;
        node.right = right;
        return node;
    }

    static IsolationNode leaf(int size) {
        IsolationNode node = new IsolationNode();
        node.size = size;
        node.external = true;
        return node;
    }

    double pathLength(double[] point, int depth) {
        IsolationNode node = this;
        while (!node.external) {
            node = point[node.splitFeature] < node.splitValue ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Expected path length of an unsuccessful BST search over {@code n} items,
     * {@code c(n) = 2H(n-1) - 2(n-1)/n}.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    public int getSplitFeature() {
        return splitFeature;
    }

    public double getSplitValue() {
        return splitValue;
    }

    public IsolationNode getLeft() {
        return left;
    }

    public IsolationNode getRight() {
        return right;
    }

    public int getSize() {
        return size;
    }

    public boolean isExternal() {
        return external;
    }
}
