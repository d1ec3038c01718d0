package com.sensorsentinel.core.ml;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest anomaly scorer.
 *
 * <p>
 * {@code s(x) = 2^(-E[h(x)] / c(n))} where {@code h} is the path length of
 * {@code x} in a tree and {@code c(n)} the expected path length for the
 * sub-sample size. Scores near 1 are anomalous, around 0.5 or below normal.
 * </p>
 */
public class IsolationForest implements AnomalyModel {

    private List<IsolationTree> trees = new ArrayList<>();
    private int sampleSize;

    public IsolationForest() {
    }

    /**
     * Train a forest.
     *
     * @param rows       scaled training samples
     * @param numTrees   number of trees
     * @param sampleSize sub-sample size per tree, capped at the number of rows
     * @param seed       random seed; equal inputs give equal forests
     */
    public static IsolationForest train(double[][] rows, int numTrees, int sampleSize, long seed) {
        if (rows == null || rows.length == 0) {
            throw new IllegalArgumentException("Cannot train on no data");
        }
        IsolationForest forest = new IsolationForest();
        forest.sampleSize = Math.min(sampleSize, rows.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(2, forest.sampleSize)) / Math.log(2));
        Random random = new Random(seed);
        for (int i = 0; i < numTrees; i++) {
            forest.trees.add(IsolationTree.grow(subsample(rows, forest.sampleSize, random), maxDepth, random));
        }
        return forest;
    }

    private static double[][] subsample(double[][] rows, int size, Random random) {
        if (rows.length <= size) {
            return Arrays.copyOf(rows, rows.length);
        }
        // partial Fisher-Yates over indices
        int[] idx = new int[rows.length];
        for (int i = 0; i < idx.length; i++) {
            idx[i] = i;
        }
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(rows.length - i);
            int tmp = idx[i];
            idx[i] = idx[j];
            idx[j] = tmp;
            sample[i] = rows[idx[i]];
        }
        return sample;
    }

    @Override
    public double score(double[] features) {
        if (trees.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(features);
        }
        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) {
            return 0.0;
        }
        return Math.pow(2.0, -(total / trees.size()) / c);
    }

    public List<IsolationTree> getTrees() {
        return trees;
    }

    public void setTrees(List<IsolationTree> trees) {
        this.trees = trees != null ? trees : new ArrayList<>();
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }
}
