package com.sensorsentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Parameters of the isolation-forest model builder, the {@code training}
 * section of the engine YAML.
 */
public class TrainingSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int trees = 200;

    /** Sub-sample size per tree. */
    private int sampleSize = 256;

    private long seed = 42L;

    /** Builds with fewer usable history records fail. */
    private int minHistory = 32;

    void validate(List<String> errors) {
        if (trees < 1) {
            errors.add("training.trees must be >= 1");
        }
        if (sampleSize < 2) {
            errors.add("training.sampleSize must be >= 2");
        }
        if (minHistory < 2) {
            errors.add("training.minHistory must be >= 2");
        }
    }

    public int getTrees() {
        return trees;
    }

    public void setTrees(int trees) {
        this.trees = trees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public int getMinHistory() {
        return minHistory;
    }

    public void setMinHistory(int minHistory) {
        this.minHistory = minHistory;
    }

    @Override
    public String toString() {
        return "TrainingSettings{trees=" + trees + ", sampleSize=" + sampleSize
                + ", seed=" + seed + ", minHistory=" + minHistory + '}';
    }
}
