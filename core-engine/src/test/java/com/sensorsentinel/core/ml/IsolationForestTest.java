package com.sensorsentinel.core.ml;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link IsolationForest}.
 */
class IsolationForestTest {

    private static double[][] training;

    @BeforeAll
    static void generateTrainingData() {
        Random random = new Random(7);
        training = new double[500][];
        for (int i = 0; i < training.length; i++) {
            training[i] = new double[] { random.nextGaussian(), random.nextGaussian() };
        }
    }

    @Test
    @DisplayName("Should score outliers higher than inliers")
    void shouldSeparateOutliers() {
        IsolationForest forest = IsolationForest.train(training, 100, 256, 42L);

        double inlier = forest.score(new double[] { 0.0, 0.0 });
        double outlier = forest.score(new double[] { 8.0, -8.0 });

        assertThat(outlier).isGreaterThan(0.6);
        assertThat(inlier).isLessThan(0.5);
        assertThat(outlier).isGreaterThan(inlier);
    }

    @Test
    @DisplayName("Should keep scores within the unit interval")
    void shouldBoundScores() {
        IsolationForest forest = IsolationForest.train(training, 50, 128, 1L);

        for (double[] row : training) {
            assertThat(forest.score(row)).isBetween(0.0, 1.0);
        }
    }

    @Test
    @DisplayName("Should grow identical forests from the same seed")
    void shouldBeReproducible() {
        IsolationForest first = IsolationForest.train(training, 30, 64, 99L);
        IsolationForest second = IsolationForest.train(training, 30, 64, 99L);

        double[] point = { 1.5, -0.3 };
        assertThat(first.score(point)).isEqualTo(second.score(point));
    }

    @Test
    @DisplayName("Should cap the sub-sample size at the number of rows")
    void shouldCapSampleSize() {
        double[][] small = { { 1.0 }, { 2.0 }, { 3.0 }, { 4.0 } };

        IsolationForest forest = IsolationForest.train(small, 10, 256, 3L);

        assertThat(forest.getSampleSize()).isEqualTo(4);
        assertThat(forest.getTrees()).hasSize(10);
    }
}
