package com.sensorsentinel.core.ml;

import com.sensorsentinel.core.cache.ModelBuilder;
import com.sensorsentinel.core.config.TrainingSettings;
import com.sensorsentinel.core.error.ModelBuildException;
import com.sensorsentinel.core.model.ModelArtifact;
import com.sensorsentinel.core.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Trains a {@link RobustScaler} and an {@link IsolationForest} from a
 * monitor's trend history.
 *
 * <p>
 * The feature set is every sensor seen in the history (restricted to the
 * configured whitelist, if any). Gaps in a record are filled with the
 * sensor's median over the history. Sensors that never carry a value are
 * dropped.
 * </p>
 */
public class IsolationForestModelBuilder implements ModelBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForestModelBuilder.class);

    private final TrainingSettings settings;
    private final Collection<String> sensorWhitelist;
    private final ArtifactCodec codec;
    private final Clock clock;

    public IsolationForestModelBuilder(TrainingSettings settings, Collection<String> sensorWhitelist,
            ArtifactCodec codec) {
        this(settings, sensorWhitelist, codec, Clock.systemUTC());
    }

    public IsolationForestModelBuilder(TrainingSettings settings, Collection<String> sensorWhitelist,
            ArtifactCodec codec, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.sensorWhitelist = sensorWhitelist != null ? new TreeSet<>(sensorWhitelist) : new TreeSet<>();
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public byte[] build(String monitorId, List<Reading> history) {
        if (history == null || history.isEmpty()) {
            throw new ModelBuildException(monitorId, "No trend history available");
        }

        List<Reading> usable = new ArrayList<>();
        TreeSet<String> features = new TreeSet<>();
        for (Reading r : history) {
            Reading projected = r.project(sensorWhitelist);
            if (!projected.getSensors().isEmpty()) {
                usable.add(projected);
                features.addAll(projected.getSensors().keySet());
            }
        }
        if (usable.size() < settings.getMinHistory()) {
            throw new ModelBuildException(monitorId, "Insufficient trend history: " + usable.size()
                    + " usable record(s), need " + settings.getMinHistory());
        }

        List<String> featureNames = new ArrayList<>(features);
        double[][] rows = toMatrix(usable, featureNames);
        RobustScaler scaler = RobustScaler.fit(rows);
        double[][] scaled = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            scaled[i] = scaler.transform(rows[i]);
        }
        IsolationForest forest = IsolationForest.train(scaled, settings.getTrees(),
                settings.getSampleSize(), settings.getSeed());

        ModelArtifact artifact = ModelArtifact.builder()
                .monitorId(monitorId)
                .builtAt(clock.instant())
                .featureNames(featureNames)
                .scaler(scaler)
                .model(forest)
                .trainingSamples(rows.length)
                .build();
        LOG.info("Trained model: monitor={} version={} samples={} features={}",
                monitorId, artifact.getVersion(), rows.length, featureNames);
        return codec.encode(artifact);
    }

    private static double[][] toMatrix(List<Reading> readings, List<String> featureNames) {
        int dims = featureNames.size();
        double[][] rows = new double[readings.size()][dims];
        double[] medians = new double[dims];
        for (int j = 0; j < dims; j++) {
            String name = featureNames.get(j);
            double[] present = readings.stream()
                    .map(Reading::getSensors)
                    .filter(m -> m.containsKey(name))
                    .mapToDouble(m -> m.get(name))
                    .sorted()
                    .toArray();
            medians[j] = RobustScaler.percentile(present, 50);
        }
        for (int i = 0; i < readings.size(); i++) {
            Map<String, Double> sensors = readings.get(i).getSensors();
            for (int j = 0; j < dims; j++) {
                Double v = sensors.get(featureNames.get(j));
                rows[i][j] = v != null ? v : medians[j];
            }
        }
        return rows;
    }

    @Override
    public String toString() {
        return "IsolationForestModelBuilder{settings=" + settings + ", sensors="
                + Arrays.toString(sensorWhitelist.toArray()) + '}';
    }
}
