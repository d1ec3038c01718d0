package com.sensorsentinel.core.support;

import com.sensorsentinel.core.model.WindowSummary;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Window summary fixtures.
 */
public final class Summaries {

    private Summaries() {
    }

    /** Summary ending at {@code T0 + endSeconds} whose sensors have the given means. */
    public static WindowSummary withMeans(String monitorId, long endSeconds, Map<String, Double> means) {
        TreeMap<String, Double> sorted = new TreeMap<>(means);
        List<String> names = new ArrayList<>(sorted.keySet());
        double[] values = new double[names.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = sorted.get(names.get(i));
        }
        long end = Readings.T0.plusSeconds(endSeconds).toEpochMilli();
        return new WindowSummary(monitorId, end - 60_000L, end, 10, names,
                values, new double[values.length], values, values, values);
    }
}
