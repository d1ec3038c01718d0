package com.sensorsentinel.core.cache;

import com.sensorsentinel.core.error.StorageException;
import com.sensorsentinel.core.model.Reading;

import java.util.List;

/**
 * Supplies historical readings used to rebuild a monitor's model.
 */
@FunctionalInterface
public interface TrendHistorySource {

    /**
     * @param monitorId monitor whose history is requested
     * @param limit     maximum number of readings to return
     * @throws StorageException if the history cannot be fetched
     */
    List<Reading> fetchHistory(String monitorId, int limit);
}
