package com.sensorsentinel.core.cache;

import com.sensorsentinel.core.error.StorageException;

import java.util.Optional;

/**
 * Durable key-value store of encoded model artifacts, one per monitor.
 *
 * <p>
 * Implementations may block on I/O; the cache only calls them from its I/O
 * executor and bounds every call with a timeout.
 * </p>
 */
public interface ModelStore {

    /**
     * @return the stored bytes, or empty if nothing is stored for the monitor
     * @throws StorageException on I/O failure
     */
    Optional<byte[]> get(String monitorId);

    /**
     * Store (or replace) the artifact of a monitor.
     *
     * @throws StorageException on I/O failure
     */
    void put(String monitorId, byte[] artifact);
}
