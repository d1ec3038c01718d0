package com.sensorsentinel.core.ml;

import com.sensorsentinel.core.error.StorageException;
import com.sensorsentinel.core.model.ModelArtifact;

/**
 * Converts model artifacts to and from the opaque bytes kept in a model store.
 */
public interface ArtifactCodec {

    byte[] encode(ModelArtifact artifact);

    /**
     * @param monitorId monitor the bytes were fetched for, used in errors
     * @param bytes     stored artifact
     * @throws StorageException if the bytes are not a readable artifact
     */
    ModelArtifact decode(String monitorId, byte[] bytes);
}
