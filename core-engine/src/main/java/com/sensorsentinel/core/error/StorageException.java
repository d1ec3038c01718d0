package com.sensorsentinel.core.error;

/**
 * Model store or trend history I/O failed, or a stored artifact could not be decoded.
 */
public class StorageException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public StorageException(String monitorId, String message) {
        super(monitorId, message);
    }

    public StorageException(String monitorId, String message, Throwable cause) {
        super(monitorId, message, cause);
    }
}
