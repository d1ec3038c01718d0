package com.sensorsentinel.core.error;

/**
 * A reading failed parsing or validation and was rejected.
 */
public class ValidationException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String monitorId, String message) {
        super(monitorId, message);
    }

    public ValidationException(String monitorId, String message, Throwable cause) {
        super(monitorId, message, cause);
    }
}
