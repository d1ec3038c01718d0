package com.sensorsentinel.core.error;

/**
 * Publishing an alert to the downstream channel failed.
 */
public class TransportException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public TransportException(String monitorId, String message) {
        super(monitorId, message);
    }

    public TransportException(String monitorId, String message, Throwable cause) {
        super(monitorId, message, cause);
    }
}
