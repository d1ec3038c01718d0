package com.sensorsentinel.core.error;

/**
 * Building a model artifact from trend history failed.
 */
public class ModelBuildException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public ModelBuildException(String monitorId, String message) {
        super(monitorId, message);
    }

    public ModelBuildException(String monitorId, String message, Throwable cause) {
        super(monitorId, message, cause);
    }
}
