package com.sensorsentinel.core.error;

/**
 * Base type for every failure raised while moving a reading through the
 * inference pipeline.
 *
 * <p>
 * Unchecked; the engine decides per stage
 * whether a failure drops a single reading, degrades a verdict or is only
 * logged. Configuration problems are reported with
 * {@link IllegalStateException} / {@link IllegalArgumentException} instead.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Monitor the failure relates to; may be {@code null}. */
    private final String monitorId;

    public PipelineException(String monitorId, String message) {
        super(message);
        this.monitorId = monitorId;
    }

    public PipelineException(String monitorId, String message, Throwable cause) {
        super(message, cause);
        this.monitorId = monitorId;
    }

    public String getMonitorId() {
        return monitorId;
    }
}
