package com.sensorsentinel.core.error;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A window summary does not carry the sensors the model artifact was built on.
 *
 * <p>
 * Reported per summary; it never triggers a rebuild of the artifact.
 * </p>
 */
public class SchemaMismatchException extends PipelineException {

    private static final long serialVersionUID = 1L;

    private final List<String> expected;
    private final List<String> actual;

    public SchemaMismatchException(String monitorId, Collection<String> expected, Collection<String> actual) {
        super(monitorId, "Feature schema mismatch for monitor " + monitorId
                + ": expected " + expected + " but window has " + actual);
        this.expected = new ArrayList<>(expected);
        this.actual = new ArrayList<>(actual);
    }

    public List<String> getExpected() {
        return List.copyOf(expected);
    }

    public List<String> getActual() {
        return List.copyOf(actual);
    }
}
