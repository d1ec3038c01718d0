package com.sensorsentinel.core.cache;

import com.sensorsentinel.core.error.ModelBuildException;
import com.sensorsentinel.core.model.Reading;

import java.util.List;

/**
 * Produces a fresh encoded artifact for a monitor from its trend history.
 */
@FunctionalInterface
public interface ModelBuilder {

    /**
     * @param monitorId monitor to build for
     * @param history   recent historical readings of that monitor
     * @return the encoded artifact
     * @throws ModelBuildException if no usable artifact can be built
     */
    byte[] build(String monitorId, List<Reading> history);
}
