package com.sensorsentinel.core.emit;

import com.sensorsentinel.core.error.TransportException;
import com.sensorsentinel.core.model.Alert;

import java.util.concurrent.CompletionStage;

/**
 * Downstream channel for alerts.
 */
@FunctionalInterface
public interface AlertPublisher {

    /**
     * Hand one alert to the channel without waiting for it to be delivered.
     *
     * @return completes when the channel acknowledged the alert; fails with a
     *         {@link TransportException} if the channel rejected or lost it
     */
    CompletionStage<Void> publish(Alert alert);
}
