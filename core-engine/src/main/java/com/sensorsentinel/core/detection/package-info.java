/**
 * Per-window scoring steps (preprocessing, prediction) and the hysteresis
 * anomaly decision.
 */
package com.sensorsentinel.core.detection;
