/**
 * Value types flowing through the inference pipeline: readings, window
 * summaries, model artifacts, verdicts and alerts.
 */
package com.sensorsentinel.core.model;
