/**
 * Exception hierarchy of the inference pipeline, rooted at
 * {@link com.sensorsentinel.core.error.PipelineException}.
 */
package com.sensorsentinel.core.error;
