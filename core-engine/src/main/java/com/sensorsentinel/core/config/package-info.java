/**
 * YAML-backed engine configuration: windowing, model cache, detection,
 * publishing and training sections, loaded by
 * {@link com.sensorsentinel.core.config.EngineConfigLoader}.
 */
package com.sensorsentinel.core.config;
