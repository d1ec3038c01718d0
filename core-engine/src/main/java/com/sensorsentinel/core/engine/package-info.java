/**
 * Embedded inference engine: per-monitor serial lanes driving window,
 * scoring, decision and emission.
 */
package com.sensorsentinel.core.engine;
