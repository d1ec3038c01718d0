/**
 * Runtime-neutral pipeline metrics.
 */
package com.sensorsentinel.core.metrics;
