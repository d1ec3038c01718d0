/**
 * Per-monitor event-time sliding window.
 */
package com.sensorsentinel.core.window;
