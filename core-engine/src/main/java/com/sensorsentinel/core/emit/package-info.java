/**
 * Alert publishing with bounded retries.
 */
package com.sensorsentinel.core.emit;
