/**
 * Adapters to the outside world: JSON reading parsing, the S3 model store and
 * the HTTP trend history client.
 */
package com.sensorsentinel.core.io;
