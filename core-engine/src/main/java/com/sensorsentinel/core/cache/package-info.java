/**
 * Bounded, coalescing per-monitor model cache and the store, builder and
 * history seams it resolves through.
 */
package com.sensorsentinel.core.cache;
