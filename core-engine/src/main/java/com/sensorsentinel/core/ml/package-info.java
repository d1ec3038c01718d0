/**
 * Reference model implementation: robust scaling, isolation-forest scoring,
 * training from trend history and the JSON artifact format.
 */
package com.sensorsentinel.core.ml;
