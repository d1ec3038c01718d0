/**
 * Apache Flink streaming job for Sensor Sentinel.
 *
 * <p>
 * This package wires the core inference engine into a Flink pipeline that
 * consumes sensor readings from Kafka, windows and scores them per monitor,
 * and publishes anomaly alerts back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.sensorsentinel.flink.SensorSentinelJob} - main entry
 * point</li>
 * <li>{@link com.sensorsentinel.flink.WindowingFunction} and
 * {@link com.sensorsentinel.flink.VerdictFunction} - keyed process
 * functions</li>
 * <li>{@link com.sensorsentinel.flink.ModelScoringFunction} - async model
 * resolution and scoring</li>
 * <li>{@link com.sensorsentinel.flink.JobConfig} - environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.sensorsentinel.flink;
