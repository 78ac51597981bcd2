/**
 * Apache Flink deployment of the DDoS Shield engine.
 *
 * <p>
 * Consumes flow events from Kafka, runs aggregation, scoring and the
 * mitigation state machine per source identity, and publishes mitigation
 * actions and alerts back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.ddosshield.flink.ShieldJob}: main entry point</li>
 * <li>{@link com.ddosshield.flink.MitigationProcessFunction}: keyed process
 * function hosting the engine</li>
 * <li>{@link com.ddosshield.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.ddosshield.flink.HealthServer}: HTTP health and readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ddosshield.flink;
