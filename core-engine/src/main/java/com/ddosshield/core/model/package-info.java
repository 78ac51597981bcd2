/**
 * Domain model of the mitigation engine.
 *
 * <p>
 * Data flows through these types in order:
 * </p>
 * <ul>
 * <li>{@link com.ddosshield.core.model.FlowEvent} - raw flow observation</li>
 * <li>{@link com.ddosshield.core.model.FeatureVector} - one closed aggregation
 * window</li>
 * <li>{@link com.ddosshield.core.model.ModelScore} /
 * {@link com.ddosshield.core.model.FusedVerdict} - ensemble output</li>
 * <li>{@link com.ddosshield.core.model.SourceState} - per-source lifecycle</li>
 * <li>{@link com.ddosshield.core.model.MitigationAction} /
 * {@link com.ddosshield.core.model.AlertEvent} - outbound events</li>
 * </ul>
 *
 * <p>
 * All of them are immutable once built.
 * </p>
 *
 * @since 1.0.0
 */
package com.ddosshield.core.model;
