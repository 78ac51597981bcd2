/**
 * Wiring and in-process hosting of the engine.
 *
 * <p>
 * {@link com.ddosshield.core.pipeline.ShieldEngine} assembles the decision
 * core from configuration.
 * {@link com.ddosshield.core.pipeline.MitigationPipeline} runs it as bounded,
 * identity-partitioned stages, and
 * {@link com.ddosshield.core.pipeline.SourceQueryService} exposes its state
 * read-only.
 * </p>
 *
 * @since 1.0.0
 */
package com.ddosshield.core.pipeline;
