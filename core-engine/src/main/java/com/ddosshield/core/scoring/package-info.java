/**
 * Model registry and score fusion.
 *
 * <p>
 * Models implement {@link com.ddosshield.core.scoring.ScoringModel} and are
 * built from configuration by
 * {@link com.ddosshield.core.scoring.ModelFactory}.
 * {@link com.ddosshield.core.scoring.EnsembleScorer} fans a vector out to
 * all of them and fuses the partial results.
 * </p>
 *
 * @since 1.0.0
 */
package com.ddosshield.core.scoring;
