/**
 * Windowed feature extraction.
 *
 * <p>
 * {@link com.ddosshield.core.aggregation.FeatureAggregator} folds raw flow
 * events into per-identity windows and emits one
 * {@link com.ddosshield.core.model.FeatureVector} per closed window.
 * </p>
 */
package com.ddosshield.core.aggregation;
