/**
 * Error taxonomy of the mitigation engine.
 *
 * <p>
 * Every exception here is unchecked and contained at the pipeline stage that
 * raises it. Only configuration errors at startup are fatal, and those are
 * reported as {@link java.lang.IllegalStateException} /
 * {@link java.lang.IllegalArgumentException} by the config loader.
 * </p>
 *
 * @since 1.0.0
 */
package com.ddosshield.core.error;
