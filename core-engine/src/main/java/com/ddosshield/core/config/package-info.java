/**
 * Configuration loading and validation for the mitigation engine.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.ddosshield.core.config.ShieldConfigLoader} into a
 * {@link com.ddosshield.core.config.ShieldConfig} instance. Validation runs
 * right after parsing so invalid thresholds fail at startup.
 * </p>
 *
 * @since 1.0.0
 */
package com.ddosshield.core.config;
