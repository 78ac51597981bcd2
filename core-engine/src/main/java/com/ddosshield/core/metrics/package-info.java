/**
 * Vendor-neutral metrics port and its in-memory implementation.
 *
 * @since 1.0.0
 */
package com.ddosshield.core.metrics;
