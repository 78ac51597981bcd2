/**
 * Hysteresis-based mitigation decisions and the timers that end blocks and
 * probation.
 *
 * @since 1.0.0
 */
package com.ddosshield.core.mitigation;
