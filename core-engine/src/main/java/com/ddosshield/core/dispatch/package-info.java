/**
 * Outbound delivery of mitigation actions and alerts with bounded retry.
 *
 * <p>
 * {@link com.ddosshield.core.dispatch.EventDispatcher} routes actions to an
 * {@link com.ddosshield.core.dispatch.EnforcementGateway} and alerts to an
 * {@link com.ddosshield.core.dispatch.AlertChannel}.
 * </p>
 */
package com.ddosshield.core.dispatch;
