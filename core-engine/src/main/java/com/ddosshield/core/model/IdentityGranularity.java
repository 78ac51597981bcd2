package com.ddosshield.core.model;

import java.util.Locale;

/**
 * How much of a flow's source tuple forms the mitigation key.
 *
 * <ul>
 * <li>{@code address} - source IP only (default)</li>
 * <li>{@code address_protocol} - source IP and transport protocol</li>
 * <li>{@code address_port_protocol} - source IP, source port and protocol</li>
 * </ul>
 */
public enum IdentityGranularity {
    ADDRESS,
    ADDRESS_PROTOCOL,
    ADDRESS_PORT_PROTOCOL;

    /**
     * @param value configuration value, case-insensitive, {@code -} or
     *              {@code _} separated
     * @return parsed granularity
     * @throws IllegalArgumentException if the value is unknown
     */
    public static IdentityGranularity fromString(String value) {
        if (value == null || value.isBlank()) {
            return ADDRESS;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return IdentityGranularity.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown identity granularity: '" + value
                    + "'. Supported: address, address_protocol, address_port_protocol", e);
        }
    }
}
