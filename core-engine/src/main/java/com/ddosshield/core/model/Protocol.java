package com.ddosshield.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Transport protocol of a flow.
 *
 * <p>
 * Parsing is lenient: names are case-insensitive and the IANA protocol
 * numbers {@code 6}, {@code 17} and {@code 1} are accepted. Anything else
 * maps to {@link #OTHER}.
 * </p>
 */
public enum Protocol {
    TCP,
    UDP,
    ICMP,
    OTHER;

    /**
     * @param value protocol name or number; may be {@code null}
     * @return the matching protocol, or {@code null} if {@code value} is blank
     */
    @JsonCreator
    public static Protocol fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "TCP", "6" -> TCP;
            case "UDP", "17" -> UDP;
            case "ICMP", "ICMPV6", "1", "58" -> ICMP;
            default -> OTHER;
        };
    }
}
