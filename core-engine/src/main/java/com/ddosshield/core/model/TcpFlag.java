package com.ddosshield.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * TCP control flags observed on a flow.
 */
public enum TcpFlag {
    SYN,
    ACK,
    FIN,
    RST,
    PSH,
    URG;

    @JsonCreator
    public static TcpFlag fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("TCP flag must not be null");
        }
        return TcpFlag.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
