package com.ddosshield.core.model;

/**
 * Coarse attack family inferred from a window's protocol and flag mix.
 */
public enum AttackType {
    SYN_FLOOD("SYN flood"),
    UDP_FLOOD("UDP flood"),
    ICMP_FLOOD("ICMP flood"),
    CONNECTION_FLOOD("TCP connection flood"),
    VOLUMETRIC("Volumetric flood"),
    UNKNOWN("Unclassified");

    private final String label;

    AttackType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
