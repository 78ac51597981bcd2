package com.ddosshield.core.explain;

import com.ddosshield.core.model.AttackType;
import com.ddosshield.core.model.FeatureNames;
import com.ddosshield.core.model.FeatureVector;

/**
 * Infers the attack family of a flagged window from its protocol and flag
 * mix. Rules are checked in order and the first match wins.
 *
 * <ol>
 * <li>SYN flood: mostly TCP, most flows carry SYN, few carry ACK</li>
 * <li>UDP flood: mostly UDP</li>
 * <li>ICMP flood: at least half ICMP</li>
 * <li>TCP connection flood: mostly TCP at a high flow rate</li>
 * <li>Volumetric: very high byte rate regardless of protocol</li>
 * </ol>
 */
public final class AttackClassifier {

    static final double SYN_RATIO = 0.6;
    static final double MAX_ACK_RATIO = 0.3;
    static final double TCP_RATIO = 0.5;
    static final double UDP_RATIO = 0.6;
    static final double ICMP_RATIO = 0.5;
    static final double CONNECTION_TCP_RATIO = 0.6;
    static final double CONNECTION_FLOW_RATE = 100.0;
    static final double VOLUMETRIC_BYTE_RATE = 10_000_000.0;

    private AttackClassifier() {
    }

    public static AttackType classify(FeatureVector vector) {
        double tcp = vector.valueOr(FeatureNames.PROTOCOL_TCP, 0.0);
        double udp = vector.valueOr(FeatureNames.PROTOCOL_UDP, 0.0);
        double icmp = vector.valueOr(FeatureNames.PROTOCOL_ICMP, 0.0);
        double syn = vector.valueOr(FeatureNames.FLAG_SYN, 0.0);
        double ack = vector.valueOr(FeatureNames.FLAG_ACK, 0.0);

        if (tcp >= TCP_RATIO && syn >= SYN_RATIO && ack <= MAX_ACK_RATIO) {
            return AttackType.SYN_FLOOD;
        }
        if (udp >= UDP_RATIO) {
            return AttackType.UDP_FLOOD;
        }
        if (icmp >= ICMP_RATIO) {
            return AttackType.ICMP_FLOOD;
        }
        if (tcp >= CONNECTION_TCP_RATIO
                && vector.valueOr(FeatureNames.FLOW_RATE, 0.0) >= CONNECTION_FLOW_RATE) {
            return AttackType.CONNECTION_FLOOD;
        }
        if (vector.valueOr(FeatureNames.BYTE_RATE, 0.0) >= VOLUMETRIC_BYTE_RATE) {
            return AttackType.VOLUMETRIC;
        }
        return AttackType.UNKNOWN;
    }
}
