package com.ddosshield.core.model;

import java.util.List;

/**
 * Names of the features the aggregator derives for every window, in the
 * order they appear in a {@link FeatureVector}.
 */
public final class FeatureNames {

    public static final String PACKET_RATE = "packet_rate";
    public static final String BYTE_RATE = "byte_rate";
    public static final String FLOW_RATE = "flow_rate";
    public static final String PACKET_SIZE_AVG = "packet_size_avg";
    public static final String PACKET_SIZE_STD = "packet_size_std";
    public static final String INTER_ARRIVAL_TIME = "inter_arrival_time";
    public static final String FLOW_DURATION_AVG = "flow_duration_avg";
    public static final String PROTOCOL_TCP = "protocol_tcp";
    public static final String PROTOCOL_UDP = "protocol_udp";
    public static final String PROTOCOL_ICMP = "protocol_icmp";
    public static final String SRC_PORT_ENTROPY = "src_port_entropy";
    public static final String DST_PORT_ENTROPY = "dst_port_entropy";
    public static final String FLAG_SYN = "flag_syn";
    public static final String FLAG_ACK = "flag_ack";
    public static final String FLAG_FIN = "flag_fin";
    public static final String FLAG_RST = "flag_rst";

    public static final List<String> ALL = List.of(
            PACKET_RATE, BYTE_RATE, FLOW_RATE,
            PACKET_SIZE_AVG, PACKET_SIZE_STD,
            INTER_ARRIVAL_TIME, FLOW_DURATION_AVG,
            PROTOCOL_TCP, PROTOCOL_UDP, PROTOCOL_ICMP,
            SRC_PORT_ENTROPY, DST_PORT_ENTROPY,
            FLAG_SYN, FLAG_ACK, FLAG_FIN, FLAG_RST);

    private FeatureNames() {
        // constants only
    }
}
