package com.ddosshield.core.aggregation;

import com.ddosshield.core.model.FeatureNames;
import com.ddosshield.core.model.FeatureVector;
import com.ddosshield.core.model.FlowEvent;
import com.ddosshield.core.model.Protocol;
import com.ddosshield.core.model.SourceIdentity;
import com.ddosshield.core.model.TcpFlag;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running counters of one identity's open window.
 *
 * <p>
 * Not thread-safe; always accessed under the owning shard's lock.
 * </p>
 */
final class WindowAccumulator {

    /** Bucket that absorbs ports once {@code maxDistinctPorts} is reached. */
    static final int OVERFLOW_PORT = -1;

    private final SourceIdentity identity;
    private final Instant start;
    private final Instant end;
    private final int maxDistinctPorts;

    private long events;
    private long packets;
    private long bytes;
    private long durationMillis;

    // Welford running statistics of per-event average packet size
    private double sizeMean;
    private double sizeM2;

    private long tcp;
    private long udp;
    private long icmp;

    private long syn;
    private long ack;
    private long fin;
    private long rst;

    private long firstSeen = Long.MAX_VALUE;
    private long lastSeen = Long.MIN_VALUE;

    private final Map<Integer, Long> sourcePorts = new HashMap<>();
    private final Map<Integer, Long> destinationPorts = new HashMap<>();

    WindowAccumulator(SourceIdentity identity, Instant start, Instant end, int maxDistinctPorts) {
        this.identity = identity;
        this.start = start;
        this.end = end;
        this.maxDistinctPorts = maxDistinctPorts;
    }

    Instant start() {
        return start;
    }

    Instant end() {
        return end;
    }

    void add(FlowEvent event) {
        events++;
        packets += event.getPackets();
        bytes += event.getBytes();
        durationMillis += event.getDurationMillis();

        double size = event.getPackets() > 0
                ? (double) event.getBytes() / event.getPackets()
                : event.getBytes();
        double delta = size - sizeMean;
        sizeMean += delta / events;
        sizeM2 += delta * (size - sizeMean);

        Protocol protocol = event.getProtocol() != null ? event.getProtocol() : Protocol.OTHER;
        switch (protocol) {
            case TCP -> tcp++;
            case UDP -> udp++;
            case ICMP -> icmp++;
            default -> {
                // counted only in the event total
            }
        }

        if (event.hasFlag(TcpFlag.SYN))
            syn++;
        if (event.hasFlag(TcpFlag.ACK))
            ack++;
        if (event.hasFlag(TcpFlag.FIN))
            fin++;
        if (event.hasFlag(TcpFlag.RST))
            rst++;

        long ts = event.getTimestamp().toEpochMilli();
        firstSeen = Math.min(firstSeen, ts);
        lastSeen = Math.max(lastSeen, ts);

        countPort(sourcePorts, event.getSourcePort());
        countPort(destinationPorts, event.getDestinationPort());
    }

    private void countPort(Map<Integer, Long> ports, Integer port) {
        if (port == null) {
            return;
        }
        Integer bucket = ports.containsKey(port) || ports.size() < maxDistinctPorts ? port : OVERFLOW_PORT;
        ports.merge(bucket, 1L, Long::sum);
    }

    /**
     * Close the window and derive its features. Rates are per second of
     * window length, ratios are fractions of the window's flow events.
     */
    FeatureVector toVector() {
        double seconds = (end.toEpochMilli() - start.toEpochMilli()) / 1000.0;
        double n = events;

        Map<String, Double> f = new LinkedHashMap<>();
        f.put(FeatureNames.PACKET_RATE, packets / seconds);
        f.put(FeatureNames.BYTE_RATE, bytes / seconds);
        f.put(FeatureNames.FLOW_RATE, n / seconds);
        f.put(FeatureNames.PACKET_SIZE_AVG, packets > 0 ? (double) bytes / packets : 0.0);
        f.put(FeatureNames.PACKET_SIZE_STD, events > 1 ? Math.sqrt(sizeM2 / n) : 0.0);
        f.put(FeatureNames.INTER_ARRIVAL_TIME, events > 1
                ? (lastSeen - firstSeen) / 1000.0 / (n - 1)
                : seconds);
        f.put(FeatureNames.FLOW_DURATION_AVG, events > 0 ? durationMillis / 1000.0 / n : 0.0);
        f.put(FeatureNames.PROTOCOL_TCP, ratio(tcp));
        f.put(FeatureNames.PROTOCOL_UDP, ratio(udp));
        f.put(FeatureNames.PROTOCOL_ICMP, ratio(icmp));
        f.put(FeatureNames.SRC_PORT_ENTROPY, Entropy.shannon(sourcePorts.values()));
        f.put(FeatureNames.DST_PORT_ENTROPY, Entropy.shannon(destinationPorts.values()));
        f.put(FeatureNames.FLAG_SYN, ratio(syn));
        f.put(FeatureNames.FLAG_ACK, ratio(ack));
        f.put(FeatureNames.FLAG_FIN, ratio(fin));
        f.put(FeatureNames.FLAG_RST, ratio(rst));

        return new FeatureVector(identity, start, end, events, f);
    }

    private double ratio(long count) {
        return events > 0 ? (double) count / events : 0.0;
    }
}
