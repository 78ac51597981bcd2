package com.ddosshield.core.model;

import com.ddosshield.core.error.MalformedEventException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One already-extracted flow observation for a single source.
 *
 * <p>
 * Produced externally (flow exporter, sensor) and consumed exactly once by
 * the feature aggregator. Instances are immutable. Construction never fails
 * so that malformed input can still be represented; call {@link #validate()}
 * before trusting the contents.
 * </p>
 *
 * <h3>JSON</h3>
 *
 * <pre>
 * {"sourceAddress":"203.0.113.7","sourcePort":51515,"destinationPort":80,
 *  "protocol":"tcp","timestamp":"2024-05-01T10:00:00Z",
 *  "bytes":1200,"packets":20,"flags":["SYN"],"durationMillis":40}
 * </pre>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = FlowEvent.Builder.class)
public final class FlowEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sourceAddress;
    private final Integer sourcePort;
    private final Integer destinationPort;
    private final Protocol protocol;
    private final Instant timestamp;
    private final long bytes;
    private final long packets;
    private final Set<TcpFlag> flags;
    private final long durationMillis;

    private FlowEvent(Builder builder) {
        this.sourceAddress = builder.sourceAddress;
        this.sourcePort = builder.sourcePort;
        this.destinationPort = builder.destinationPort;
        this.protocol = builder.protocol != null ? builder.protocol : Protocol.OTHER;
        this.timestamp = builder.timestamp;
        this.bytes = builder.bytes;
        this.packets = builder.packets;
        this.flags = builder.flags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.flags));
        this.durationMillis = builder.durationMillis;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check that the event carries a usable source identity and timestamp and
     * non-negative counters.
     *
     * @throws MalformedEventException listing every problem found
     */
    public void validate() {
        List<String> problems = new ArrayList<>();

        if (sourceAddress == null || sourceAddress.isBlank()) {
            problems.add("'sourceAddress' is required");
        } else {
            try {
                SourceIdentity.normalizeAddress(sourceAddress);
            } catch (IllegalArgumentException e) {
                problems.add(e.getMessage());
            }
        }
        if (timestamp == null) {
            problems.add("'timestamp' is required");
        } else if (timestamp.isBefore(Instant.EPOCH)) {
            problems.add("'timestamp' precedes the epoch: " + timestamp);
        }
        if (bytes < 0) {
            problems.add("'bytes' must be >= 0, got: " + bytes);
        }
        if (packets < 0) {
            problems.add("'packets' must be >= 0, got: " + packets);
        }
        if (durationMillis < 0) {
            problems.add("'durationMillis' must be >= 0, got: " + durationMillis);
        }
        checkPort("sourcePort", sourcePort, problems);
        checkPort("destinationPort", destinationPort, problems);

        if (!problems.isEmpty()) {
            throw new MalformedEventException(problems);
        }
    }

    /**
     * @return {@code true} if {@link #validate()} would pass
     */
    @JsonIgnore
    public boolean isValid() {
        try {
            validate();
            return true;
        } catch (MalformedEventException e) {
            return false;
        }
    }

    /**
     * Derive the mitigation key for this event.
     *
     * @param granularity how much of the source tuple to keep
     * @return source identity
     * @throws MalformedEventException if the address or port is unusable
     */
    public SourceIdentity identity(IdentityGranularity granularity) {
        Objects.requireNonNull(granularity, "granularity must not be null");
        try {
            return switch (granularity) {
                case ADDRESS -> SourceIdentity.of(sourceAddress);
                case ADDRESS_PROTOCOL -> SourceIdentity.of(sourceAddress, protocol, null);
                case ADDRESS_PORT_PROTOCOL -> SourceIdentity.of(sourceAddress, protocol, sourcePort);
            };
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException(e.getMessage(), e);
        }
    }

    private static void checkPort(String name, Integer port, List<String> problems) {
        if (port != null && (port < 0 || port > 65_535)) {
            problems.add("'" + name + "' must be in [0, 65535], got: " + port);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getSourceAddress() {
        return sourceAddress;
    }

    public Integer getSourcePort() {
        return sourcePort;
    }

    public Integer getDestinationPort() {
        return destinationPort;
    }

    public Protocol getProtocol() {
        return protocol;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getBytes() {
        return bytes;
    }

    public long getPackets() {
        return packets;
    }

    public Set<TcpFlag> getFlags() {
        return flags;
    }

    public boolean hasFlag(TcpFlag flag) {
        return flags.contains(flag);
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder, also used by Jackson for deserialization.
     */
    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String sourceAddress;
        private Integer sourcePort;
        private Integer destinationPort;
        private Protocol protocol;
        private Instant timestamp;
        private long bytes;
        private long packets;
        private final Set<TcpFlag> flags = EnumSet.noneOf(TcpFlag.class);
        private long durationMillis;

        public Builder sourceAddress(String sourceAddress) {
            this.sourceAddress = sourceAddress;
            return this;
        }

        public Builder sourcePort(Integer sourcePort) {
            this.sourcePort = sourcePort;
            return this;
        }

        public Builder destinationPort(Integer destinationPort) {
            this.destinationPort = destinationPort;
            return this;
        }

        public Builder protocol(Protocol protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder bytes(long bytes) {
            this.bytes = bytes;
            return this;
        }

        public Builder packets(long packets) {
            this.packets = packets;
            return this;
        }

        public Builder flags(Collection<TcpFlag> flags) {
            this.flags.clear();
            if (flags != null) {
                this.flags.addAll(flags);
            }
            return this;
        }

        public Builder flag(TcpFlag flag) {
            this.flags.add(Objects.requireNonNull(flag, "flag must not be null"));
            return this;
        }

        public Builder durationMillis(long durationMillis) {
            this.durationMillis = durationMillis;
            return this;
        }

        public FlowEvent build() {
            return new FlowEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FlowEvent that))
            return false;
        return bytes == that.bytes
                && packets == that.packets
                && durationMillis == that.durationMillis
                && Objects.equals(sourceAddress, that.sourceAddress)
                && Objects.equals(sourcePort, that.sourcePort)
                && Objects.equals(destinationPort, that.destinationPort)
                && protocol == that.protocol
                && Objects.equals(timestamp, that.timestamp)
                && flags.equals(that.flags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceAddress, sourcePort, destinationPort, protocol, timestamp,
                bytes, packets, flags, durationMillis);
    }

    @Override
    public String toString() {
        return "FlowEvent{" +
                "source='" + sourceAddress + '\'' +
                ", sourcePort=" + sourcePort +
                ", destinationPort=" + destinationPort +
                ", protocol=" + protocol +
                ", timestamp=" + timestamp +
                ", bytes=" + bytes +
                ", packets=" + packets +
                ", flags=" + flags +
                '}';
    }
}
