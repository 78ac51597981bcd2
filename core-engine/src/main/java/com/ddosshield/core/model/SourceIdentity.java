package com.ddosshield.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The network entity mitigation decisions are scoped to.
 *
 * <p>
 * An identity is a source IP address optionally narrowed by transport
 * protocol and source port. Its canonical string form ({@link #key()}) is
 * used as the Flink key, the JSON representation and the log label:
 * </p>
 *
 * <pre>
 *   203.0.113.7
 *   203.0.113.7/UDP
 *   203.0.113.7:53/UDP
 *   [2001:db8:0:0:0:0:0:1]:443/TCP
 * </pre>
 *
 * <p>
 * Addresses must be IP literals. No name resolution is ever attempted.
 * </p>
 *
 * @since 1.0.0
 */
public final class SourceIdentity implements Serializable, Comparable<SourceIdentity> {

    private static final long serialVersionUID = 1L;

    private static final Pattern IPV4 = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
    private static final Pattern IPV6_CHARS = Pattern.compile("\\A[0-9a-fA-F:.]+\\z");

    private static final Comparator<SourceIdentity> ORDER = Comparator.comparing(SourceIdentity::key);

    private final String address;
    private final Integer port;
    private final Protocol protocol;
    private final String key;

    private SourceIdentity(String address, Integer port, Protocol protocol) {
        this.address = normalizeAddress(address);
        if (port != null && (port < 0 || port > 65_535)) {
            throw new IllegalArgumentException("Port must be in [0, 65535], got: " + port);
        }
        if (port != null && protocol == null) {
            throw new IllegalArgumentException("A port-scoped identity also requires a protocol");
        }
        this.port = port;
        this.protocol = protocol;
        this.key = buildKey();
    }

    /**
     * @param address IP literal
     * @return address-only identity
     * @throws IllegalArgumentException if {@code address} is not an IP literal
     */
    public static SourceIdentity of(String address) {
        return new SourceIdentity(address, null, null);
    }

    /**
     * @param address  IP literal
     * @param protocol transport protocol; may be {@code null}
     * @param port     source port; may be {@code null}, requires a protocol
     * @return identity
     * @throws IllegalArgumentException if any part is invalid
     */
    public static SourceIdentity of(String address, Protocol protocol, Integer port) {
        return new SourceIdentity(address, port, protocol);
    }

    /**
     * Parse the canonical form produced by {@link #key()}.
     *
     * @param key canonical identity string
     * @return identity
     * @throws IllegalArgumentException if the string is not a valid identity
     */
    @JsonCreator
    public static SourceIdentity parse(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Source identity must not be blank");
        }
        String rest = key.trim();
        Protocol protocol = null;
        int slash = rest.lastIndexOf('/');
        if (slash >= 0) {
            protocol = Protocol.fromString(rest.substring(slash + 1));
            rest = rest.substring(0, slash);
        }

        String address = rest;
        Integer port = null;
        if (rest.startsWith("[")) {
            int close = rest.indexOf(']');
            if (close < 0 || close + 2 > rest.length() || rest.charAt(close + 1) != ':') {
                throw new IllegalArgumentException("Bracketed IPv6 identity must carry a port: " + key);
            }
            address = rest.substring(1, close);
            port = parsePort(rest.substring(close + 2), key);
        } else if (rest.indexOf(':') > 0 && rest.indexOf(':') == rest.lastIndexOf(':')) {
            int colon = rest.indexOf(':');
            address = rest.substring(0, colon);
            port = parsePort(rest.substring(colon + 1), key);
        }
        return new SourceIdentity(address, port, protocol);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getAddress() {
        return address;
    }

    public Integer getPort() {
        return port;
    }

    public Protocol getProtocol() {
        return protocol;
    }

    /**
     * @return canonical string form
     */
    @JsonValue
    public String key() {
        return key;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private String buildKey() {
        StringBuilder sb = new StringBuilder();
        boolean v6 = address.indexOf(':') >= 0;
        if (port != null) {
            sb.append(v6 ? "[" + address + "]" : address).append(':').append(port);
        } else {
            sb.append(address);
        }
        if (protocol != null) {
            sb.append('/').append(protocol.name());
        }
        return sb.toString();
    }

    private static Integer parsePort(String value, String key) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in source identity: " + key, e);
        }
    }

    static String normalizeAddress(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Source address must not be blank");
        }
        String trimmed = address.trim();
        if (IPV4.matcher(trimmed).matches()) {
            for (String octet : trimmed.split("\\.")) {
                if (Integer.parseInt(octet) > 255) {
                    throw new IllegalArgumentException("IPv4 octet out of range in: " + address);
                }
            }
            return trimmed;
        }
        if (trimmed.indexOf(':') >= 0 && IPV6_CHARS.matcher(trimmed).matches()) {
            try {
                InetAddress parsed = InetAddress.getByName(trimmed);
                if (parsed instanceof Inet6Address) {
                    return parsed.getHostAddress().toLowerCase(Locale.ROOT);
                }
                // IPv4-mapped literals come back as Inet4Address
                return parsed.getHostAddress();
            } catch (UnknownHostException e) {
                throw new IllegalArgumentException("Invalid IPv6 literal: " + address, e);
            }
        }
        throw new IllegalArgumentException("Source address is not an IP literal: " + address);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public int compareTo(SourceIdentity other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SourceIdentity that))
            return false;
        return key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key);
    }

    @Override
    public String toString() {
        return key;
    }
}
