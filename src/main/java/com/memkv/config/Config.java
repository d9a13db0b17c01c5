package com.memkv.config;

import java.net.InetSocketAddress;

public class Config {
    public static final String DEFAULT_ADDRESS = "127.0.0.1:9090";
    public static final int DEFAULT_COMPACTION_THRESHOLD = 1024;
    // 32-bit unsigned maximum
    public static final long MAX_VALUE_LENGTH = 0xFFFFFFFFL;

    private final String host;
    private final int port;
    private final int maxConnections;
    private final int compactionThreshold;
    private final long maxValueLength;

    public Config(String host, int port, int maxConnections, int compactionThreshold, long maxValueLength) {
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("host cannot be empty");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        if (maxConnections < 0) {
            throw new IllegalArgumentException("maxConnections cannot be negative: " + maxConnections);
        }
        if (compactionThreshold <= 0) {
            throw new IllegalArgumentException("compactionThreshold must be positive: " + compactionThreshold);
        }
        if (maxValueLength < 0 || maxValueLength > MAX_VALUE_LENGTH) {
            throw new IllegalArgumentException("maxValueLength out of range: " + maxValueLength);
        }
        this.host = host;
        this.port = port;
        this.maxConnections = maxConnections;
        this.compactionThreshold = compactionThreshold;
        this.maxValueLength = maxValueLength;
    }

    public static Config of(String address, int maxConnections) {
        InetSocketAddress parsed = parseAddress(address);
        return new Config(parsed.getHostString(), parsed.getPort(), maxConnections,
                DEFAULT_COMPACTION_THRESHOLD, MAX_VALUE_LENGTH);
    }

    public static InetSocketAddress parseAddress(String address) {
        if (address == null) {
            throw new IllegalArgumentException("Address is missing");
        }
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new IllegalArgumentException("Address must be host:port, got '" + address + "'");
        }
        String host = address.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(address.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in address '" + address + "'", e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range in address '" + address + "'");
        }
        return InetSocketAddress.createUnresolved(host, port);
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getAddress() {
        return host + ":" + port;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public int getCompactionThreshold() {
        return compactionThreshold;
    }

    public long getMaxValueLength() {
        return maxValueLength;
    }
}
