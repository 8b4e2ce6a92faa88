package org.harmar.kv;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Startup settings of the server. Read once from {@code harmar-kv.properties} on the classpath,
 * with JVM system properties of the same name taking precedence.
 */
public final class ServerConfig {
    public static final String RESOURCE = "harmar-kv.properties";

    static final String PREFIX = "harmar.kv.";
    static final String HOST = PREFIX + "host";
    static final String PORT = PREFIX + "port";
    static final String MAX_CONNECTIONS_PER_ADDRESS = PREFIX + "maxConnectionsPerAddress";
    static final String MAX_CONNECTIONS = PREFIX + "maxConnections";
    static final String WORKER_THREADS = PREFIX + "workerThreads";
    static final String MAX_FRAME_LENGTH = PREFIX + "maxFrameLength";

    public static final String DEFAULT_HOST = "::1";
    public static final int DEFAULT_PORT = 8899;
    public static final int DEFAULT_MAX_CONNECTIONS_PER_ADDRESS = 1;
    public static final int DEFAULT_MAX_CONNECTIONS = 10;
    public static final int DEFAULT_MAX_FRAME_LENGTH = 1024 * 1024;

    private final String host;
    private final int port;
    private final int maxConnectionsPerAddress;
    private final int maxConnections;
    // 0 -> netty default (2 * cores)
    private final int workerThreads;
    private final int maxFrameLength;

    public ServerConfig(String host, int port, int maxConnectionsPerAddress, int maxConnections,
                        int workerThreads, int maxFrameLength) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException(HOST + " must not be blank");
        }
        this.host = host;
        this.port = requireRange(PORT, port, 0, 65535);
        this.maxConnectionsPerAddress = requireRange(MAX_CONNECTIONS_PER_ADDRESS, maxConnectionsPerAddress, 1, Integer.MAX_VALUE);
        this.maxConnections = requireRange(MAX_CONNECTIONS, maxConnections, 1, Integer.MAX_VALUE);
        this.workerThreads = requireRange(WORKER_THREADS, workerThreads, 0, Integer.MAX_VALUE);
        this.maxFrameLength = requireRange(MAX_FRAME_LENGTH, maxFrameLength, 1, Integer.MAX_VALUE);
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_MAX_CONNECTIONS_PER_ADDRESS,
                DEFAULT_MAX_CONNECTIONS, 0, DEFAULT_MAX_FRAME_LENGTH);
    }

    /**
     * classpath resource first, then system properties
     */
    public static ServerConfig load() {
        Properties properties = new Properties();
        try (InputStream in = ServerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, e);
        }

        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(properties);
    }

    public static ServerConfig fromProperties(Properties properties) {
        return new ServerConfig(
                properties.getProperty(HOST, DEFAULT_HOST).trim(),
                intValue(properties, PORT, DEFAULT_PORT),
                intValue(properties, MAX_CONNECTIONS_PER_ADDRESS, DEFAULT_MAX_CONNECTIONS_PER_ADDRESS),
                intValue(properties, MAX_CONNECTIONS, DEFAULT_MAX_CONNECTIONS),
                intValue(properties, WORKER_THREADS, 0),
                intValue(properties, MAX_FRAME_LENGTH, DEFAULT_MAX_FRAME_LENGTH));
    }

    private static int intValue(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Value '%s' for %s is not an integer", value, key), e);
        }
    }

    private static int requireRange(String key, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(String.format("%s: %d (expected: %d..%d)", key, value, min, max));
        }
        return value;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public int getMaxConnectionsPerAddress() {
        return maxConnectionsPerAddress;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public int getMaxFrameLength() {
        return maxFrameLength;
    }

    @Override
    public String toString() {
        return "ServerConfig{host=" + host + ", port=" + port
                + ", maxConnectionsPerAddress=" + maxConnectionsPerAddress
                + ", maxConnections=" + maxConnections
                + ", workerThreads=" + workerThreads
                + ", maxFrameLength=" + maxFrameLength + "}";
    }
}
