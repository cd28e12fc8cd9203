package com.lansync.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Every tunable of the sync layer, with LAN-friendly defaults.
 *
 * Immutable; create through {@link #builder()} or load from JSON. In JSON, missing keys keep
 * their default and unknown keys are ignored:
 * {
 *     "gamePort": 6000,
 *     "bufferDelayMillis": 100
 * }
 *
 * The extrapolation factor cap and the prediction move cap are empirical values. They are
 * tunables, not derived constants.
 */
@JsonDeserialize(builder = SyncConfig.Builder.class)
public final class SyncConfig {

    private static final Logger logger = LoggerFactory.getLogger(SyncConfig.class);

    /** Classpath resource read by {@link #loadDefault()}. */
    public static final String DEFAULT_RESOURCE = "lansync.json";

    // Network
    private final int discoveryPort;
    private final int gamePort;
    private final String broadcastAddress;
    private final long heartbeatIntervalMillis;
    private final long serverTtlMillis;
    private final long discoveryScanMillis;
    private final int connectTimeoutMillis;
    private final int keepAliveSeconds;
    private final int readTimeoutSeconds;
    private final long sendTimeoutMillis;
    private final int maxLineLength;

    // Smoothing
    private final long bufferDelayMillis;
    private final int stateBufferCapacity;
    private final long extrapolationWindowMillis;
    private final double extrapolationFactorCap;
    private final int predictionMoveCap;
    private final int tickRate;
    private final int gridWidth;
    private final int gridHeight;

    private SyncConfig(Builder b) {
        this.discoveryPort = b.discoveryPort;
        this.gamePort = b.gamePort;
        this.broadcastAddress = b.broadcastAddress;
        this.heartbeatIntervalMillis = b.heartbeatIntervalMillis;
        this.serverTtlMillis = b.serverTtlMillis;
        this.discoveryScanMillis = b.discoveryScanMillis;
        this.connectTimeoutMillis = b.connectTimeoutMillis;
        this.keepAliveSeconds = b.keepAliveSeconds;
        this.readTimeoutSeconds = b.readTimeoutSeconds;
        this.sendTimeoutMillis = b.sendTimeoutMillis;
        this.maxLineLength = b.maxLineLength;
        this.bufferDelayMillis = b.bufferDelayMillis;
        this.stateBufferCapacity = b.stateBufferCapacity;
        this.extrapolationWindowMillis = b.extrapolationWindowMillis;
        this.extrapolationFactorCap = b.extrapolationFactorCap;
        this.predictionMoveCap = b.predictionMoveCap;
        this.tickRate = b.tickRate;
        this.gridWidth = b.gridWidth;
        this.gridHeight = b.gridHeight;
    }

    public static SyncConfig defaults() {
        return builder().build();
    }

    /**
     * Reads a config from JSON.
     *
     * @throws IOException if the stream is unreadable or not a valid config
     */
    public static SyncConfig load(InputStream in) throws IOException {
        try {
            return new ObjectMapper().readValue(in, SyncConfig.class);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Reads {@value #DEFAULT_RESOURCE} from the classpath, falling back to the defaults when
     * it is absent or unreadable.
     */
    public static SyncConfig loadDefault() {
        try (InputStream in = SyncConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            SyncConfig config = load(in);
            logger.info("Loaded configuration from {}", DEFAULT_RESOURCE);
            return config;
        } catch (IOException e) {
            logger.warn("Could not read {}, using defaults", DEFAULT_RESOURCE, e);
            return defaults();
        }
    }

    public int getDiscoveryPort() {
        return discoveryPort;
    }

    public int getGamePort() {
        return gamePort;
    }

    public String getBroadcastAddress() {
        return broadcastAddress;
    }

    public long getHeartbeatIntervalMillis() {
        return heartbeatIntervalMillis;
    }

    public long getServerTtlMillis() {
        return serverTtlMillis;
    }

    public long getDiscoveryScanMillis() {
        return discoveryScanMillis;
    }

    public int getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public int getKeepAliveSeconds() {
        return keepAliveSeconds;
    }

    public int getReadTimeoutSeconds() {
        return readTimeoutSeconds;
    }

    public long getSendTimeoutMillis() {
        return sendTimeoutMillis;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public long getBufferDelayMillis() {
        return bufferDelayMillis;
    }

    public int getStateBufferCapacity() {
        return stateBufferCapacity;
    }

    public long getExtrapolationWindowMillis() {
        return extrapolationWindowMillis;
    }

    public double getExtrapolationFactorCap() {
        return extrapolationFactorCap;
    }

    public int getPredictionMoveCap() {
        return predictionMoveCap;
    }

    public int getTickRate() {
        return tickRate;
    }

    public int getGridWidth() {
        return gridWidth;
    }

    public int getGridHeight() {
        return gridHeight;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.discoveryPort = discoveryPort;
        b.gamePort = gamePort;
        b.broadcastAddress = broadcastAddress;
        b.heartbeatIntervalMillis = heartbeatIntervalMillis;
        b.serverTtlMillis = serverTtlMillis;
        b.discoveryScanMillis = discoveryScanMillis;
        b.connectTimeoutMillis = connectTimeoutMillis;
        b.keepAliveSeconds = keepAliveSeconds;
        b.readTimeoutSeconds = readTimeoutSeconds;
        b.sendTimeoutMillis = sendTimeoutMillis;
        b.maxLineLength = maxLineLength;
        b.bufferDelayMillis = bufferDelayMillis;
        b.stateBufferCapacity = stateBufferCapacity;
        b.extrapolationWindowMillis = extrapolationWindowMillis;
        b.extrapolationFactorCap = extrapolationFactorCap;
        b.predictionMoveCap = predictionMoveCap;
        b.tickRate = tickRate;
        b.gridWidth = gridWidth;
        b.gridHeight = gridHeight;
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private int discoveryPort = 50000;
        private int gamePort = 5555;
        private String broadcastAddress = "255.255.255.255";
        private long heartbeatIntervalMillis = 1000;
        private long serverTtlMillis = 5000;
        private long discoveryScanMillis = 500;
        private int connectTimeoutMillis = 5000;
        private int keepAliveSeconds = 5;
        private int readTimeoutSeconds = 30;
        private long sendTimeoutMillis = 200;
        private int maxLineLength = 65536;
        private long bufferDelayMillis = 80;
        private int stateBufferCapacity = 30;
        private long extrapolationWindowMillis = 500;
        private double extrapolationFactorCap = 1.5;
        private int predictionMoveCap = 5;
        private int tickRate = 60;
        private int gridWidth = 15;
        private int gridHeight = 15;

        public Builder discoveryPort(int discoveryPort) {
            this.discoveryPort = discoveryPort;
            return this;
        }

        public Builder gamePort(int gamePort) {
            this.gamePort = gamePort;
            return this;
        }

        public Builder broadcastAddress(String broadcastAddress) {
            this.broadcastAddress = broadcastAddress;
            return this;
        }

        public Builder heartbeatIntervalMillis(long heartbeatIntervalMillis) {
            this.heartbeatIntervalMillis = heartbeatIntervalMillis;
            return this;
        }

        public Builder serverTtlMillis(long serverTtlMillis) {
            this.serverTtlMillis = serverTtlMillis;
            return this;
        }

        public Builder discoveryScanMillis(long discoveryScanMillis) {
            this.discoveryScanMillis = discoveryScanMillis;
            return this;
        }

        public Builder connectTimeoutMillis(int connectTimeoutMillis) {
            this.connectTimeoutMillis = connectTimeoutMillis;
            return this;
        }

        /** Writer-idle time after which a PING is sent; 0 disables keep-alive pings. */
        public Builder keepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
            return this;
        }

        /** Reader-idle time after which a link is considered dead; 0 disables the check. */
        public Builder readTimeoutSeconds(int readTimeoutSeconds) {
            this.readTimeoutSeconds = readTimeoutSeconds;
            return this;
        }

        /** Longest a send may wait for the socket; a peer slower than this is disconnected. */
        public Builder sendTimeoutMillis(long sendTimeoutMillis) {
            this.sendTimeoutMillis = sendTimeoutMillis;
            return this;
        }

        public Builder maxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder bufferDelayMillis(long bufferDelayMillis) {
            this.bufferDelayMillis = bufferDelayMillis;
            return this;
        }

        public Builder stateBufferCapacity(int stateBufferCapacity) {
            this.stateBufferCapacity = stateBufferCapacity;
            return this;
        }

        public Builder extrapolationWindowMillis(long extrapolationWindowMillis) {
            this.extrapolationWindowMillis = extrapolationWindowMillis;
            return this;
        }

        public Builder extrapolationFactorCap(double extrapolationFactorCap) {
            this.extrapolationFactorCap = extrapolationFactorCap;
            return this;
        }

        public Builder predictionMoveCap(int predictionMoveCap) {
            this.predictionMoveCap = predictionMoveCap;
            return this;
        }

        public Builder tickRate(int tickRate) {
            this.tickRate = tickRate;
            return this;
        }

        public Builder gridWidth(int gridWidth) {
            this.gridWidth = gridWidth;
            return this;
        }

        public Builder gridHeight(int gridHeight) {
            this.gridHeight = gridHeight;
            return this;
        }

        public SyncConfig build() {
            requirePort("discoveryPort", discoveryPort);
            requirePort("gamePort", gamePort);
            requirePositive("heartbeatIntervalMillis", heartbeatIntervalMillis);
            requirePositive("serverTtlMillis", serverTtlMillis);
            requirePositive("discoveryScanMillis", discoveryScanMillis);
            requirePositive("connectTimeoutMillis", connectTimeoutMillis);
            requirePositive("sendTimeoutMillis", sendTimeoutMillis);
            requirePositive("maxLineLength", maxLineLength);
            requirePositive("stateBufferCapacity", stateBufferCapacity);
            requirePositive("extrapolationWindowMillis", extrapolationWindowMillis);
            requirePositive("predictionMoveCap", predictionMoveCap);
            requirePositive("tickRate", tickRate);
            requirePositive("gridWidth", gridWidth);
            requirePositive("gridHeight", gridHeight);
            if (keepAliveSeconds < 0 || readTimeoutSeconds < 0 || bufferDelayMillis < 0) {
                throw new IllegalArgumentException("Timeouts and delays must not be negative");
            }
            if (extrapolationFactorCap < 1.0) {
                throw new IllegalArgumentException("extrapolationFactorCap must be >= 1.0, was " + extrapolationFactorCap);
            }
            if (broadcastAddress == null || broadcastAddress.isBlank()) {
                throw new IllegalArgumentException("broadcastAddress is required");
            }
            return new SyncConfig(this);
        }

        private static void requirePort(String name, int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException(name + " out of range: " + port);
            }
        }

        private static void requirePositive(String name, long value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive, was " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "SyncConfig{" +
                "discoveryPort=" + discoveryPort +
                ", gamePort=" + gamePort +
                ", broadcastAddress='" + broadcastAddress + '\'' +
                ", heartbeatIntervalMillis=" + heartbeatIntervalMillis +
                ", bufferDelayMillis=" + bufferDelayMillis +
                ", stateBufferCapacity=" + stateBufferCapacity +
                ", grid=" + gridWidth + "x" + gridHeight +
                '}';
    }
}
