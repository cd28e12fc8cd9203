package com.lansync.discovery;

/**
 * A host seen on the LAN, keyed by its IP.
 */
public final class DiscoveredServer {

    private final String name;
    private final String ip;
    private final int port;
    private final long lastSeenMillis;

    public DiscoveredServer(String name, String ip, int port, long lastSeenMillis) {
        this.name = name;
        this.ip = ip;
        this.port = port;
        this.lastSeenMillis = lastSeenMillis;
    }

    public String getName() {
        return name;
    }

    public String getIp() {
        return ip;
    }

    /**
     * The game (TCP) port announced by the host.
     */
    public int getPort() {
        return port;
    }

    public long getLastSeenMillis() {
        return lastSeenMillis;
    }

    @Override
    public String toString() {
        return "DiscoveredServer{" +
                "name='" + name + '\'' +
                ", address=" + ip + ":" + port +
                ", lastSeen=" + lastSeenMillis +
                '}';
    }
}
