package com.lansync.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * TTL cache of discovered hosts, keyed by IP.
 *
 * Written by the discovery I/O thread, read by the caller's thread. Every method holds the
 * same lock, so readers never see a half-applied update.
 */
public class ServerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ServerRegistry.class);

    private final long ttlMillis;
    private final LongSupplier currentTimeMillis;
    private final Map<String, DiscoveredServer> servers = new LinkedHashMap<>();

    public ServerRegistry(long ttlMillis, LongSupplier currentTimeMillis) {
        this.ttlMillis = ttlMillis;
        this.currentTimeMillis = currentTimeMillis;
    }

    /**
     * Records an announcement from {@code ip}, refreshing its last-seen time.
     *
     * @return true if this IP was not listed before
     */
    public synchronized boolean upsert(String ip, String name, int port) {
        DiscoveredServer previous = servers.put(ip,
                new DiscoveredServer(name, ip, port, currentTimeMillis.getAsLong()));
        if (previous == null) {
            logger.info("Discovered server '{}' at {}:{}", name, ip, port);
            return true;
        }
        return false;
    }

    /**
     * Drops every server not seen for longer than the TTL.
     *
     * @return how many were dropped
     */
    public synchronized int purgeExpired() {
        long now = currentTimeMillis.getAsLong();
        int removed = 0;
        Iterator<DiscoveredServer> it = servers.values().iterator();
        while (it.hasNext()) {
            DiscoveredServer server = it.next();
            if (now - server.getLastSeenMillis() > ttlMillis) {
                it.remove();
                removed++;
                logger.info("Server '{}' at {} timed out", server.getName(), server.getIp());
            }
        }
        return removed;
    }

    /**
     * Returns a copy of the current list, in order of first discovery.
     */
    public synchronized List<DiscoveredServer> getServers() {
        return new ArrayList<>(servers.values());
    }

    public synchronized void clear() {
        servers.clear();
    }
}
