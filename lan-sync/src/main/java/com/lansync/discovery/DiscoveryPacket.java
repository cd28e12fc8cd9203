package com.lansync.discovery;

import java.util.Optional;

/**
 * Text format of discovery datagrams.
 *
 * Announcement (host heartbeat): {@code LANSYNC_RESPONSE_V1|<server name>|<game port>}
 * Probe: starts with {@code LANSYNC_DISCOVER_V1}
 *
 * The magic prefixes keep unrelated broadcast traffic on the same port, and probes from
 * other listeners, out of the server list. The port is taken after the last separator,
 * so server names may contain '|'.
 */
public final class DiscoveryPacket {

    public static final String RESPONSE_MAGIC = "LANSYNC_RESPONSE_V1";
    public static final String DISCOVER_MAGIC = "LANSYNC_DISCOVER_V1";
    public static final char SEPARATOR = '|';

    private DiscoveryPacket() {
    }

    public static String announcement(String serverName, int gamePort) {
        return RESPONSE_MAGIC + SEPARATOR + serverName + SEPARATOR + gamePort;
    }

    public static boolean isProbe(String datagram) {
        return datagram != null && datagram.startsWith(DISCOVER_MAGIC);
    }

    /**
     * Parses a host announcement.
     *
     * @return empty for anything that is not a well-formed announcement
     */
    public static Optional<Announcement> parseAnnouncement(String datagram) {
        String prefix = RESPONSE_MAGIC + SEPARATOR;
        if (datagram == null || !datagram.startsWith(prefix)) {
            return Optional.empty();
        }
        String payload = datagram.substring(prefix.length());
        int split = payload.lastIndexOf(SEPARATOR);
        if (split < 0) {
            return Optional.empty();
        }
        String name = payload.substring(0, split);
        int port;
        try {
            port = Integer.parseInt(payload.substring(split + 1).trim());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (port < 1 || port > 65535) {
            return Optional.empty();
        }
        return Optional.of(new Announcement(name, port));
    }

    /**
     * The content of one host announcement.
     */
    public static final class Announcement {
        private final String serverName;
        private final int gamePort;

        Announcement(String serverName, int gamePort) {
            this.serverName = serverName;
            this.gamePort = gamePort;
        }

        public String getServerName() {
            return serverName;
        }

        public int getGamePort() {
            return gamePort;
        }
    }
}
