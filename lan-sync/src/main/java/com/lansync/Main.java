package com.lansync;

import com.lansync.config.SyncConfig;
import com.lansync.discovery.DiscoveredServer;
import com.lansync.discovery.DiscoveryBroadcaster;
import com.lansync.discovery.DiscoveryListener;
import com.lansync.server.HostServer;
import com.lansync.session.ConnectResult;
import com.lansync.session.ConnectionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point for the LAN sync service.
 *
 * Usage:
 *   Main host [name] [maxPlayers]   host a session and announce it on the LAN
 *   Main discover                   list hosts announced on the LAN
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);
    private static final String DEFAULT_NAME = "LanSync Host";
    private static final int DEFAULT_MAX_PLAYERS = 4;

    public static void main(String[] args) throws InterruptedException {
        if (args.length == 0) {
            usage();
            System.exit(2);
        }

        SyncConfig config = SyncConfig.loadDefault();
        switch (args[0]) {
            case "host" -> host(config, args);
            case "discover" -> discover(config);
            default -> {
                logger.error("Unknown mode '{}'", args[0]);
                usage();
                System.exit(2);
            }
        }
    }

    private static void host(SyncConfig config, String[] args) throws InterruptedException {
        String name = args.length > 1 ? args[1] : DEFAULT_NAME;
        int maxPlayers = DEFAULT_MAX_PLAYERS;
        if (args.length > 2) {
            try {
                maxPlayers = Integer.parseInt(args[2]);
            } catch (NumberFormatException e) {
                logger.warn("Invalid maxPlayers argument '{}', using {}", args[2], DEFAULT_MAX_PLAYERS);
            }
        }

        HostServer server = new HostServer(config, new ConnectionListener() {
            @Override
            public void playerJoined(int slot, String address) {
                logger.info("Player {} joined from {}", slot, address);
            }

            @Override
            public void playerLeft(int slot) {
                logger.info("Player {} left", slot);
            }
        });

        ConnectResult result = server.start(maxPlayers);
        if (!result.isOk()) {
            logger.error("Failed to start host: {}", result.getError());
            System.exit(1);
        }

        DiscoveryBroadcaster broadcaster = new DiscoveryBroadcaster(config, name, server.getPort());
        if (!broadcaster.start()) {
            logger.warn("Discovery unavailable; clients must connect to {} directly", result.getAddress());
        }

        logger.info("===========================================");
        logger.info("  LanSync host '{}'", name);
        logger.info("  Listening on {} for up to {} players", result.getAddress(), maxPlayers);
        logger.info("===========================================");

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping host...");
            broadcaster.stop();
            server.shutdown();
            stopped.countDown();
        }));
        stopped.await();
    }

    private static void discover(SyncConfig config) throws InterruptedException {
        DiscoveryListener listener = new DiscoveryListener(config);
        if (!listener.start()) {
            logger.error("Could not listen on discovery port {}", config.getDiscoveryPort());
            System.exit(1);
        }
        Runtime.getRuntime().addShutdownHook(new Thread(listener::stop));

        while (listener.isRunning()) {
            List<DiscoveredServer> servers = listener.getServers();
            if (servers.isEmpty()) {
                logger.info("No servers found yet");
            } else {
                for (DiscoveredServer server : servers) {
                    logger.info("  {} at {}:{}", server.getName(), server.getIp(), server.getPort());
                }
            }
            Thread.sleep(1000);
        }
    }

    private static void usage() {
        logger.info("Usage: Main host [name] [maxPlayers] | Main discover");
    }
}
