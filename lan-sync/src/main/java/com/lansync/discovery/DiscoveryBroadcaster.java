package com.lansync.discovery;

import com.lansync.config.SyncConfig;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.ScheduledFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Host-side heartbeat: announces the server name and game port on the discovery port.
 *
 * Runs on its own single-thread event loop, so the game loop never waits on it.
 */
public class DiscoveryBroadcaster {

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryBroadcaster.class);

    private final SyncConfig config;
    private final String serverName;
    private final int gamePort;

    private EventLoopGroup group;
    private Channel channel;
    private ScheduledFuture<?> heartbeat;
    private volatile boolean running;

    public DiscoveryBroadcaster(SyncConfig config, String serverName, int gamePort) {
        this.config = config;
        this.serverName = serverName;
        this.gamePort = gamePort;
    }

    /**
     * Opens a broadcast socket and schedules the heartbeat, first datagram immediately.
     *
     * @return false if already running or the socket could not be opened
     */
    public synchronized boolean start() {
        if (running) {
            return false;
        }
        group = new NioEventLoopGroup(1);
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, true)
                .handler(new ChannelInboundHandlerAdapter());

        ChannelFuture bind = bootstrap.bind(0).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            logger.error("Could not open discovery broadcast socket", bind.cause());
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            group = null;
            return false;
        }
        channel = bind.channel();
        running = true;

        InetSocketAddress target = new InetSocketAddress(config.getBroadcastAddress(), config.getDiscoveryPort());
        byte[] payload = DiscoveryPacket.announcement(serverName, gamePort).getBytes(StandardCharsets.UTF_8);
        long interval = config.getHeartbeatIntervalMillis();
        Channel ch = channel;
        heartbeat = ch.eventLoop().scheduleAtFixedRate(
                () -> announce(ch, target, payload), 0, interval, TimeUnit.MILLISECONDS);

        logger.info("Announcing '{}' (game port {}) to {} every {} ms",
                serverName, gamePort, target, interval);
        return true;
    }

    private void announce(Channel ch, InetSocketAddress target, byte[] payload) {
        ch.writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(payload), target))
                .addListener(f -> {
                    if (!f.isSuccess() && running) {
                        logger.warn("Discovery heartbeat to {} failed: {}", target, f.cause().toString());
                    }
                });
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (heartbeat != null) {
            heartbeat.cancel(false);
            heartbeat = null;
        }
        channel.close().awaitUninterruptibly();
        channel = null;
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
        group = null;
        logger.info("Discovery broadcaster for '{}' stopped", serverName);
    }
}
