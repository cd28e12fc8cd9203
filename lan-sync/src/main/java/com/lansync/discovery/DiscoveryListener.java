package com.lansync.discovery;

import com.lansync.config.SyncConfig;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.ScheduledFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Client-side discovery: listens on the shared discovery port and keeps a TTL list of hosts.
 */
public class DiscoveryListener {

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryListener.class);

    private final SyncConfig config;
    private final ServerRegistry registry;

    private EventLoopGroup group;
    private Channel channel;
    private ScheduledFuture<?> scan;
    private volatile boolean running;

    public DiscoveryListener(SyncConfig config) {
        this(config, System::currentTimeMillis);
    }

    public DiscoveryListener(SyncConfig config, LongSupplier currentTimeMillis) {
        this.config = config;
        this.registry = new ServerRegistry(config.getServerTtlMillis(), currentTimeMillis);
    }

    /**
     * Binds the discovery port and starts the periodic purge.
     *
     * @return false if already running or the port could not be bound
     */
    public synchronized boolean start() {
        if (running) {
            return false;
        }
        group = new NioEventLoopGroup(1);
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .option(ChannelOption.SO_BROADCAST, true)
                .handler(new AnnouncementHandler());

        ChannelFuture bind = bootstrap.bind(config.getDiscoveryPort()).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            logger.error("Could not bind discovery port {}", config.getDiscoveryPort(), bind.cause());
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            group = null;
            return false;
        }
        channel = bind.channel();
        running = true;

        long period = config.getDiscoveryScanMillis();
        scan = channel.eventLoop().scheduleAtFixedRate(registry::purgeExpired, period, period, TimeUnit.MILLISECONDS);
        logger.info("Listening for servers on UDP port {}", getPort());
        return true;
    }

    /**
     * Hosts currently announced on the LAN, oldest discovery first.
     */
    public List<DiscoveredServer> getServers() {
        return List.copyOf(registry.getServers());
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * The bound UDP port, or -1 if not running.
     */
    public int getPort() {
        Channel ch = channel;
        if (ch == null || ch.localAddress() == null) {
            return -1;
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (scan != null) {
            scan.cancel(false);
            scan = null;
        }
        channel.close().awaitUninterruptibly();
        channel = null;
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
        group = null;
        registry.clear();
        logger.info("Discovery listener stopped");
    }

    private class AnnouncementHandler extends SimpleChannelInboundHandler<DatagramPacket> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet) {
            String text = packet.content().toString(StandardCharsets.UTF_8);
            String ip = packet.sender().getAddress().getHostAddress();

            if (DiscoveryPacket.isProbe(text)) {
                logger.debug("Ignoring discovery probe from {}", ip);
            } else {
                Optional<DiscoveryPacket.Announcement> announcement = DiscoveryPacket.parseAnnouncement(text);
                if (announcement.isPresent()) {
                    registry.upsert(ip, announcement.get().getServerName(), announcement.get().getGamePort());
                } else {
                    logger.debug("Skipping malformed discovery datagram from {}", ip);
                }
            }
            registry.purgeExpired();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            // UDP socket stays open; one bad read does not end discovery
            logger.warn("Discovery receive error: {}", cause.toString());
        }
    }
}
