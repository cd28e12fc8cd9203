package com.lansync.client;

import com.lansync.config.SyncConfig;
import com.lansync.handler.ChannelSends;
import com.lansync.handler.ClientFrameHandler;
import com.lansync.handler.LineMessageHandler;
import com.lansync.handler.LinePipelineInitializer;
import com.lansync.protocol.DisconnectMessage;
import com.lansync.protocol.Message;
import com.lansync.protocol.MessageCodec;
import com.lansync.session.ConnectResult;
import com.lansync.session.ConnectionListener;
import com.lansync.session.InboundMessage;
import com.lansync.session.MessageQueue;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client side of the game link: one TCP connection to the host.
 *
 * A single Netty I/O thread reads and frames incoming records into the message queue,
 * which the game loop drains with {@link #getMessages()}. Losing the link raises exactly
 * one {@code connectionLost}; reconnecting is up to the caller.
 */
public class HostConnection {

    private static final Logger logger = LoggerFactory.getLogger(HostConnection.class);

    private final SyncConfig config;
    private final ConnectionListener listener;
    private final MessageCodec codec;
    private final MessageQueue inbound;
    private final AtomicBoolean running;
    private final AtomicBoolean connected;

    private EventLoopGroup ioGroup;
    private volatile Channel channel;
    private volatile String hostAddress;

    public HostConnection(SyncConfig config, ConnectionListener listener) {
        this.config = config;
        this.listener = listener;
        this.codec = new MessageCodec();
        this.inbound = new MessageQueue();
        this.running = new AtomicBoolean(false);
        this.connected = new AtomicBoolean(false);
    }

    public ConnectResult connect(String hostIp) {
        return connect(hostIp, config.getGamePort());
    }

    /**
     * Connects to a host, waiting at most the configured connect timeout.
     *
     * @return the host address on success, the reason on failure
     */
    public synchronized ConnectResult connect(String hostIp, int port) {
        if (running.get() && !connected.get()) {
            // Previous link already dropped; release its I/O thread first.
            shutdown();
        }
        if (!running.compareAndSet(false, true)) {
            return ConnectResult.failure("Already connected to " + hostAddress);
        }
        inbound.clear();
        ioGroup = new NioEventLoopGroup(1);

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(ioGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, config.getConnectTimeoutMillis())
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.TCP_NODELAY, true) // Disable Nagle for low latency
                .handler(new LinePipelineInitializer(config, codec,
                        () -> new ClientFrameHandler(codec, inbound, this::onLinkLost)));

        // Mark connected before the channel can go inactive, so a very early close is still reported.
        connected.set(true);
        ChannelFuture connect = bootstrap.connect(hostIp, port).awaitUninterruptibly();
        if (!connect.isSuccess()) {
            connected.set(false);
            String error = "Failed to connect to " + hostIp + ":" + port + ": " + connect.cause().getMessage();
            logger.warn(error);
            ioGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
            ioGroup = null;
            running.set(false);
            return ConnectResult.failure(error);
        }

        channel = connect.channel();
        hostAddress = hostIp + ":" + port;
        logger.info("Connected to host at {}", hostAddress);
        return ConnectResult.success(hostAddress);
    }

    private void onLinkLost(String reason) {
        if (connected.compareAndSet(true, false)) {
            logger.info("Connection to host lost: {}", reason);
            listener.connectionLost(reason);
        }
    }

    /**
     * Sends a message to the host, waiting at most the configured send timeout for it to be
     * handed to the socket. A link that stays blocked longer is closed.
     *
     * @return false if not connected or the write failed
     */
    public boolean send(Message message) {
        return ChannelSends.writeAndFlush(channel, message, config.getSendTimeoutMillis());
    }

    /**
     * Drains every message received since the last call, in receipt order.
     */
    public List<InboundMessage> getMessages() {
        return inbound.drain();
    }

    public boolean isConnected() {
        return connected.get();
    }

    /**
     * "ip:port" of the host, or null before the first successful connect.
     */
    public String getHostAddress() {
        return hostAddress;
    }

    /**
     * Sends a DISCONNECT, closes the link (raising {@code connectionLost} if it was still up)
     * and stops the I/O thread. Safe to call more than once. Must not be called from a
     * {@link ConnectionListener} callback.
     */
    public synchronized void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Channel ch = channel;
        if (ch != null) {
            if (ch.isActive()) {
                ChannelSends.writeAndFlush(ch, new DisconnectMessage("client shutdown"), config.getSendTimeoutMillis());
            }
            ch.attr(LineMessageHandler.CLOSE_REASON).setIfAbsent("shutdown");
            ch.close().awaitUninterruptibly();
            channel = null;
        }
        if (ioGroup != null) {
            ioGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
            ioGroup = null;
        }
        inbound.clear();
        logger.info("Client connection shut down");
    }
}
