package com.lansync.server;

import com.lansync.config.SyncConfig;
import com.lansync.handler.HostFrameHandler;
import com.lansync.handler.LineMessageHandler;
import com.lansync.handler.LinePipelineInitializer;
import com.lansync.protocol.DisconnectMessage;
import com.lansync.protocol.Message;
import com.lansync.protocol.MessageCodec;
import com.lansync.session.ClientSession;
import com.lansync.session.ConnectResult;
import com.lansync.session.ConnectionListener;
import com.lansync.session.InboundMessage;
import com.lansync.session.MessageQueue;
import com.lansync.session.SessionManager;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Host side of the game link: accepts up to {@code maxPlayers - 1} clients over TCP.
 *
 * Threading Model:
 * - A single Netty I/O thread both accepts new connections and services reads on every
 *   client socket with non-blocking I/O. There is no thread per client.
 * - {@link #send}, {@link #broadcast} and {@link #getMessages} are called from the game
 *   loop. A send waits at most the configured send timeout per client; a client whose
 *   socket does not take the bytes in time is disconnected.
 *
 * Connection lifecycle events go to the {@link ConnectionListener}; a disconnect of any
 * kind (peer close, I/O error, failed send, idle timeout, planned DISCONNECT, shutdown)
 * raises exactly one {@code playerLeft}. Nothing here retries or reconnects.
 */
public class HostServer {

    private static final Logger logger = LoggerFactory.getLogger(HostServer.class);

    private final SyncConfig config;
    private final ConnectionListener listener;
    private final MessageCodec codec;
    private final MessageQueue inbound;
    private final AtomicBoolean running;

    private volatile SessionManager sessionManager;
    private EventLoopGroup ioGroup;
    private Channel serverChannel;

    public HostServer(SyncConfig config, ConnectionListener listener) {
        this.config = config;
        this.listener = listener;
        this.codec = new MessageCodec();
        this.inbound = new MessageQueue();
        this.running = new AtomicBoolean(false);
        this.sessionManager = new SessionManager(0);
    }

    /**
     * Binds the game port and starts accepting clients. Returns once the port is bound.
     *
     * @param maxPlayers total players including the host; clients take slots 1..maxPlayers-1
     * @return the LAN address ("ip:port") on success, the reason on failure
     */
    public synchronized ConnectResult start(int maxPlayers) {
        if (maxPlayers < 2) {
            return ConnectResult.failure("maxPlayers must be at least 2, was " + maxPlayers);
        }
        if (!running.compareAndSet(false, true)) {
            return ConnectResult.failure("Host already running");
        }

        SessionManager sessions = new SessionManager(maxPlayers - 1);
        this.sessionManager = sessions;
        inbound.clear();

        // One thread serves as both acceptor and reader for every client.
        ioGroup = new NioEventLoopGroup(1);

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(ioGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, maxPlayers)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true) // Disable Nagle for low latency
                .childHandler(new LinePipelineInitializer(config, codec,
                        () -> new HostFrameHandler(codec, sessions, inbound, listener)));

        ChannelFuture bind = bootstrap.bind(config.getGamePort()).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            String error = "Failed to bind port " + config.getGamePort() + ": " + bind.cause().getMessage();
            logger.error(error, bind.cause());
            ioGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
            ioGroup = null;
            running.set(false);
            return ConnectResult.failure(error);
        }
        serverChannel = bind.channel();

        String address = localLanAddress() + ":" + getPort();
        logger.info("Host started on {} ({} client slots)", address, maxPlayers - 1);
        return ConnectResult.success(address);
    }

    /**
     * Sends a message to the client in {@code slot}.
     *
     * @return false if there is no such client or the write failed
     */
    public boolean send(int slot, Message message) {
        ClientSession session = sessionManager.getSessionBySlot(slot);
        if (session == null) {
            logger.debug("No client in slot {}, dropping {}", slot, message.getType());
            return false;
        }
        return session.send(message, config.getSendTimeoutMillis());
    }

    /**
     * Sends a message to every connected client. A failure on one client does not affect the
     * others; the failed or stalled client is disconnected.
     *
     * @return the number of clients the message was written to
     */
    public int broadcast(Message message) {
        int delivered = 0;
        for (ClientSession session : sessionManager.getAllSessions()) {
            if (session.send(message, config.getSendTimeoutMillis())) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Sends a DISCONNECT to the client in {@code slot} and closes its connection.
     */
    public void disconnect(int slot, String reason) {
        ClientSession session = sessionManager.getSessionBySlot(slot);
        if (session != null) {
            session.send(new DisconnectMessage(reason), config.getSendTimeoutMillis());
            LineMessageHandler.closeWithReason(session.getChannel(), reason);
        }
    }

    /**
     * Drains every message received since the last call, in receipt order per client.
     */
    public List<InboundMessage> getMessages() {
        return inbound.drain();
    }

    /**
     * Connected players including the host.
     */
    public int getConnectedCount() {
        return sessionManager.getSessionCount() + 1;
    }

    public List<ClientSession> getSessions() {
        return sessionManager.getAllSessions();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * The bound game port, or -1 when not running. Useful when configured with port 0.
     */
    public int getPort() {
        Channel channel = serverChannel;
        if (channel == null || !(channel.localAddress() instanceof InetSocketAddress)) {
            return -1;
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    /**
     * Disconnects every client (each raises one {@code playerLeft}), closes the listening
     * socket and stops the I/O thread. Safe to call more than once. Must not be called from
     * a {@link ConnectionListener} callback.
     */
    public synchronized void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Shutting down host...");

        for (ClientSession session : sessionManager.getAllSessions()) {
            session.send(new DisconnectMessage("host shutting down"), config.getSendTimeoutMillis());
            session.getChannel().attr(LineMessageHandler.CLOSE_REASON).setIfAbsent("host shutdown");
            session.getChannel().close().awaitUninterruptibly();
        }
        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly();
            serverChannel = null;
        }
        if (ioGroup != null) {
            ioGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
            ioGroup = null;
        }
        inbound.clear();
        logger.info("Host shutdown complete.");
    }

    /**
     * Best guess at this machine's LAN address: the local end of a UDP "connection" towards a
     * public address. No packet is sent.
     */
    static String localLanAddress() {
        try (DatagramSocket probe = new DatagramSocket()) {
            probe.connect(InetAddress.getByName("8.8.8.8"), 80);
            InetAddress local = probe.getLocalAddress();
            if (local != null && !local.isAnyLocalAddress()) {
                return local.getHostAddress();
            }
        } catch (IOException | UncheckedIOException e) {
            logger.debug("Could not determine LAN address: {}", e.getMessage());
        }
        return "127.0.0.1";
    }
}
