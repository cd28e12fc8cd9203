package com.lansync.handler;

import com.lansync.protocol.DisconnectMessage;
import com.lansync.protocol.Message;
import com.lansync.protocol.MessageCodec;
import com.lansync.session.ClientSession;
import com.lansync.session.ConnectionListener;
import com.lansync.session.InboundMessage;
import com.lansync.session.MessageQueue;
import com.lansync.session.SessionManager;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host side of one client connection.
 *
 * - channel active: take a slot and announce {@code playerJoined}, or refuse when full
 * - message: queue it tagged with the client's slot
 * - channel inactive: free the slot and announce {@code playerLeft}, once
 */
public class HostFrameHandler extends LineMessageHandler {

    private static final Logger logger = LoggerFactory.getLogger(HostFrameHandler.class);

    private final SessionManager sessionManager;
    private final MessageQueue inbound;
    private final ConnectionListener listener;

    public HostFrameHandler(MessageCodec codec, SessionManager sessionManager, MessageQueue inbound,
                            ConnectionListener listener) {
        super(codec);
        this.sessionManager = sessionManager;
        this.inbound = inbound;
        this.listener = listener;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        ClientSession session = sessionManager.register(ctx.channel());
        if (session == null) {
            logger.warn("Rejecting {}: all {} client slots taken",
                    ctx.channel().remoteAddress(), sessionManager.getMaxClients());
            ctx.channel().attr(CLOSE_REASON).setIfAbsent("server full");
            ctx.writeAndFlush(new DisconnectMessage("server full")).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        logger.info("Client connected from {} (slot {})", session.getAddress(), session.getSlot());
        listener.playerJoined(session.getSlot(), session.getAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        ClientSession session = sessionManager.remove(ctx.channel());
        if (session != null) {
            logger.info("Client in slot {} disconnected ({})", session.getSlot(),
                    closeReason(ctx.channel(), "closed by peer"));
            listener.playerLeft(session.getSlot());
        }
        super.channelInactive(ctx);
    }

    @Override
    protected void onMessage(ChannelHandlerContext ctx, Message message) {
        ClientSession session = sessionManager.getSessionByChannel(ctx.channel());
        if (session == null) {
            logger.error("Received message from unknown channel");
            return;
        }
        inbound.add(new InboundMessage(session.getSlot(), message));
    }
}
