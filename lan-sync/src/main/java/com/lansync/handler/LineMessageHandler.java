package com.lansync.handler;

import com.lansync.protocol.DisconnectMessage;
import com.lansync.protocol.MalformedMessageException;
import com.lansync.protocol.Message;
import com.lansync.protocol.MessageCodec;
import com.lansync.protocol.PingMessage;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.AttributeKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles decoded lines for one connection, host or client side.
 *
 * Common rules live here:
 * - blank lines are ignored, malformed lines are logged and dropped (never fatal)
 * - PING is answered with PONG and not passed on
 * - DISCONNECT closes the connection
 * - idle and I/O errors close the connection
 * Everything else goes to {@link #onMessage} in receipt order.
 *
 * Threading Model:
 * - Each connection is handled by a single Netty I/O thread, so no synchronization is needed
 *   within one handler. Never block in this handler.
 */
public abstract class LineMessageHandler extends SimpleChannelInboundHandler<String> {

    private static final Logger logger = LoggerFactory.getLogger(LineMessageHandler.class);

    /**
     * Why a channel was closed, read back when it goes inactive. The first reason set wins.
     */
    public static final AttributeKey<String> CLOSE_REASON = AttributeKey.valueOf("lansync.closeReason");

    private final MessageCodec codec;

    protected LineMessageHandler(MessageCodec codec) {
        this.codec = codec;
    }

    /**
     * Called for every valid message that is not handled by the transport itself.
     */
    protected abstract void onMessage(ChannelHandlerContext ctx, Message message);

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        if (line.isBlank()) {
            return;
        }

        Message message;
        try {
            message = codec.decode(line);
        } catch (MalformedMessageException e) {
            logger.warn("Dropping malformed record from {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            logger.debug("Malformed record was: {}", line);
            return;
        }

        boolean forward = switch (message.getType()) {
            case PING -> {
                ctx.writeAndFlush(((PingMessage) message).reply());
                yield false;
            }
            case DISCONNECT -> {
                String reason = ((DisconnectMessage) message).getReason();
                closeWithReason(ctx.channel(), "peer disconnected" + (reason != null ? ": " + reason : ""));
                yield false;
            }
            case INPUT, READY, WORLD_SNAPSHOT, GAME_START, GAME_END, PLAYER_ASSIGNED,
                    LOBBY_STATE, RETURN_TO_LOBBY, PONG -> true;
        };

        if (forward) {
            logger.trace("Received {} from {}", message.getType(), ctx.channel().remoteAddress());
            onMessage(ctx, message);
        }
    }

    /**
     * Handles idle state events (keep-alive and dead peer detection).
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                logger.warn("Connection idle timeout, closing: {}", ctx.channel().remoteAddress());
                closeWithReason(ctx.channel(), "read timeout");
            } else if (e.state() == IdleState.WRITER_IDLE) {
                ctx.writeAndFlush(new PingMessage(System.currentTimeMillis()));
            }
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            // Framing or charset problem with a single record; the stream itself is still usable.
            logger.warn("Dropping undecodable record from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
            return;
        }
        logger.warn("Connection error on {}, closing", ctx.channel().remoteAddress(), cause);
        closeWithReason(ctx.channel(), String.valueOf(cause.getMessage()));
    }

    /**
     * Records why the channel is being closed, then closes it.
     */
    public static void closeWithReason(Channel channel, String reason) {
        channel.attr(CLOSE_REASON).setIfAbsent(reason);
        channel.close();
    }

    protected static String closeReason(Channel channel, String fallback) {
        String reason = channel.attr(CLOSE_REASON).get();
        return reason != null ? reason : fallback;
    }
}
