package com.lansync.handler;

import com.lansync.protocol.Message;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-and-flush for the game link with a bounded wait.
 *
 * A failed write closes the channel, so a send failure goes through the same close path
 * (and the same single "gone" event) as a read failure. So does a write that is still
 * pending when the wait runs out: a peer that stops reading is dropped rather than left
 * to block the caller.
 */
public final class ChannelSends {

    private static final Logger logger = LoggerFactory.getLogger(ChannelSends.class);

    /** Close reason for a peer whose socket did not take a write in time. */
    public static final String SEND_STALLED = "send stalled";

    private ChannelSends() {
    }

    /**
     * Writes and flushes {@code message}, waiting up to {@code timeoutMillis} for the write
     * to complete unless called from the channel's own I/O thread (where waiting would
     * deadlock).
     *
     * @return false if the channel is not active, the write failed or it did not finish in time
     */
    public static boolean writeAndFlush(Channel channel, Message message, long timeoutMillis) {
        if (channel == null || !channel.isActive()) {
            return false;
        }
        ChannelFuture future = channel.writeAndFlush(message)
                .addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
        if (channel.eventLoop().inEventLoop()) {
            return true;
        }
        if (!future.awaitUninterruptibly(timeoutMillis)) {
            logger.warn("Sending {} to {} took over {} ms, closing", message.getType(),
                    channel.remoteAddress(), timeoutMillis);
            LineMessageHandler.closeWithReason(channel, SEND_STALLED);
            return false;
        }
        if (!future.isSuccess()) {
            logger.warn("Failed to send {} to {}", message.getType(), channel.remoteAddress(), future.cause());
            return false;
        }
        return true;
    }
}
