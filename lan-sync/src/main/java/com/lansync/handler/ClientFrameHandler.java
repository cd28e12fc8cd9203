package com.lansync.handler;

import com.lansync.protocol.Message;
import com.lansync.protocol.MessageCodec;
import com.lansync.session.InboundMessage;
import com.lansync.session.MessageQueue;

import io.netty.channel.ChannelHandlerContext;

import java.util.function.Consumer;

/**
 * Client side of the link to the host: queues messages and reports the link going down.
 */
public class ClientFrameHandler extends LineMessageHandler {

    private final MessageQueue inbound;
    private final Consumer<String> onLinkLost;

    public ClientFrameHandler(MessageCodec codec, MessageQueue inbound, Consumer<String> onLinkLost) {
        super(codec);
        this.inbound = inbound;
        this.onLinkLost = onLinkLost;
    }

    @Override
    protected void onMessage(ChannelHandlerContext ctx, Message message) {
        inbound.add(new InboundMessage(InboundMessage.HOST_SLOT, message));
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        onLinkLost.accept(closeReason(ctx.channel(), "connection closed by host"));
        super.channelInactive(ctx);
    }
}
