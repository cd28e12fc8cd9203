package com.lansync.handler;

import com.lansync.protocol.Message;
import com.lansync.protocol.MessageCodec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.nio.charset.StandardCharsets;

/**
 * Writes each outbound message as one UTF-8 JSON record terminated by {@code '\n'}.
 */
@ChannelHandler.Sharable
public class MessageEncoder extends MessageToByteEncoder<Message> {

    private static final byte NEWLINE = '\n';

    private final MessageCodec codec;

    public MessageEncoder(MessageCodec codec) {
        super(Message.class);
        this.codec = codec;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Message message, ByteBuf out) {
        out.writeCharSequence(codec.encode(message), StandardCharsets.UTF_8);
        out.writeByte(NEWLINE);
    }
}
