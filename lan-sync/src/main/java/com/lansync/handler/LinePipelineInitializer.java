package com.lansync.handler;

import com.lansync.config.SyncConfig;
import com.lansync.protocol.MessageCodec;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.timeout.IdleStateHandler;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Builds the pipeline shared by host and client connections:
 *
 * idle detection → newline framing → UTF-8 decoding → JSON encoding (outbound) → handler
 *
 * The frame decoder accumulates partial reads per connection and emits one record per
 * complete line, so TCP segmentation never splits or merges records.
 */
public class LinePipelineInitializer extends ChannelInitializer<SocketChannel> {

    private final SyncConfig config;
    private final MessageEncoder encoder;
    private final Supplier<LineMessageHandler> handlerFactory;

    public LinePipelineInitializer(SyncConfig config, MessageCodec codec,
                                   Supplier<LineMessageHandler> handlerFactory) {
        this.config = config;
        this.encoder = new MessageEncoder(codec);
        this.handlerFactory = handlerFactory;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline pipeline = ch.pipeline();

        // Reader idle: peer is dead. Writer idle: send a PING so the peer does not think we are.
        pipeline.addLast(new IdleStateHandler(config.getReadTimeoutSeconds(), config.getKeepAliveSeconds(),
                0, TimeUnit.SECONDS));

        // Over-long lines are discarded up to the next newline and reported as an exception.
        pipeline.addLast(new LineBasedFrameDecoder(config.getMaxLineLength(), true, false));
        pipeline.addLast(new StringDecoder(StandardCharsets.UTF_8));
        pipeline.addLast(encoder);

        pipeline.addLast(handlerFactory.get());
    }
}
