package org.harmar.kv.connection;

import java.nio.charset.StandardCharsets;

import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringEncoder;
import org.harmar.kv.protocol.ServerCodec;
import org.harmar.kv.protocol.Utf8FrameDecoder;

/**
 * Pipeline of an accepted connection: lines -> json requests -> store.
 */
public class KvServerInitializer extends ChannelInitializer<Channel> {
    private static final Utf8FrameDecoder UTF8_DECODER = new Utf8FrameDecoder();

    private final KvRequestHandler requestHandler;
    private final int maxFrameLength;

    public KvServerInitializer(KvRequestHandler requestHandler, int maxFrameLength) {
        this.requestHandler = requestHandler;
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    protected void initChannel(Channel ch) {
        ChannelPipeline p = ch.pipeline();

        p.addLast("framer", new LineBasedFrameDecoder(maxFrameLength));
        p.addLast("stringDecoder", UTF8_DECODER);
        p.addLast("stringEncoder", new StringEncoder(StandardCharsets.UTF_8));
        p.addLast("codec", new ServerCodec());
        p.addLast("handler", requestHandler);
    }
}
