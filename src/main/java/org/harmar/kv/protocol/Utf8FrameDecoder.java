package org.harmar.kv.protocol;

import java.nio.charset.StandardCharsets;
import java.util.List;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;

/**
 * Turns a framed line into a string, failing the frame instead of substituting U+FFFD when
 * it is not well-formed UTF-8.
 */
@Sharable
public class Utf8FrameDecoder extends MessageToMessageDecoder<ByteBuf> {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf frame, List<Object> out) throws ProtocolException {
        if (!ByteBufUtil.isText(frame, StandardCharsets.UTF_8)) {
            throw new ProtocolException("Line is not valid UTF-8");
        }
        out.add(frame.toString(StandardCharsets.UTF_8));
    }
}
