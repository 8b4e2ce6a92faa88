package org.harmar.kv.protocol;

import java.util.List;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;

/**
 * Server side: decoded lines become {@link KvRequest}s, {@link KvResponse}s become lines.
 * A line that is not a valid request fails with a {@code DecoderException}.
 */
public class ServerCodec extends MessageToMessageCodec<String, KvResponse> {

    @Override
    protected void encode(ChannelHandlerContext ctx, KvResponse msg, List<Object> out) {
        out.add(KvJson.writeResponse(msg) + "\n");
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, String msg, List<Object> out) throws ProtocolException {
        out.add(KvJson.readRequest(msg));
    }
}
