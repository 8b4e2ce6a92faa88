package org.harmar.kv.protocol;

import java.util.List;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;

public class ClientCodec extends MessageToMessageCodec<String, KvRequest> {

    @Override
    protected void encode(ChannelHandlerContext ctx, KvRequest msg, List<Object> out) {
        out.add(KvJson.writeRequest(msg) + "\n");
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, String msg, List<Object> out) throws ProtocolException {
        out.add(KvJson.readResponse(msg));
    }
}
