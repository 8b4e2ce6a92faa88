package org.harmar.kv.connection;

import java.io.IOException;

import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.harmar.kv.protocol.KvRequest;
import org.harmar.kv.protocol.KvResponse;
import org.harmar.kv.store.InMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the request stream of one accepted connection against the shared store.
 *
 * <p>Requests of a channel are handled one at a time on its event loop, so responses go out
 * in request order. Any failure closes the channel, which releases its admission slot
 * through the close future (see {@link ConnectionSlot#bind}).
 */
@Sharable
public class KvRequestHandler extends SimpleChannelInboundHandler<KvRequest> {
    private static final Logger logger = LoggerFactory.getLogger(KvRequestHandler.class);

    private final InMemoryStore store;

    public KvRequestHandler(InMemoryStore store) {
        this.store = store;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        ConnectionSlot slot = ConnectionSlot.of(ctx.channel());
        if (slot != null) {
            slot.markServing();
        }
        logger.debug("Serving {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, KvRequest request) {
        // frames already buffered behind a failed one still arrive after close
        ConnectionSlot slot = ConnectionSlot.of(ctx.channel());
        if (!ctx.channel().isActive() || (slot != null && slot.getState() == ConnectionState.CLOSED)) {
            logger.debug("Discarding {} from closed connection {}", request, ctx.channel().remoteAddress());
            return;
        }
        ctx.writeAndFlush(dispatch(request));
    }

    KvResponse dispatch(KvRequest request) {
        logger.debug("Dispatching {}", request);
        switch (request.getOperation()) {
            case SET:
                store.set(request.getKey(), request.getValue());
                return KvResponse.set();
            case GET:
                return KvResponse.get(store.get(request.getKey()));
            case DELETE:
                store.delete(request.getKey());
                return KvResponse.delete();
            default:
                throw new IllegalStateException("Unhandled operation " + request.getOperation());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        logger.debug("Connection {} closed", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            logger.warn("Closing {}: undecodable request ({})", ctx.channel().remoteAddress(),
                    cause.getCause() != null ? cause.getCause().getMessage() : cause.getMessage());
        } else if (cause instanceof IOException) {
            logger.debug("Closing {}: {}", ctx.channel().remoteAddress(), cause.toString());
        } else {
            logger.warn("Closing {} after error", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }
}
