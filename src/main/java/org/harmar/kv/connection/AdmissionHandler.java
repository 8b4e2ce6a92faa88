package org.harmar.kv.connection;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import org.harmar.kv.security.AdmissionDecision;
import org.harmar.kv.security.ConnectionAdmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admission gate of the listener. Installed with {@link ServerBootstrap#handler(ChannelHandler)},
 * so it sees every accepted child channel before the child is registered with a worker loop.
 *
 * <p>An admitted child gets a {@link ConnectionSlot} bound to its close future and is passed on.
 * A rejected child is reset and dropped without ever reaching a request handler.
 */
@Sharable
public final class AdmissionHandler extends ChannelInboundHandlerAdapter {
    private static final Logger logger = LoggerFactory.getLogger(AdmissionHandler.class);

    private final ConnectionAdmission admission;

    private final AtomicBoolean loggingScheduled = new AtomicBoolean();
    private final LongAdder droppedConnections = new LongAdder();

    public AdmissionHandler(ConnectionAdmission admission) {
        this.admission = admission;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        final Channel child = (Channel) msg;

        InetAddress address = peerAddress(child.remoteAddress());
        if (address == null) {
            logger.warn("Dropping connection with unsupported remote address {}", child.remoteAddress());
            drop(ctx, child);
            return;
        }

        AdmissionDecision decision = admission.admit(address);
        if (!decision.isAccepted()) {
            logger.debug("Rejected connection from {}: {}", address.getHostAddress(), decision.getDescription());
            drop(ctx, child);
            return;
        }

        ConnectionSlot.bind(child, new ConnectionSlot(admission, address));
        super.channelRead(ctx, msg);
    }

    private void drop(ChannelHandlerContext ctx, Channel child) {
        // no TIME_WAIT for refused peers
        child.config().setOption(ChannelOption.SO_LINGER, 0);
        child.unsafe().closeForcibly();

        droppedConnections.increment();
        if (loggingScheduled.compareAndSet(false, true)) {
            ctx.executor().schedule(this::writeDroppedConnectionsLog, 1, TimeUnit.SECONDS);
        }
    }

    private void writeDroppedConnectionsLog() {
        loggingScheduled.set(false);

        final long dropped = droppedConnections.sumThenReset();
        if (dropped > 0) {
            logger.warn("Dropped {} connection(s) to limit open connections to {} per address and {} in total",
                    dropped, admission.maxPerAddress(), admission.maxTotal());
        }
    }

    static InetAddress peerAddress(SocketAddress remote) {
        if (remote instanceof InetSocketAddress) {
            return ((InetSocketAddress) remote).getAddress();
        }
        return null;
    }
}
