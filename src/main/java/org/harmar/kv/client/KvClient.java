package org.harmar.kv.client;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringEncoder;
import org.harmar.kv.ServerConfig;
import org.harmar.kv.protocol.ClientCodec;
import org.harmar.kv.protocol.KvRequest;
import org.harmar.kv.protocol.KvResponse;
import org.harmar.kv.protocol.Operation;
import org.harmar.kv.protocol.ProtocolException;
import org.harmar.kv.protocol.Utf8FrameDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for one connection to the key-value server.
 *
 * <p>The server answers requests of a connection in order, so responses are matched to
 * pending requests first in, first out. Once the connection is closed, by either side,
 * every pending and later call fails with an {@link IOException}.
 */
public class KvClient implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(KvClient.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final EventLoopGroup group;
    private final Duration timeout;
    private final Deque<CompletableFuture<KvResponse>> pending = new ArrayDeque<>();

    private Channel channel;
    // guarded by pending
    private boolean closed;

    private KvClient(EventLoopGroup group, Duration timeout) {
        this.group = group;
        this.timeout = timeout;
    }

    public static KvClient connect(String host, int port) throws IOException {
        return connect(host, port, null, DEFAULT_TIMEOUT);
    }

    /**
     * @param localAddress local address to bind before connecting, null for any
     * @param timeout      connect timeout and deadline of each blocking call
     */
    public static KvClient connect(String host, int port, InetSocketAddress localAddress, Duration timeout)
            throws IOException {
        EventLoopGroup group = new NioEventLoopGroup(1);
        KvClient client = new KvClient(group, timeout);

        Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis(timeout))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LineBasedFrameDecoder(ServerConfig.DEFAULT_MAX_FRAME_LENGTH));
                        p.addLast(new Utf8FrameDecoder());
                        p.addLast(new StringEncoder(StandardCharsets.UTF_8));
                        p.addLast(new ClientCodec());
                        p.addLast(client.new ResponseHandler());
                    }
                });

        InetSocketAddress remote = new InetSocketAddress(host, port);
        ChannelFuture f = (localAddress == null ? b.connect(remote) : b.connect(remote, localAddress))
                .awaitUninterruptibly();
        if (!f.isSuccess()) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            throw new IOException("Unable to connect to " + remote, f.cause());
        }
        client.channel = f.channel();
        return client;
    }

    static int connectTimeoutMillis(Duration timeout) {
        return (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE);
    }

    public void set(String key, String value) throws IOException {
        expect(call(KvRequest.set(key, value)), Operation.SET);
    }

    public Optional<String> get(String key) throws IOException {
        return expect(call(KvRequest.get(key)), Operation.GET).getValue();
    }

    public void delete(String key) throws IOException {
        expect(call(KvRequest.delete(key)), Operation.DELETE);
    }

    /**
     * Send without waiting. The returned future completes with the matching response or
     * fails when the connection closes first.
     */
    public CompletableFuture<KvResponse> send(KvRequest request) {
        CompletableFuture<KvResponse> future = new CompletableFuture<>();
        synchronized (pending) {
            if (closed) {
                future.completeExceptionally(new ClosedChannelException());
                return future;
            }
            pending.addLast(future);
            channel.writeAndFlush(request).addListener(w -> {
                if (!w.isSuccess()) {
                    future.completeExceptionally(w.cause());
                    channel.close();
                }
            });
        }
        return future;
    }

    private KvResponse call(KvRequest request) throws IOException {
        CompletableFuture<KvResponse> future = send(request);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted waiting for response to " + request);
        } catch (TimeoutException e) {
            throw new IOException("Timed out after " + timeout.toMillis() + "ms waiting for response to " + request);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw new IOException("Request " + request + " failed: " + cause, cause);
        }
    }

    private static KvResponse expect(KvResponse response, Operation operation) throws ProtocolException {
        if (response.getOperation() != operation) {
            throw new ProtocolException("Expected a " + operation.getWireName() + " response but got " + response);
        }
        return response;
    }

    public boolean isOpen() {
        return channel.isActive();
    }

    @Override
    public void close() {
        channel.close().syncUninterruptibly();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private void failPending(Throwable cause) {
        List<CompletableFuture<KvResponse>> failed;
        synchronized (pending) {
            closed = true;
            failed = new ArrayList<>(pending);
            pending.clear();
        }
        for (CompletableFuture<KvResponse> future : failed) {
            future.completeExceptionally(cause);
        }
    }

    private class ResponseHandler extends SimpleChannelInboundHandler<KvResponse> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, KvResponse response) {
            CompletableFuture<KvResponse> future;
            synchronized (pending) {
                future = pending.pollFirst();
            }
            if (future == null) {
                logger.warn("Unsolicited response {} from {}", response, ctx.channel().remoteAddress());
                return;
            }
            future.complete(response);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            failPending(new ClosedChannelException());
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            logger.debug("Connection to {} failed", ctx.channel().remoteAddress(), cause);
            failPending(cause);
            ctx.close();
        }
    }
}
