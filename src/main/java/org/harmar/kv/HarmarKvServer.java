package org.harmar.kv;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.harmar.kv.connection.AdmissionHandler;
import org.harmar.kv.connection.KvRequestHandler;
import org.harmar.kv.connection.KvServerInitializer;
import org.harmar.kv.security.ConnectionAdmission;
import org.harmar.kv.store.InMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key-value server: one listening socket, an admission gate in front of it and one
 * request handler per admitted connection, all sharing a single {@link InMemoryStore}.
 */
public class HarmarKvServer {
    private static final Logger logger = LoggerFactory.getLogger(HarmarKvServer.class);

    private final ServerConfig config;
    private final InMemoryStore store = new InMemoryStore();
    private final ConnectionAdmission admission;

    private volatile boolean isRunning;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private volatile Channel serverChannel;

    public HarmarKvServer(ServerConfig config) {
        this.config = config;
        this.admission = new ConnectionAdmission(config.getMaxConnectionsPerAddress(), config.getMaxConnections());
    }

    public synchronized void start() throws IOException {
        if (isRunning) return;

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .handler(new AdmissionHandler(admission))
                .childHandler(new KvServerInitializer(new KvRequestHandler(store), config.getMaxFrameLength()))
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        ChannelFuture f = b.bind(config.getHost(), config.getPort()).awaitUninterruptibly();
        if (!f.isSuccess()) {
            shutdownGroups();
            logger.error("Unable to bind {}:{}", config.getHost(), config.getPort(), f.cause());
            throw new IOException(String.format("Unable to bind %s:%d", config.getHost(), config.getPort()), f.cause());
        }

        serverChannel = f.channel();
        isRunning = true;
        logger.info("Listening on {} (max {} connection(s) per address, {} in total)",
                serverChannel.localAddress(), admission.maxPerAddress(), admission.maxTotal());
    }

    public synchronized void stop() {
        if (!isRunning) return;
        isRunning = false;

        serverChannel.close().syncUninterruptibly();
        shutdownGroups();

        logger.info("Server stopped");
    }

    private void shutdownGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).syncUninterruptibly();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).syncUninterruptibly();
        }
    }

    /**
     * block until the listening socket is closed
     */
    public void awaitTermination() throws InterruptedException {
        Channel channel = serverChannel;
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    public boolean isRunning() {
        return isRunning;
    }

    public InetSocketAddress localAddress() {
        Channel channel = serverChannel;
        return channel == null ? null : (InetSocketAddress) channel.localAddress();
    }

    public ConnectionAdmission admission() {
        return admission;
    }

    public InMemoryStore store() {
        return store;
    }

    public ServerConfig config() {
        return config;
    }
}
