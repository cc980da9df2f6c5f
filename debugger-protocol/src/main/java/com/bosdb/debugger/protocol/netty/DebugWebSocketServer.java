package com.bosdb.debugger.protocol.netty;

import com.bosdb.debugger.protocol.ProtocolServer;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * WebSocket transport for a {@link ProtocolServer}.
 */
public class DebugWebSocketServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DebugWebSocketServer.class);

    private final ProtocolServer protocolServer;
    private final int port;
    private final String path;
    private final int workerThreads;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public DebugWebSocketServer(ProtocolServer protocolServer, int port, String path) {
        this(protocolServer, port, path, 4);
    }

    public DebugWebSocketServer(ProtocolServer protocolServer, int port, String path, int workerThreads) {
        this.protocolServer = protocolServer;
        this.port = port;
        this.path = path;
        this.workerThreads = workerThreads;
    }

    /**
     * Bind and start accepting connections. Port 0 binds an ephemeral port.
     * @throws InterruptedException if interrupted while binding
     */
    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(workerThreads);

        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
            .channel(NioServerSocketChannel.class)
            .childHandler(new DebugChannelInitializer(path, new DebugWebSocketHandler(protocolServer)))
            .option(ChannelOption.SO_BACKLOG, 128)
            .childOption(ChannelOption.SO_KEEPALIVE, true);

        try {
            serverChannel = b.bind(port).sync().channel();
        } catch (Exception e) {
            shutdownGroups();
            throw e;
        }
        log.info("[WebSocket] Listening on ws://localhost:{}{}", getPort(), path);
    }

    /**
     * @return the bound port, or -1 if not started
     */
    public synchronized int getPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public synchronized void stop() {
        if (serverChannel == null) {
            return;
        }
        serverChannel.close().syncUninterruptibly();
        serverChannel = null;
        shutdownGroups();
        log.info("[WebSocket] Stopped");
    }

    private void shutdownGroups() {
        if (bossGroup != null && !bossGroup.isShuttingDown()) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null && !workerGroup.isShuttingDown()) {
            workerGroup.shutdownGracefully();
        }
    }

    @Override
    public void close() {
        stop();
    }
}
