package com.bosdb.debugger.protocol.netty;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;

public class DebugChannelInitializer extends ChannelInitializer<SocketChannel> {

    private static final int MAX_CONTENT_LENGTH = 65536;

    private final String path;
    private final DebugWebSocketHandler handler;

    public DebugChannelInitializer(String path, DebugWebSocketHandler handler) {
        this.path = path;
        this.handler = handler;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        ch.pipeline()
            .addLast(new HttpServerCodec())
            .addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH))
            .addLast(new WebSocketServerProtocolHandler(path, null, true))
            .addLast(handler);
    }
}
