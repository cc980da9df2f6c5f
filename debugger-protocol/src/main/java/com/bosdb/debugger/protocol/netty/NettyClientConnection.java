package com.bosdb.debugger.protocol.netty;

import com.bosdb.debugger.protocol.ClientConnection;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

final class NettyClientConnection implements ClientConnection {

    private final Channel channel;

    NettyClientConnection(Channel channel) {
        this.channel = channel;
    }

    @Override
    public void send(String text) {
        channel.writeAndFlush(new TextWebSocketFrame(text));
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }
}
