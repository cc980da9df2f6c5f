package com.bosdb.debugger.protocol.netty;

import com.bosdb.debugger.protocol.ProtocolServer;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges WebSocket text frames to a {@link ProtocolServer}. A channel becomes a
 * protocol client once its handshake completes.
 */
@ChannelHandler.Sharable
public class DebugWebSocketHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(DebugWebSocketHandler.class);

    static final AttributeKey<String> CLIENT_ID = AttributeKey.valueOf("debugClientId");

    private final ProtocolServer protocolServer;

    public DebugWebSocketHandler(ProtocolServer protocolServer) {
        this.protocolServer = protocolServer;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            String clientId = protocolServer.connect(new NettyClientConnection(ctx.channel()));
            ctx.channel().attr(CLIENT_ID).set(clientId);
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        String clientId = ctx.channel().attr(CLIENT_ID).get();
        if (clientId == null) {
            return;
        }
        protocolServer.onMessage(clientId, frame.text());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        String clientId = ctx.channel().attr(CLIENT_ID).getAndSet(null);
        if (clientId != null) {
            protocolServer.disconnect(clientId);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("[WebSocket] Closing {} after error", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }
}
