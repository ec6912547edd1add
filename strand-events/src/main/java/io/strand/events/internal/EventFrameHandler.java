// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events.internal;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.strand.core.InternalApi;
import io.strand.core.error.ConnectionException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Netty handler for one event stream: completes the WebSocket handshake, sends the
 * subscribe request and forwards text frames to a {@link WebSocketEventConnection}.
 *
 * <p>
 * A fresh handler is created for every connection attempt; the handshaker tracks
 * per-channel state and cannot be reused.
 */
@InternalApi
public final class EventFrameHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger log = LoggerFactory.getLogger(EventFrameHandler.class);

    private final WebSocketClientHandshaker handshaker;
    private final String subscribeRequest;
    private final WebSocketEventConnection connection;
    private ChannelPromise handshakeFuture;

    public EventFrameHandler(
            final WebSocketClientHandshaker handshaker,
            final String subscribeRequest,
            final WebSocketEventConnection connection) {
        this.handshaker = Objects.requireNonNull(handshaker, "handshaker");
        this.subscribeRequest = Objects.requireNonNull(subscribeRequest, "subscribeRequest");
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    /**
     * Completes once the handshake succeeded and the subscribe request was written.
     */
    public ChannelFuture handshakeFuture() {
        return handshakeFuture;
    }

    @Override
    public void handlerAdded(final ChannelHandlerContext ctx) {
        handshakeFuture = ctx.newPromise();
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) {
        if (!handshakeFuture.isDone()) {
            handshakeFuture.setFailure(new ConnectionException("Channel closed during WebSocket handshake"));
        }
        log.debug("Event stream channel {} inactive", ctx.channel());
        connection.onClosed(null);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Object msg) {
        Channel ch = ctx.channel();
        if (!handshaker.isHandshakeComplete()) {
            if (msg instanceof FullHttpResponse response) {
                try {
                    handshaker.finishHandshake(ch, response);
                    ch.writeAndFlush(new TextWebSocketFrame(subscribeRequest));
                    handshakeFuture.setSuccess();
                } catch (WebSocketHandshakeException e) {
                    handshakeFuture.setFailure(e);
                }
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException("Unexpected FullHttpResponse (status=" + response.status() + ")");
        }
        if (msg instanceof TextWebSocketFrame frame) {
            connection.onText(frame.text());
        } else if (msg instanceof PingWebSocketFrame ping) {
            ch.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
        } else if (msg instanceof CloseWebSocketFrame close) {
            log.debug("Server closed event stream: {} {}", close.statusCode(), close.reasonText());
            connection.onClosed(null);
            ch.close();
        }
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.warn("Event stream channel exception", cause);
        if (!handshakeFuture.isDone()) {
            handshakeFuture.setFailure(cause);
        }
        connection.onClosed(cause);
        ctx.close();
    }
}
