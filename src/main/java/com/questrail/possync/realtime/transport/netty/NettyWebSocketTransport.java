package com.questrail.possync.realtime.transport.netty;

import com.questrail.possync.realtime.transport.TransportSocket;
import com.questrail.possync.realtime.transport.TransportSocketListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyWebSocketTransport
 * =============================================================================
 * Netty-backed implementation of the {@link TransportSocket} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT decode
 * envelopes, classify closures or schedule reconnects.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code ByteBuf}, frames) MUST NOT escape
 * this package. Text frames are converted to {@code String} before they reach
 * the listener.
 *
 * <h2>Close reporting</h2>
 * The listener receives exactly one {@code onClose}:
 * <ul>
 *   <li>the peer's close frame code and reason, if one arrived</li>
 *   <li>the code passed to {@link #close} when the client closed first</li>
 *   <li>otherwise 1006 with the failure message (connect or handshake
 *       failure) or an empty reason (connection dropped)</li>
 * </ul>
 */
final class NettyWebSocketTransport implements TransportSocket
{
    private static final int NO_STATUS_RECEIVED = 1005;
    private static final int ABNORMAL_CLOSURE = 1006;

    private final URI address;
    private final List<String> subprotocols;
    private final TransportSocketListener listener;
    private final EventLoopGroup group;
    private final SslContext sslContext;
    private final int maxFramePayloadLength;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closeRequested = new AtomicBoolean(false);
    private final AtomicBoolean closeReported = new AtomicBoolean(false);

    private volatile Channel channel;
    private volatile boolean open;
    private volatile int peerCloseCode = -1;
    private volatile String peerCloseReason = "";
    private volatile int requestedCloseCode = -1;
    private volatile String requestedCloseReason = "";

    NettyWebSocketTransport(URI address,
                            List<String> subprotocols,
                            TransportSocketListener listener,
                            EventLoopGroup group,
                            SslContext sslContext,
                            int maxFramePayloadLength)
    {
        this.address = Objects.requireNonNull(address, "address");
        this.subprotocols = List.copyOf(subprotocols);
        this.listener = Objects.requireNonNull(listener, "listener");
        this.group = Objects.requireNonNull(group, "group");
        this.sslContext = sslContext;
        this.maxFramePayloadLength = maxFramePayloadLength;
    }

    @Override
    public void open()
    {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("TransportSocket is single-use");
        }

        String host = address.getHost();
        int port = port(address);

        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                address,
                WebSocketVersion.V13,
                subprotocols.isEmpty() ? null : String.join(",", subprotocols),
                true,
                new DefaultHttpHeaders(),
                maxFramePayloadLength);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(65536));
                        p.addLast(new SocketHandler(handshaker));
                    }
                });

        ChannelFuture connect = bootstrap.connect(host, port);
        channel = connect.channel();
        connect.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                listener.onError(future.cause());
                reportClose(ABNORMAL_CLOSURE, describe(future.cause()));
            }
            else if (closeRequested.get()) {
                // close() raced with connect; honour it now.
                future.channel().close();
            }
        });
    }

    @Override
    public boolean send(String text)
    {
        Objects.requireNonNull(text, "text");

        Channel ch = channel;
        if (!open || ch == null || !ch.isActive()) {
            return false;
        }
        ch.writeAndFlush(new TextWebSocketFrame(text));
        return true;
    }

    @Override
    public void close(int code, String reason)
    {
        if (!closeRequested.compareAndSet(false, true)) {
            return;
        }
        requestedCloseCode = code;
        requestedCloseReason = reason == null ? "" : reason;

        Channel ch = channel;
        if (ch == null) {
            reportClose(code, reason);
            return;
        }

        if (open && ch.isActive() && isSendableCode(code)) {
            ch.writeAndFlush(new CloseWebSocketFrame(code, reason == null ? "" : reason))
                    .addListener(ChannelFutureListener.CLOSE);
        }
        else {
            ch.close();
        }
    }

    @Override
    public boolean isOpen()
    {
        return open;
    }

    private void reportClose(int code, String reason)
    {
        open = false;
        if (closeReported.compareAndSet(false, true)) {
            listener.onClose(code, reason == null ? "" : reason);
        }
    }

    private static boolean isSendableCode(int code)
    {
        if (code < 1000 || code > 4999) {
            return false;
        }
        return code != 1005 && code != 1006 && code != 1015;
    }

    private static int port(URI uri)
    {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "wss".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    private static String describe(Throwable cause)
    {
        if (cause == null) {
            return "";
        }
        String message = cause.getMessage();
        return message == null ? cause.getClass().getSimpleName() : message;
    }

    /**
     * SocketHandler
     * -------------------------------------------------------------------------
     * Completes the handshake, then converts frames to listener callbacks.
     * Runs on the channel's event loop, so callbacks are serialized.
     */
    private final class SocketHandler extends SimpleChannelInboundHandler<Object>
    {
        private final WebSocketClientHandshaker handshaker;
        private String failure = "";

        SocketHandler(WebSocketClientHandshaker handshaker)
        {
            this.handshaker = handshaker;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            handshaker.handshake(ctx.channel());
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg)
        {
            Channel ch = ctx.channel();

            if (!handshaker.isHandshakeComplete()) {
                if (msg instanceof FullHttpResponse response) {
                    try {
                        handshaker.finishHandshake(ch, response);
                    }
                    catch (RuntimeException e) {
                        failure = describe(e);
                        listener.onError(e);
                        ch.close();
                        return;
                    }
                    open = true;
                    if (closeRequested.get()) {
                        ch.close();
                        return;
                    }
                    listener.onOpen();
                }
                return;
            }

            if (!(msg instanceof WebSocketFrame frame)) {
                return;
            }

            if (frame instanceof TextWebSocketFrame text) {
                listener.onMessage(text.text());
            }
            else if (frame instanceof PingWebSocketFrame) {
                ch.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
            }
            else if (frame instanceof CloseWebSocketFrame close) {
                int status = close.statusCode();
                peerCloseCode = status == -1 ? NO_STATUS_RECEIVED : status;
                peerCloseReason = status == -1 ? "" : close.reasonText();
                if (!closeRequested.get()) {
                    CloseWebSocketFrame echo = status == -1
                            ? new CloseWebSocketFrame()
                            : new CloseWebSocketFrame(status, "");
                    ch.writeAndFlush(echo).addListener(ChannelFutureListener.CLOSE);
                }
                else {
                    ch.close();
                }
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            int code = peerCloseCode;
            if (code > 0) {
                reportClose(code, peerCloseReason);
            }
            else if (closeRequested.get() && failure.isEmpty()) {
                reportClose(requestedCloseCode, requestedCloseReason);
            }
            else {
                reportClose(ABNORMAL_CLOSURE, failure);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (failure.isEmpty()) {
                failure = describe(cause);
            }
            listener.onError(cause);
            ctx.close();
        }
    }
}
