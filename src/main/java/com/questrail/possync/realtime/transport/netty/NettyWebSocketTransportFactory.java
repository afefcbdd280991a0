package com.questrail.possync.realtime.transport.netty;

import com.questrail.possync.realtime.transport.TransportSocket;
import com.questrail.possync.realtime.transport.TransportSocketFactory;
import com.questrail.possync.realtime.transport.TransportSocketListener;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Creates {@link NettyWebSocketTransport}s that share one event loop group and
 * one client TLS context.
 *
 * <p>The factory owns the group; {@link #shutdown()} releases it. Sockets
 * created afterwards fail to connect.</p>
 */
public final class NettyWebSocketTransportFactory implements TransportSocketFactory
{
    public static final int DEFAULT_MAX_FRAME_PAYLOAD = 1 << 20;

    private final EventLoopGroup group;
    private final SslContext sslContext;
    private final int maxFramePayloadLength;

    public NettyWebSocketTransportFactory()
    {
        this(DEFAULT_MAX_FRAME_PAYLOAD);
    }

    public NettyWebSocketTransportFactory(int maxFramePayloadLength)
    {
        if (maxFramePayloadLength <= 0) {
            throw new IllegalArgumentException("maxFramePayloadLength must be positive");
        }
        this.maxFramePayloadLength = maxFramePayloadLength;
        this.group = new NioEventLoopGroup(1);
        this.sslContext = clientTls();
    }

    @Override
    public TransportSocket create(URI address, List<String> subprotocols, TransportSocketListener listener)
    {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(subprotocols, "subprotocols");

        String scheme = address.getScheme();
        boolean secure = "wss".equalsIgnoreCase(scheme);
        if (!secure && !"ws".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Not a WebSocket address: " + address);
        }

        return new NettyWebSocketTransport(address, subprotocols, listener, group,
                secure ? sslContext : null, maxFramePayloadLength);
    }

    /**
     * Shuts down the event loop group and waits briefly for it to terminate.
     */
    public void shutdown()
    {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly(5, TimeUnit.SECONDS);
    }

    private static SslContext clientTls()
    {
        try {
            return SslContextBuilder.forClient().build();
        }
        catch (SSLException e) {
            throw new IllegalStateException("Unable to initialise client TLS context", e);
        }
    }
}
