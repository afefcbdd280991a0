package com.questrail.possync.realtime.transport.netty;

import com.questrail.possync.realtime.transport.TransportSocket;
import com.questrail.possync.realtime.transport.TransportSocketListener;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the Netty client against an in-process Netty WebSocket server on the
 * loopback interface. The server echoes text frames, and closes with 4001 when
 * it receives {@code "kick"}.
 */
final class NettyWebSocketTransportIntegrationTest {

    private EventLoopGroup serverGroup;
    private Channel serverChannel;
    private NettyWebSocketTransportFactory factory;
    private int port;

    private static final class RecordingListener implements TransportSocketListener {
        final CountDownLatch opened = new CountDownLatch(1);
        final CountDownLatch closed = new CountDownLatch(1);
        final CountDownLatch message = new CountDownLatch(1);
        final List<String> messages = new CopyOnWriteArrayList<>();
        volatile int closeCode = -1;
        volatile String closeReason;

        @Override
        public void onOpen() {
            opened.countDown();
        }

        @Override
        public void onMessage(String text) {
            messages.add(text);
            message.countDown();
        }

        @Override
        public void onClose(int code, String reason) {
            closeCode = code;
            closeReason = reason;
            closed.countDown();
        }

        @Override
        public void onError(Throwable cause) {
        }
    }

    private static final class EchoHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
            if ("kick".equals(frame.text())) {
                ctx.writeAndFlush(new CloseWebSocketFrame(4001, "unauthorized"))
                        .addListener(ChannelFutureListener.CLOSE);
                return;
            }
            ctx.writeAndFlush(new TextWebSocketFrame(frame.text()));
        }
    }

    @BeforeEach
    void setUp() throws InterruptedException {
        serverGroup = new NioEventLoopGroup(1);
        WebSocketServerProtocolConfig config = WebSocketServerProtocolConfig.newBuilder()
                .websocketPath("/ws/pos")
                .subprotocols("token")
                .checkStartsWith(true)
                .build();

        serverChannel = new ServerBootstrap()
                .group(serverGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new HttpServerCodec());
                        ch.pipeline().addLast(new HttpObjectAggregator(65536));
                        ch.pipeline().addLast(new WebSocketServerProtocolHandler(config));
                        ch.pipeline().addLast(new EchoHandler());
                    }
                })
                .bind(new InetSocketAddress("127.0.0.1", 0))
                .sync()
                .channel();
        port = ((InetSocketAddress) serverChannel.localAddress()).getPort();

        factory = new NettyWebSocketTransportFactory();
    }

    @AfterEach
    void tearDown() {
        factory.shutdown();
        serverChannel.close().awaitUninterruptibly(2, TimeUnit.SECONDS);
        serverGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly(5, TimeUnit.SECONDS);
    }

    private URI address() {
        return URI.create("ws://127.0.0.1:" + port + "/ws/pos/r-1?user_id=u-1");
    }

    @Test
    void opensExchangesTextAndClosesNormally() throws InterruptedException {
        RecordingListener listener = new RecordingListener();
        TransportSocket socket = factory.create(address(), List.of("token", "dG9rLTE"), listener);

        socket.open();
        assertTrue(listener.opened.await(5, TimeUnit.SECONDS), "socket should open");
        assertTrue(socket.isOpen());

        assertTrue(socket.send("{\"type\":\"ping\"}"));
        assertTrue(listener.message.await(5, TimeUnit.SECONDS), "echo should arrive");
        assertEquals("{\"type\":\"ping\"}", listener.messages.get(0));

        socket.close(1000, "Client disconnect");
        assertTrue(listener.closed.await(5, TimeUnit.SECONDS), "close should be reported");
        assertEquals(1000, listener.closeCode);
        assertFalse(socket.isOpen());
        assertFalse(socket.send("late"));
    }

    @Test
    void serverCloseCodeAndReasonAreReported() throws InterruptedException {
        RecordingListener listener = new RecordingListener();
        TransportSocket socket = factory.create(address(), List.of("token", "dG9rLTE"), listener);

        socket.open();
        assertTrue(listener.opened.await(5, TimeUnit.SECONDS));
        socket.send("kick");

        assertTrue(listener.closed.await(5, TimeUnit.SECONDS));
        assertEquals(4001, listener.closeCode);
        assertEquals("unauthorized", listener.closeReason);
    }

    @Test
    void refusedConnectionIsReportedAsAbnormalClose() throws InterruptedException, IOException {
        int unused;
        try (ServerSocket reserved = new ServerSocket(0)) {
            unused = reserved.getLocalPort();
        }

        RecordingListener listener = new RecordingListener();
        TransportSocket socket = factory.create(URI.create("ws://127.0.0.1:" + unused + "/ws/pos/r-1"),
                List.of("token"), listener);

        socket.open();

        assertTrue(listener.closed.await(5, TimeUnit.SECONDS));
        assertEquals(1006, listener.closeCode);
        assertEquals(1, listener.opened.getCount());
    }

    @Test
    void socketIsSingleUse() throws InterruptedException {
        RecordingListener listener = new RecordingListener();
        TransportSocket socket = factory.create(address(), List.of("token"), listener);

        socket.open();
        assertThrows(IllegalStateException.class, socket::open);

        socket.close(1000, "");
        assertTrue(listener.closed.await(5, TimeUnit.SECONDS));
    }

    @Test
    void nonWebSocketSchemeIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> factory.create(URI.create("http://127.0.0.1:" + port + "/ws/pos/r-1"),
                        List.of("token"), new RecordingListener()));
    }
}
