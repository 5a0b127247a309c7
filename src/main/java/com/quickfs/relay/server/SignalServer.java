package com.quickfs.relay.server;

import com.quickfs.relay.session.SessionRegistry;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * WebSocket signaling server.
 *
 * Netty event loops handle HTTP parsing, the upgrade, and frame I/O. Every upgraded
 * connection then gets its own worker thread running a blocking
 * {@link com.quickfs.relay.net.HostHandler} or {@link com.quickfs.relay.net.ReceiverHandler}
 * loop. The pool is unbounded; one thread per live connection.
 */
public class SignalServer {

    private static final Logger log = LoggerFactory.getLogger(SignalServer.class);

    public static final int DEFAULT_PORT = 3000;
    public static final int DEFAULT_MAX_FRAME_SIZE = 65536;

    private final String bindAddress;
    private final int port;
    private final int maxFrameSize;
    private final Duration sendTimeout;
    private final SessionRegistry registry;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ExecutorService handlers;
    private Channel serverChannel;

    public SignalServer(String bindAddress, int port, int maxFrameSize, SessionRegistry registry) {
        this(bindAddress, port, maxFrameSize, WebSocketConnection.DEFAULT_SEND_TIMEOUT, registry);
    }

    /**
     * @param sendTimeout how long a write may wait on a peer that is not reading before
     *                    that peer is disconnected
     */
    public SignalServer(String bindAddress, int port, int maxFrameSize, Duration sendTimeout,
                        SessionRegistry registry) {
        this.bindAddress = bindAddress;
        this.port = port;
        this.maxFrameSize = maxFrameSize;
        this.sendTimeout = sendTimeout;
        this.registry = registry;
    }

    /**
     * Bind and start accepting connections. Returns once the socket is bound.
     */
    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Server already started");
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        handlers = Executors.newCachedThreadPool(new ConnectionThreadFactory());

        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new SignalServerInitializer(registry, handlers, maxFrameSize, sendTimeout));
            serverChannel = bootstrap.bind(bindAddress, port).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IOException("Interrupted while binding " + bindAddress + ":" + port, e);
        } catch (Exception e) {
            stop();
            throw new IOException("Cannot bind " + bindAddress + ":" + port + ": " + e.getMessage(), e);
        }
        log.info("Signaling server listening on {}:{}", bindAddress, port());
    }

    /** Block until the server channel closes. */
    public void awaitTermination() throws InterruptedException {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.closeFuture().await();
        }
    }

    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
        if (handlers != null) {
            // Interrupts blocked read loops; they exit through their normal cleanup
            handlers.shutdownNow();
        }
        log.info("Signaling server stopped");
    }

    /** Bound port (differs from the configured one when that was 0). */
    public int port() {
        Channel ch = serverChannel;
        if (ch != null && ch.localAddress() instanceof InetSocketAddress) {
            return ((InetSocketAddress) ch.localAddress()).getPort();
        }
        return port;
    }

    public SessionRegistry registry() {
        return registry;
    }

    private static final class ConnectionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "signal-conn-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
