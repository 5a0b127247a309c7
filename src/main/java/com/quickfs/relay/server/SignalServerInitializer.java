package com.quickfs.relay.server;

import com.quickfs.relay.session.SessionRegistry;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Per-connection pipeline: HTTP/1.1 until the upgrade, then WebSocket frames.
 */
class SignalServerInitializer extends ChannelInitializer<SocketChannel> {

    private static final int MAX_REQUEST_BYTES = 8192;

    private final SessionRegistry registry;
    private final Executor workers;
    private final int maxFrameSize;
    private final Duration sendTimeout;

    SignalServerInitializer(SessionRegistry registry, Executor workers, int maxFrameSize, Duration sendTimeout) {
        this.registry = registry;
        this.workers = workers;
        this.maxFrameSize = maxFrameSize;
        this.sendTimeout = sendTimeout;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline p = ch.pipeline();
        p.addLast("http-codec", new HttpServerCodec());
        p.addLast("http-aggregator", new HttpObjectAggregator(MAX_REQUEST_BYTES));
        p.addLast("signal-request", new SignalRequestHandler(registry, workers, maxFrameSize, sendTimeout));
    }
}
