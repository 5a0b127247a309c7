package com.quickfs.relay.server;

import com.quickfs.relay.net.HostHandler;
import com.quickfs.relay.net.ReceiverHandler;
import com.quickfs.relay.session.FileMetadata;
import com.quickfs.relay.session.InvalidRequestException;
import com.quickfs.relay.session.Session;
import com.quickfs.relay.session.SessionRegistry;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshakerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Routes the HTTP request that opens a connection, validates it, and upgrades the
 * channel to WebSocket.
 *
 * <pre>
 * GET /api/upload?filename=&amp;filetype=&amp;filesize=   → host session
 * GET /api/join/{id}                                 → receiver join
 * </pre>
 *
 * Every rejection (bad parameters, unknown session, failed upgrade) is answered with an
 * HTTP status before any session or receiver state exists. After a successful upgrade
 * this handler replaces itself with a {@link WebSocketFrameHandler} and hands the
 * connection to a worker thread.
 */
class SignalRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(SignalRequestHandler.class);

    static final String UPLOAD_PATH = "/api/upload";
    static final String JOIN_PREFIX = "/api/join/";

    private final SessionRegistry registry;
    private final Executor workers;
    private final int maxFrameSize;
    private final Duration sendTimeout;

    SignalRequestHandler(SessionRegistry registry, Executor workers, int maxFrameSize, Duration sendTimeout) {
        this.registry = registry;
        this.workers = workers;
        this.maxFrameSize = maxFrameSize;
        this.sendTimeout = sendTimeout;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        if (!req.decoderResult().isSuccess()) {
            sendError(ctx, HttpResponseStatus.BAD_REQUEST, "Malformed request");
            return;
        }

        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        String path = query.path();

        if (UPLOAD_PATH.equals(path)) {
            if (requireGet(ctx, req)) {
                handleUpload(ctx, req, query);
            }
        } else if (path.startsWith(JOIN_PREFIX) && isSegment(path.substring(JOIN_PREFIX.length()))) {
            if (requireGet(ctx, req)) {
                handleJoin(ctx, req, path.substring(JOIN_PREFIX.length()));
            }
        } else {
            sendError(ctx, HttpResponseStatus.NOT_FOUND, "Not found");
        }
    }

    private void handleUpload(ChannelHandlerContext ctx, FullHttpRequest req, QueryStringDecoder query) {
        FileMetadata metadata;
        try {
            metadata = FileMetadata.fromQuery(query.parameters());
        } catch (InvalidRequestException e) {
            log.debug("Rejected upload from {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            sendError(ctx, HttpResponseStatus.BAD_REQUEST, e.getMessage());
            return;
        }

        upgrade(ctx, req, connection -> {
            Session session;
            try {
                session = registry.create(metadata, connection);
            } catch (IllegalStateException e) {
                log.warn("Cannot create session for {}: {}", connection.remoteAddress(), e.getMessage());
                connection.close();
                return;
            }
            try {
                workers.execute(new HostHandler(registry, session));
            } catch (RejectedExecutionException e) {
                log.debug("Server shutting down, dropping session '{}'", session.id());
                registry.remove(session);
                connection.close();
            }
        });
    }

    private void handleJoin(ChannelHandlerContext ctx, FullHttpRequest req, String sessionId) {
        Session session = registry.lookup(sessionId);
        if (session == null || session.isTornDown()) {
            log.debug("Join from {} for unknown session '{}'", ctx.channel().remoteAddress(), sessionId);
            sendError(ctx, HttpResponseStatus.NOT_FOUND, "Upload not found");
            return;
        }

        upgrade(ctx, req, connection -> {
            try {
                workers.execute(new ReceiverHandler(session, connection, registry.receiverIds()));
            } catch (RejectedExecutionException e) {
                log.debug("Server shutting down, dropping receiver {}", connection.remoteAddress());
                connection.close();
            }
        });
    }

    /**
     * Perform the WebSocket handshake. {@code onOpen} runs once the 101 response has been
     * written; on any failure the client gets a 4xx and {@code onOpen} never runs.
     */
    private void upgrade(ChannelHandlerContext ctx, FullHttpRequest req, Consumer<WebSocketConnection> onOpen) {
        if (!isWebSocketUpgrade(req)) {
            sendError(ctx, HttpResponseStatus.BAD_REQUEST, "Could not upgrade connection");
            return;
        }

        WebSocketServerHandshakerFactory factory =
                new WebSocketServerHandshakerFactory(webSocketUrl(req), null, false, maxFrameSize);
        WebSocketServerHandshaker handshaker = factory.newHandshaker(req);
        if (handshaker == null) {
            WebSocketServerHandshakerFactory.sendUnsupportedVersionResponse(ctx.channel());
            return;
        }

        Channel channel = ctx.channel();
        WebSocketConnection connection = new WebSocketConnection(channel, sendTimeout);
        try {
            handshaker.handshake(channel, req).addListener((ChannelFutureListener) future -> {
                if (future.isSuccess()) {
                    onOpen.accept(connection);
                } else {
                    log.debug("Handshake with {} failed: {}", channel.remoteAddress(), future.cause().toString());
                    connection.onClosed();
                    channel.close();
                }
            });
        } catch (WebSocketHandshakeException e) {
            log.debug("Could not upgrade {}: {}", channel.remoteAddress(), e.getMessage());
            sendError(ctx, HttpResponseStatus.BAD_REQUEST, "Could not upgrade connection");
            return;
        }

        ChannelPipeline pipeline = ctx.pipeline();
        pipeline.replace(this, "ws-frames", new WebSocketFrameHandler(connection));
        pipeline.addBefore("ws-frames", "ws-aggregator", new WebSocketFrameAggregator(maxFrameSize));
    }

    private boolean requireGet(ChannelHandlerContext ctx, FullHttpRequest req) {
        if (HttpMethod.GET.equals(req.method())) {
            return true;
        }
        sendError(ctx, HttpResponseStatus.METHOD_NOT_ALLOWED, "Method not allowed");
        return false;
    }

    private static boolean isSegment(String s) {
        return !s.isEmpty() && s.indexOf('/') < 0;
    }

    private static boolean isWebSocketUpgrade(FullHttpRequest req) {
        return req.headers().containsValue(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true)
                && req.headers().contains(HttpHeaderNames.SEC_WEBSOCKET_KEY);
    }

    private static String webSocketUrl(FullHttpRequest req) {
        return "ws://" + req.headers().get(HttpHeaderNames.HOST, "localhost") + req.uri();
    }

    private static void sendError(ChannelHandlerContext ctx, HttpResponseStatus status, String message) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
                Unpooled.copiedBuffer(message + "\n", StandardCharsets.UTF_8));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=utf-8");
        HttpUtil.setContentLength(response, response.content().readableBytes());
        HttpUtil.setKeepAlive(response, false);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("Request from {} failed: {}", ctx.channel().remoteAddress(), cause.toString());
        ctx.close();
    }
}
