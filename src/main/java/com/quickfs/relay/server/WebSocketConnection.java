package com.quickfs.relay.server;

import com.quickfs.relay.net.SignalConnection;
import com.quickfs.relay.protocol.Message;
import com.quickfs.relay.protocol.MessageCodec;
import com.quickfs.relay.protocol.MessageException;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link SignalConnection} over an upgraded Netty channel.
 *
 * The event loop pushes text frames into an inbound queue ({@link #onText}); the
 * connection's handler thread drains it with a blocking {@link #receive()}. Socket reads
 * pause while {@link #HIGH_WATER} frames are waiting and resume once the handler has
 * drained the queue to {@link #LOW_WATER}.
 *
 * Sends are written through the channel and awaited for at most the send timeout, so
 * they must never be called from the event loop. A peer that does not take a message
 * within the timeout is disconnected.
 */
public class WebSocketConnection implements SignalConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConnection.class);

    public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(5);

    static final int HIGH_WATER = 64;
    static final int LOW_WATER = 16;

    /** Queue entry; {@link #END} marks the end of the stream. */
    private record Inbound(String text) {}

    private static final Inbound END = new Inbound(null);

    private final Channel channel;
    private final long sendTimeoutMillis;
    private final BlockingQueue<Inbound> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean ended = new AtomicBoolean(false);

    public WebSocketConnection(Channel channel) {
        this(channel, DEFAULT_SEND_TIMEOUT);
    }

    public WebSocketConnection(Channel channel, Duration sendTimeout) {
        this.channel = channel;
        this.sendTimeoutMillis = sendTimeout.toMillis();
    }

    // --- Event loop side ---

    void onText(String text) {
        if (ended.get()) {
            return;
        }
        inbound.add(new Inbound(text));
        if (inbound.size() >= HIGH_WATER && channel.config().isAutoRead()) {
            log.debug("Pausing reads from {}: {} messages queued", remoteAddress(), inbound.size());
            channel.config().setAutoRead(false);
        }
    }

    void onClosed() {
        if (ended.compareAndSet(false, true)) {
            inbound.add(END);
        }
    }

    // --- Handler thread side ---

    @Override
    public Message receive() throws IOException, MessageException {
        Inbound next = inbound.poll();
        if (next == null) {
            // Never block with reads paused
            resumeReads();
            try {
                next = inbound.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while waiting for a message");
            }
        } else if (inbound.size() <= LOW_WATER) {
            resumeReads();
        }
        if (next == END) {
            // Leave the marker for any later receive()
            inbound.add(END);
            throw new ClosedChannelException();
        }
        return MessageCodec.decode(next.text());
    }

    private void resumeReads() {
        if (!ended.get() && !channel.config().isAutoRead()) {
            channel.config().setAutoRead(true);
        }
    }

    @Override
    public void send(Message message) throws IOException {
        if (!channel.isActive()) {
            throw new ClosedChannelException();
        }
        ChannelFuture future = channel.writeAndFlush(new TextWebSocketFrame(MessageCodec.encode(message)));
        boolean done;
        try {
            done = future.await(sendTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while writing to " + remoteAddress());
        }
        if (!done) {
            log.debug("{} took no data for {} ms, disconnecting", remoteAddress(), sendTimeoutMillis);
            abort();
            throw new IOException("Write to " + remoteAddress() + " timed out after " + sendTimeoutMillis + " ms");
        }
        if (!future.isSuccess()) {
            throw new IOException("Write to " + remoteAddress() + " failed", future.cause());
        }
    }

    @Override
    public void close() {
        onClosed();
        if (channel.isActive()) {
            channel.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
        } else {
            channel.close();
        }
    }

    /** Drop the channel without a close handshake; pending writes fail. */
    private void abort() {
        onClosed();
        channel.close();
    }

    @Override
    public boolean isOpen() {
        return !ended.get() && channel.isActive();
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(channel.remoteAddress());
    }
}
