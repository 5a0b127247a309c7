package com.quickfs.relay.server;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quickfs.relay.protocol.Message;
import com.quickfs.relay.protocol.MessageCodec;
import com.quickfs.relay.protocol.MessageType;
import com.quickfs.relay.session.SessionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs against a live server on an ephemeral port, using the JDK's
 * HTTP and WebSocket client as host and receiver.
 */
class SignalServerTest {

    private static final int TIMEOUT_S = 5;
    private static final String UPLOAD_QUERY = "filename=report.pdf&filetype=application/pdf&filesize=2048";
    private static final Duration SEND_TIMEOUT = Duration.ofMillis(500);

    private SignalServer server;
    private HttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new SignalServer("127.0.0.1", 0, SignalServer.DEFAULT_MAX_FRAME_SIZE,
                SEND_TIMEOUT, new SessionRegistry());
        server.start();
        client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(TIMEOUT_S))
                .build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    // --- Client helpers ---

    /** Collects complete text messages from a client WebSocket. */
    private static final class Peer implements WebSocket.Listener {
        final BlockingQueue<Message> received = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();
        WebSocket socket;

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                try {
                    received.add(MessageCodec.decode(partial.toString()));
                } catch (Exception e) {
                    throw new IllegalStateException("Server sent undecodable text: " + partial, e);
                } finally {
                    partial.setLength(0);
                }
            }
            webSocket.request(1);
            return null;
        }

        Message next() throws InterruptedException {
            Message m = received.poll(TIMEOUT_S, TimeUnit.SECONDS);
            assertNotNull(m, "Timed out waiting for a message");
            return m;
        }

        void send(Message message) throws Exception {
            socket.sendText(MessageCodec.encode(message), true).get(TIMEOUT_S, TimeUnit.SECONDS);
        }

        void close() throws Exception {
            socket.sendClose(WebSocket.NORMAL_CLOSURE, "").get(TIMEOUT_S, TimeUnit.SECONDS);
        }
    }

    private URI uri(String scheme, String pathAndQuery) {
        return URI.create(scheme + "://127.0.0.1:" + server.port() + pathAndQuery);
    }

    private Peer connect(String pathAndQuery) throws Exception {
        Peer peer = new Peer();
        peer.socket = client.newWebSocketBuilder()
                .buildAsync(uri("ws", pathAndQuery), peer)
                .get(TIMEOUT_S, TimeUnit.SECONDS);
        return peer;
    }

    private HttpResponse<String> get(String pathAndQuery) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri("http", pathAndQuery))
                .timeout(Duration.ofSeconds(TIMEOUT_S))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    /**
     * Join over a plain socket and then never read again. The small receive buffer makes
     * the server's writes back up quickly.
     */
    private Socket joinWithoutReading(String sessionId) throws Exception {
        Socket socket = new Socket();
        socket.setReceiveBufferSize(4096);
        socket.connect(new InetSocketAddress("127.0.0.1", server.port()), TIMEOUT_S * 1000);
        socket.setSoTimeout(TIMEOUT_S * 1000);

        OutputStream out = socket.getOutputStream();
        String request = "GET /api/join/" + sessionId + " HTTP/1.1\r\n"
                + "Host: 127.0.0.1:" + server.port() + "\r\n"
                + "Upgrade: websocket\r\n"
                + "Connection: Upgrade\r\n"
                + "Sec-WebSocket-Key: dGhlIHNhbXBsZSBub25jZQ==\r\n"
                + "Sec-WebSocket-Version: 13\r\n\r\n";
        out.write(request.getBytes(StandardCharsets.US_ASCII));
        out.flush();

        InputStream in = socket.getInputStream();
        ByteArrayOutputStream head = new ByteArrayOutputStream();
        while (!head.toString(StandardCharsets.US_ASCII).endsWith("\r\n\r\n")) {
            int b = in.read();
            assertNotEquals(-1, b, "Connection closed during handshake");
            head.write(b);
        }
        assertTrue(head.toString(StandardCharsets.US_ASCII).startsWith("HTTP/1.1 101"), head.toString());

        byte[] join = MessageCodec.encode(new Message(MessageType.JOIN_REQUEST, object().put("name", "Stalled")))
                .getBytes(StandardCharsets.UTF_8);
        assertTrue(join.length < 126);
        // Client frames must be masked; an all-zero key leaves the payload as is
        out.write(new byte[] {(byte) 0x81, (byte) (0x80 | join.length), 0, 0, 0, 0});
        out.write(join);
        out.flush();
        return socket;
    }

    private static ObjectNode object() {
        return MessageCodec.mapper().createObjectNode();
    }

    private void awaitGone(String sessionId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TIMEOUT_S * 1000L;
        while (server.registry().lookup(sessionId) != null && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertNull(server.registry().lookup(sessionId), "Session should be removed");
    }

    // --- Tests ---

    @Test
    void fullSignalingExchange() throws Exception {
        Peer host = connect("/api/upload?" + UPLOAD_QUERY);
        Message created = host.next();
        assertEquals("upload_created", created.type());
        String sessionId = created.payload().get("id").asText();
        assertTrue(sessionId.matches("[0-9a-f]{8}"));

        Peer receiver = connect("/api/join/" + sessionId);
        receiver.send(new Message(MessageType.JOIN_REQUEST, object().put("name", "Alex")));

        Message meta = receiver.next();
        assertEquals("file_metadata", meta.type());
        assertEquals("report.pdf", meta.payload().get("filename").asText());
        assertEquals("application/pdf", meta.payload().get("filetype").asText());
        assertEquals(2048, meta.payload().get("filesize").asLong());

        Message update = host.next();
        assertEquals("receivers_update", update.type());
        assertEquals(1, update.payload().size());
        String receiverId = update.payload().get(0).get("id").asText();
        assertEquals("Alex", update.payload().get(0).get("name").asText());

        ObjectNode offer = object();
        offer.put("receiver_id", receiverId);
        offer.putObject("offer").put("type", "offer").put("sdp", "v=0");
        host.send(new Message(MessageType.WEBRTC_OFFER, offer));

        Message gotOffer = receiver.next();
        assertEquals("webrtc_offer", gotOffer.type());
        assertEquals("host", gotOffer.payload().get("sender_id").asText());
        assertEquals("v=0", gotOffer.payload().get("offer").get("sdp").asText());

        ObjectNode answer = object();
        answer.putObject("answer").put("type", "answer").put("sdp", "v=0 answer");
        receiver.send(new Message(MessageType.WEBRTC_ANSWER, answer));

        Message gotAnswer = host.next();
        assertEquals("webrtc_answer", gotAnswer.type());
        assertEquals(receiverId, gotAnswer.payload().get("receiver_id").asText());
        assertEquals("v=0 answer", gotAnswer.payload().get("answer").get("sdp").asText());

        ObjectNode hostCandidate = object();
        hostCandidate.put("peer_id", receiverId);
        hostCandidate.putObject("candidate").put("candidate", "candidate:1 1 udp 1 10.0.0.1 9 typ host");
        host.send(new Message(MessageType.WEBRTC_ICE_CANDIDATE, hostCandidate));

        Message atReceiver = receiver.next();
        assertEquals("webrtc_ice_candidate", atReceiver.type());
        assertEquals("host", atReceiver.payload().get("peer_id").asText());

        ObjectNode receiverCandidate = object();
        receiverCandidate.putObject("candidate").put("candidate", "candidate:2 1 udp 1 10.0.0.2 9 typ host");
        receiver.send(new Message(MessageType.WEBRTC_ICE_CANDIDATE, receiverCandidate));

        Message atHost = host.next();
        assertEquals(receiverId, atHost.payload().get("peer_id").asText());

        receiver.close();
        Message afterLeave = host.next();
        assertEquals("receivers_update", afterLeave.type());
        assertEquals(0, afterLeave.payload().size());

        host.close();
        awaitGone(sessionId);
    }

    @Test
    void getReceiversOverTheWire() throws Exception {
        Peer host = connect("/api/upload?" + UPLOAD_QUERY);
        host.next();

        host.send(new Message(MessageType.GET_RECEIVERS, MessageCodec.mapper().nullNode()));
        Message update = host.next();
        assertEquals("receivers_update", update.type());
        assertTrue(update.payload().isArray());
        assertEquals(0, update.payload().size());
        host.close();
    }

    @Test
    void missingParametersRejected() throws Exception {
        HttpResponse<String> response = get("/api/upload?filename=report.pdf");
        assertEquals(400, response.statusCode());
        assertTrue(response.body().startsWith("Missing required query parameters"));
        assertEquals(0, server.registry().size());
    }

    @Test
    void nonNumericFilesizeRejected() throws Exception {
        HttpResponse<String> response = get("/api/upload?filename=a&filetype=b&filesize=big");
        assertEquals(400, response.statusCode());
        assertEquals("Invalid filesize parameter", response.body().trim());
    }

    @Test
    void plainHttpUploadCannotUpgrade() throws Exception {
        HttpResponse<String> response = get("/api/upload?" + UPLOAD_QUERY);
        assertEquals(400, response.statusCode());
        assertEquals("Could not upgrade connection", response.body().trim());
        assertEquals(0, server.registry().size());
    }

    @Test
    void uploadRequiresGet() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri("http", "/api/upload?" + UPLOAD_QUERY))
                .timeout(Duration.ofSeconds(TIMEOUT_S))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        assertEquals(405, response.statusCode());
    }

    @Test
    void unknownPathNotFound() throws Exception {
        assertEquals(404, get("/api/other").statusCode());
        assertEquals(404, get("/api/join/").statusCode());
    }

    @Test
    void joinUnknownSessionNotFound() throws Exception {
        assertEquals(404, get("/api/join/deadbeef").statusCode());

        ExecutionException e = assertThrows(ExecutionException.class, () -> connect("/api/join/deadbeef"));
        assertTrue(e.getCause() instanceof WebSocketHandshakeException, "Cause: " + e.getCause());
        assertEquals(404, ((WebSocketHandshakeException) e.getCause()).getResponse().statusCode());
    }

    @Test
    void hostDisconnectEndsSession() throws Exception {
        Peer host = connect("/api/upload?" + UPLOAD_QUERY);
        String sessionId = host.next().payload().get("id").asText();
        assertNotNull(server.registry().lookup(sessionId));

        host.close();
        awaitGone(sessionId);

        assertEquals(404, get("/api/join/" + sessionId).statusCode());
    }

    @Test
    void receiverThatStopsReadingIsDisconnected() throws Exception {
        Peer host = connect("/api/upload?" + UPLOAD_QUERY);
        String sessionId = host.next().payload().get("id").asText();

        try (Socket stalled = joinWithoutReading(sessionId)) {
            Message joined = host.next();
            assertEquals(1, joined.payload().size());
            String stalledId = joined.payload().get(0).get("id").asText();

            String padding = "a".repeat(50_000);
            for (int i = 0; i < 400; i++) {
                ObjectNode offer = object();
                offer.put("receiver_id", stalledId);
                offer.putObject("offer").put("type", "offer").put("sdp", padding);
                host.send(new Message(MessageType.WEBRTC_OFFER, offer));
            }

            long deadline = System.currentTimeMillis() + TIMEOUT_S * 1000L;
            while (server.registry().lookup(sessionId).receiverCount() > 0
                    && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertEquals(0, server.registry().lookup(sessionId).receiverCount(), "Stalled receiver evicted");

            // At most one of these is the departure notice; the other proves the host loop is live
            host.received.clear();
            host.send(new Message(MessageType.GET_RECEIVERS, MessageCodec.mapper().nullNode()));
            host.send(new Message(MessageType.GET_RECEIVERS, MessageCodec.mapper().nullNode()));
            for (int i = 0; i < 2; i++) {
                Message update = host.next();
                assertEquals("receivers_update", update.type());
                assertEquals(0, update.payload().size());
            }
        }

        host.close();
        awaitGone(sessionId);
        assertEquals(404, get("/api/join/" + sessionId).statusCode());
    }
}
