package com.skein.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skein.config.PipelineConfig;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relay transport over the JDK WebSocket client, reading JSON text frames from
 * {@code {relay}/xrpc/com.atproto.sync.subscribeRepos}.
 *
 * <p>Reads are demand driven: the listener requests one message at a time and only asks
 * for the next after {@link RelayStream#next()} has taken the previous one, so a slow
 * consumer slows the socket instead of growing a buffer.</p>
 *
 * <p>A text frame that does not decode, or a binary frame, is handed on as an
 * {@linkplain RelayMessage#undecodable undecodable} message rather than failing the
 * connection, since the relay would only send it again after a reconnect.</p>
 */
@Slf4j
public class WebSocketRelayTransport implements RelayTransport {

    static final String SUBSCRIBE_PATH = "/xrpc/com.atproto.sync.subscribeRepos";

    private final String relayUrl;
    private final Duration connectTimeout;
    private final Duration idleTimeout;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public WebSocketRelayTransport(PipelineConfig.RelaySection relay, ObjectMapper objectMapper) {
        this.relayUrl = stripTrailingSlash(relay.getUrl());
        this.connectTimeout = Duration.ofMillis(relay.getConnectTimeoutMs());
        this.idleTimeout = Duration.ofMillis(relay.getIdleTimeoutMs());
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public RelayStream connect(OptionalLong cursor) throws ConnectionLostException {
        URI uri = subscriptionUri(cursor);
        log.info("Connecting to relay uri={}", uri);

        SignalListener listener = new SignalListener();
        try {
            WebSocket webSocket = httpClient.newWebSocketBuilder()
                    .connectTimeout(connectTimeout)
                    .buildAsync(uri, listener)
                    .get(connectTimeout.toMillis() * 2, TimeUnit.MILLISECONDS);
            return new WebSocketRelayStream(webSocket, listener);
        } catch (ExecutionException e) {
            throw new ConnectionLostException("Could not connect to " + uri, e.getCause());
        } catch (TimeoutException e) {
            throw new ConnectionLostException("Timed out connecting to " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionLostException("Interrupted while connecting to " + uri, e);
        }
    }

    URI subscriptionUri(OptionalLong cursor) {
        StringBuilder sb = new StringBuilder(relayUrl).append(SUBSCRIBE_PATH);
        cursor.ifPresent(c -> sb.append("?cursor=").append(c));
        return URI.create(sb.toString());
    }

    private static String stripTrailingSlash(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("skein.relay.url is required");
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Decodes one text frame.  When the JSON does not map onto {@link RelayMessage} the
     * sequence is still read from the raw tree if it is there.
     */
    RelayMessage decode(String text) {
        try {
            return objectMapper.readValue(text, RelayMessage.class);
        } catch (JsonProcessingException e) {
            Long seq = sequenceOf(text);
            log.debug("Undecodable frame seq={}: {}", seq, e.getOriginalMessage());
            return RelayMessage.undecodable(seq, "unparseable frame: " + e.getOriginalMessage());
        }
    }

    private Long sequenceOf(String text) {
        try {
            JsonNode seq = objectMapper.readTree(text).path("seq");
            return seq.canConvertToLong() ? seq.asLong() : null;
        } catch (JsonProcessingException e) {
            log.debug("Frame is not JSON at all: {}", e.getOriginalMessage());
            return null;
        }
    }

    // ── Listener ─────────────────────────────────────────────────────────

    /** What the listener hands to the reading thread. */
    private static final class Signal {
        final String text;
        final Throwable error;
        final String closeReason;
        final boolean binary;

        private Signal(String text, Throwable error, String closeReason, boolean binary) {
            this.text = text;
            this.error = error;
            this.closeReason = closeReason;
            this.binary = binary;
        }

        static Signal text(String text) {
            return new Signal(text, null, null, false);
        }

        static Signal binary() {
            return new Signal(null, null, null, true);
        }

        static Signal error(Throwable error) {
            return new Signal(null, error, null, false);
        }

        static Signal closed(String reason) {
            return new Signal(null, null, reason, false);
        }
    }

    private static final class SignalListener implements WebSocket.Listener {

        private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                signals.add(Signal.text(partial.toString()));
                partial.setLength(0);
            } else {
                // rest of the same message
                webSocket.request(1);
            }
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            if (last) {
                signals.add(Signal.binary());
            } else {
                webSocket.request(1);
            }
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            signals.add(Signal.closed("code=" + statusCode + " reason=" + reason));
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            signals.add(Signal.error(error));
        }
    }

    // ── Stream ───────────────────────────────────────────────────────────

    private final class WebSocketRelayStream implements RelayStream {

        private final WebSocket webSocket;
        private final SignalListener listener;
        private volatile boolean closed;
        private long lastSeq = -1;

        WebSocketRelayStream(WebSocket webSocket, SignalListener listener) {
            this.webSocket = webSocket;
            this.listener = listener;
        }

        @Override
        public RelayMessage next() throws ConnectionLostException {
            if (closed) {
                throw new ConnectionLostException("Stream already closed");
            }
            Signal signal;
            try {
                signal = listener.signals.poll(idleTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionLostException("Interrupted while waiting for a frame", e);
            }

            if (signal == null) {
                throw new ConnectionLostException("No frame received within " + idleTimeout);
            }
            if (signal.error != null) {
                throw new ConnectionLostException("Relay connection failed", signal.error);
            }
            if (signal.closeReason != null) {
                throw new ConnectionLostException("Relay closed the stream: " + signal.closeReason);
            }

            RelayMessage message = signal.binary
                    ? RelayMessage.undecodable(null, "binary frame on the JSON subscription")
                    : decode(signal.text);

            Long seq = message.getSeq();
            if (seq != null) {
                if (seq <= lastSeq) {
                    throw new ConnectionLostException(
                            "Sequence regression: got seq=" + seq + " after seq=" + lastSeq);
                }
                lastSeq = seq;
            }

            webSocket.request(1);
            return message;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            listener.signals.add(Signal.closed("closed by consumer"));
            CompletableFuture<WebSocket> sent = webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "consumer shutdown");
            sent.whenComplete((ws, error) -> {
                if (error != null) {
                    log.debug("Close handshake failed, aborting socket: {}", error.getMessage());
                }
                webSocket.abort();
            });
        }
    }
}
