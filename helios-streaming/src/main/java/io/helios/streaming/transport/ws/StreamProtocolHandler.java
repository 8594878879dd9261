package io.helios.streaming.transport.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.helios.streaming.domain.data.SourceKind;
import io.helios.streaming.domain.session.ClientSession;
import io.helios.streaming.domain.session.OutboundChannel;
import io.helios.streaming.domain.session.Subscription;
import io.helios.streaming.infrastructure.metrics.StreamingMetrics;
import io.helios.streaming.service.session.ConnectionRegistry;
import io.helios.streaming.service.stream.StreamingDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inbound control protocol and per-session subscription lifecycle.
 *
 * Session states: IDLE -> SUBSCRIBED -> IDLE. Messages are JSON objects:
 * <pre>
 * {"type":"subscribe","source":"sensor","frequency":1000}   source defaults to "stock", frequency to 500ms
 * {"type":"unsubscribe"}
 * {"type":"ping"}
 * </pre>
 * Malformed payloads get an {@code error} reply and leave the session untouched.
 * Unknown types are ignored unless {@code rejectUnknownTypes} is set.
 *
 * Transport-agnostic: the WebSocket hub feeds it frames and lifecycle events.
 */
public final class StreamProtocolHandler {
    private static final Logger log = LoggerFactory.getLogger(StreamProtocolHandler.class);

    public static final String DEFAULT_SOURCE = "stock";
    public static final long DEFAULT_FREQUENCY_MS = 500;
    public static final long MIN_FREQUENCY_MS = 10;

    private final ConnectionRegistry connections;
    private final StreamingDispatcher dispatcher;
    private final WsMessages messages;
    private final StreamingMetrics metrics;
    private final boolean rejectUnknownTypes;
    private final ObjectMapper mapper;

    private final Object joinLock = new Object();

    public StreamProtocolHandler(
            ConnectionRegistry connections,
            StreamingDispatcher dispatcher,
            WsMessages messages,
            StreamingMetrics metrics,
            boolean rejectUnknownTypes) {
        this.connections = connections;
        this.dispatcher = dispatcher;
        this.messages = messages;
        this.metrics = metrics;
        this.rejectUnknownTypes = rejectUnknownTypes;
        this.mapper = messages.mapper();
    }

    /**
     * Create and register the session for a new connection. The welcome message is
     * written before the session becomes visible to the stats broadcaster, so it is
     * always the first frame the client sees.
     *
     * @return the registered session, or null if the welcome could not be delivered
     */
    public ClientSession onConnect(OutboundChannel channel) {
        ClientSession session;
        int total;
        synchronized (joinLock) {
            total = connections.count() + 1;
            session = new ClientSession("client_" + total, channel);
            if (!session.send(messages.welcome(session.getClientId(), total))) {
                metrics.recordDeliveryFailure();
                log.info("[WS] {} closed before welcome was delivered", channel.describe());
                return null;
            }
            connections.add(session);
        }
        metrics.setClientsConnected(connections.count());
        log.info("[WS] Client connected: {} from {} (total: {})",
            session.getClientId(), channel.describe(), connections.count());
        return session;
    }

    /**
     * Handle one inbound text frame.
     */
    public void onMessage(ClientSession session, String raw) {
        session.touch();

        ClientMessage msg;
        try {
            msg = parse(raw);
        } catch (MalformedMessageException e) {
            metrics.recordProtocolError(e.reason);
            log.debug("[WS] {} malformed message: {}", session, e.getMessage());
            session.send(messages.error(e.getMessage()));
            return;
        }

        String type = msg.type == null ? "" : msg.type;
        switch (type) {
            case "subscribe" -> handleSubscribe(session, msg);
            case "unsubscribe" -> handleUnsubscribe(session);
            case "ping" -> session.send(messages.pong());
            default -> handleUnknown(session, msg.type);
        }
    }

    /**
     * Transport-level closure, from any state. Terminal for the session.
     */
    public void onDisconnect(ClientSession session) {
        dispatcher.release(session);
        if (connections.remove(session)) {
            metrics.setClientsConnected(connections.count());
            log.info("[WS] Client disconnected: {} (total: {})", session.getClientId(), connections.count());
        }
    }

    private void handleSubscribe(ClientSession session, ClientMessage msg) {
        String source = msg.source == null || msg.source.isBlank() ? DEFAULT_SOURCE : msg.source;
        long frequency = msg.frequency == null ? DEFAULT_FREQUENCY_MS : Math.max(MIN_FREQUENCY_MS, msg.frequency);

        metrics.recordSubscription(SourceKind.fromName(source));
        if (!dispatcher.subscribe(session, new Subscription(source, frequency))) {
            if (session.isClosed()) {
                log.debug("[WS] {} closed during subscribe", session);
            } else {
                session.send(messages.error("Subscription unavailable: server is shutting down"));
            }
        }
    }

    private void handleUnsubscribe(ClientSession session) {
        dispatcher.unsubscribe(session);
        session.send(messages.unsubscribed());
    }

    private void handleUnknown(ClientSession session, String type) {
        if (rejectUnknownTypes) {
            metrics.recordProtocolError("unknown_type");
            session.send(messages.error("Unknown message type: " + type));
        } else {
            log.debug("[WS] {} ignoring message type={}", session, type);
        }
    }

    private ClientMessage parse(String raw) throws MalformedMessageException {
        JsonNode node;
        try {
            node = mapper.readTree(raw == null ? "" : raw);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("invalid_json", "Invalid JSON message");
        }
        if (node == null || !node.isObject()) {
            throw new MalformedMessageException("not_object", "Invalid message: expected a JSON object");
        }
        try {
            return mapper.treeToValue(node, ClientMessage.class);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("invalid_fields", "Invalid message: " + e.getOriginalMessage());
        }
    }

    // Message models
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ClientMessage {
        public String type;
        public String source;
        public Long frequency;  // ms
    }

    static final class MalformedMessageException extends Exception {
        private final String reason;

        MalformedMessageException(String reason, String message) {
            super(message);
            this.reason = reason;
        }
    }
}
