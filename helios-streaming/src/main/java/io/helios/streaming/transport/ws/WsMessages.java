package io.helios.streaming.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.helios.streaming.domain.data.DataPoint;
import io.helios.streaming.domain.data.SourceKind;
import io.helios.streaming.domain.monitoring.ServerStats;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Outbound wire messages. Every message carries a {@code type} discriminator and
 * an ISO-8601 {@code timestamp}.
 */
public final class WsMessages {
    public static final String SERVER_VERSION = "1.0.0";

    public static final String WELCOME = "welcome";
    public static final String SUBSCRIBED = "subscribed";
    public static final String UNSUBSCRIBED = "unsubscribed";
    public static final String PONG = "pong";
    public static final String ERROR = "error";
    public static final String DATA = "data";
    public static final String SERVER_STATS = "server_stats";

    private final ObjectMapper mapper;
    private final Clock clock;
    private final Instant startedAt;

    public WsMessages(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Seconds since this server instance started.
     */
    public double uptimeSeconds() {
        return Duration.between(startedAt, clock.instant()).toMillis() / 1000.0;
    }

    public String welcome(String clientId, int clientsConnected) {
        ObjectNode o = base(WELCOME);
        o.put("client_id", clientId);
        ArrayNode sources = o.putArray("available_sources");
        SourceKind.advertised().forEach(sources::add);

        ObjectNode info = o.putObject("server_info");
        info.put("version", SERVER_VERSION);
        info.put("uptime", uptimeSeconds());
        info.put("clients_connected", clientsConnected);
        return write(o);
    }

    public String subscribed(String source, long frequencyMs) {
        ObjectNode o = base(SUBSCRIBED);
        o.put("source", source);
        o.put("frequency", frequencyMs);
        return write(o);
    }

    public String unsubscribed() {
        return write(base(UNSUBSCRIBED));
    }

    public String pong() {
        return write(base(PONG));
    }

    public String error(String message) {
        ObjectNode o = base(ERROR);
        o.put("message", message);
        return write(o);
    }

    public String data(String source, DataPoint point) {
        ObjectNode o = base(DATA);
        o.put("source", source);
        o.set("data", DataPointJsonMapper.toJson(mapper, point));
        return write(o);
    }

    public String serverStats(ServerStats stats) {
        ObjectNode o = base(SERVER_STATS);
        ObjectNode s = o.putObject("stats");
        s.put("clients_connected", stats.clientsConnected());
        ArrayNode active = s.putArray("active_sources");
        List<String> sources = stats.activeSources();
        sources.forEach(active::add);
        s.put("uptime", stats.uptimeSeconds());
        s.put("memory_usage", stats.memoryUsedBytes());
        s.put("data_points_sent", stats.dataPointsSent());
        return write(o);
    }

    private ObjectNode base(String type) {
        ObjectNode o = mapper.createObjectNode();
        o.put("type", type);
        o.put("timestamp", LocalDateTime.now(clock).toString());
        return o;
    }

    private String write(ObjectNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize WS message type=" + node.path("type").asText(), e);
        }
    }
}
