package io.helios.streaming.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.helios.streaming.domain.data.DataPoint;
import io.helios.streaming.domain.monitoring.ServerStats;
import io.helios.streaming.support.RecordingChannel;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WsMessagesTest {

    private static final Instant START = Instant.parse("2024-05-01T08:00:00Z");

    /**
     * Clock that can be advanced by the test.
     */
    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private final MutableClock clock = new MutableClock(START);
    private final WsMessages messages = new WsMessages(new ObjectMapper(), clock);

    @Test
    void testEveryMessageHasTypeAndTimestamp() {
        for (String json : List.of(messages.pong(), messages.unsubscribed(), messages.error("x"),
                messages.subscribed("stock", 500), messages.welcome("client_1", 1))) {
            JsonNode node = RecordingChannel.parse(json);
            assertTrue(node.hasNonNull("type"), json);
            assertEquals("2024-05-01T08:00", node.get("timestamp").asText(), json);
        }
    }

    @Test
    void testUptimeIsSecondsSinceStart() {
        clock.advance(Duration.ofMillis(12_500));

        assertEquals(12.5, messages.uptimeSeconds(), 1e-9);
        JsonNode welcome = RecordingChannel.parse(messages.welcome("client_3", 3));
        assertEquals(12.5, welcome.get("server_info").get("uptime").asDouble(), 1e-9);
        assertEquals(3, welcome.get("server_info").get("clients_connected").asInt());
        assertEquals("client_3", welcome.get("client_id").asText());
    }

    @Test
    void testSubscribedAndError() {
        JsonNode ack = RecordingChannel.parse(messages.subscribed("weather", 250));
        assertEquals("subscribed", ack.get("type").asText());
        assertEquals("weather", ack.get("source").asText());
        assertEquals(250, ack.get("frequency").asLong());

        JsonNode err = RecordingChannel.parse(messages.error("Invalid JSON message"));
        assertEquals("error", err.get("type").asText());
        assertEquals("Invalid JSON message", err.get("message").asText());
    }

    @Test
    void testDataMessageShape() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("price", 101.25);
        values.put("volume", 1_000_250.5);
        DataPoint point = new DataPoint("2024-05-01T08:00:01.5", "stock", values,
            new DataPoint.Metadata(1500, 0.97, 0.03));

        JsonNode msg = RecordingChannel.parse(messages.data("stock", point));

        assertEquals("data", msg.get("type").asText());
        assertEquals("stock", msg.get("source").asText());
        JsonNode data = msg.get("data");
        assertEquals("2024-05-01T08:00:01.5", data.get("timestamp").asText());
        assertEquals("stock", data.get("source").asText());
        assertEquals(101.25, data.get("data").get("price").asDouble());
        assertEquals(1_000_250.5, data.get("data").get("volume").asDouble());
        assertEquals(1500, data.get("metadata").get("sequence").asLong());
        assertEquals(0.97, data.get("metadata").get("quality").asDouble());
        assertEquals(0.03, data.get("metadata").get("anomaly_score").asDouble());

        // field order preserved
        assertEquals("price", data.get("data").fieldNames().next());
    }

    @Test
    void testServerStatsShape() {
        ServerStats stats = new ServerStats(2, List.of("stock", "crypto"), 42.0, 1_048_576L, 99L);

        JsonNode msg = RecordingChannel.parse(messages.serverStats(stats));

        assertEquals("server_stats", msg.get("type").asText());
        JsonNode s = msg.get("stats");
        assertEquals(2, s.get("clients_connected").asInt());
        assertEquals("crypto", s.get("active_sources").get(1).asText());
        assertEquals(42.0, s.get("uptime").asDouble());
        assertEquals(1_048_576L, s.get("memory_usage").asLong());
        assertEquals(99L, s.get("data_points_sent").asLong());
    }
}
