package io.helios.streaming.service.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.helios.streaming.domain.data.SourceKind;
import io.helios.streaming.domain.monitoring.ServerStats;
import io.helios.streaming.domain.session.ClientSession;
import io.helios.streaming.infrastructure.metrics.StreamingMetrics;
import io.helios.streaming.service.session.ConnectionRegistry;
import io.helios.streaming.service.signal.SourceRegistry;
import io.helios.streaming.support.RecordingChannel;
import io.helios.streaming.transport.ws.WsMessages;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static io.helios.streaming.support.RecordingChannel.awaitCondition;
import static org.junit.jupiter.api.Assertions.*;

class StatsBroadcasterTest {

    private ConnectionRegistry connections;
    private SourceRegistry sources;
    private StreamingMetrics metrics;
    private StreamingDispatcher dispatcher;
    private StatsBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        connections = new ConnectionRegistry();
        sources = new SourceRegistry();
        metrics = new StreamingMetrics(new CollectorRegistry());
        WsMessages messages = new WsMessages(new ObjectMapper(), Clock.systemDefaultZone());
        dispatcher = new StreamingDispatcher(sources, connections, messages, metrics, 1);
        broadcaster = new StatsBroadcaster(connections, sources, dispatcher, messages, metrics, Duration.ofMillis(50));
    }

    @AfterEach
    void tearDown() {
        broadcaster.stop();
        dispatcher.shutdown();
    }

    private RecordingChannel connect(String name) {
        RecordingChannel channel = new RecordingChannel(name);
        connections.add(new ClientSession(name, channel));
        return channel;
    }

    @Test
    void testNoClientsNoBroadcast() {
        assertEquals(0, broadcaster.broadcastOnce());
    }

    @Test
    void testEveryRecipientSeesSameClientCount() {
        List<RecordingChannel> channels = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            channels.add(connect("client_" + i));
        }
        sources.getOrCreate("stock");
        sources.getOrCreate("weather");

        assertEquals(4, broadcaster.broadcastOnce());

        for (RecordingChannel channel : channels) {
            JsonNode msg = channel.last();
            assertEquals("server_stats", msg.get("type").asText());
            JsonNode stats = msg.get("stats");
            assertEquals(4, stats.get("clients_connected").asInt());
            assertEquals(2, stats.get("active_sources").size());
            assertEquals("stock", stats.get("active_sources").get(0).asText());
            assertTrue(stats.get("uptime").asDouble() >= 0.0);
            assertTrue(stats.get("memory_usage").asLong() > 0);
            assertEquals(0, stats.get("data_points_sent").asLong());
        }
        // Built once per sweep: identical payloads
        assertEquals(channels.get(0).raw(), channels.get(3).raw());
    }

    @Test
    void testClosedSessionsRemovedDuringSweep() {
        RecordingChannel alive = connect("client_1");
        RecordingChannel dead = connect("client_2");
        dead.disconnect();

        assertEquals(1, broadcaster.broadcastOnce());

        assertEquals(1, connections.count());
        assertEquals(1, alive.size());
        assertEquals(0, dead.size());
        assertEquals(1.0, metrics.deliveryFailureCount());
    }

    @Test
    void testDataPointsSentReflectsDeliveries() {
        RecordingChannel channel = connect("client_1");
        metrics.recordDataPointSent(SourceKind.STOCK);
        metrics.recordDataPointSent(SourceKind.STOCK);
        metrics.recordDataPointSent(SourceKind.SENSOR);

        broadcaster.broadcastOnce();

        assertEquals(3, channel.last().get("stats").get("data_points_sent").asLong());
    }

    @Test
    void testCurrentStats() {
        sources.getOrCreate("crypto");

        ServerStats stats = broadcaster.currentStats(7);

        assertEquals(7, stats.clientsConnected());
        assertEquals(List.of("crypto"), stats.activeSources());
        assertTrue(stats.memoryUsedBytes() > 0);
    }

    @Test
    void testPeriodicBroadcast() throws InterruptedException {
        RecordingChannel channel = connect("client_1");

        broadcaster.start();
        broadcaster.start();  // second start is ignored

        assertTrue(awaitCondition(() -> channel.messagesOfType("server_stats").size() >= 3, Duration.ofSeconds(3)));
    }
}
