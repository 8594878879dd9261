package io.helios.streaming.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.helios.streaming.config.StreamingConfig;
import io.helios.streaming.domain.session.ClientSession;
import io.helios.streaming.infrastructure.metrics.StreamingMetrics;
import io.helios.streaming.service.session.ConnectionRegistry;
import io.helios.streaming.service.signal.SourceRegistry;
import io.helios.streaming.service.stream.StatsBroadcaster;
import io.helios.streaming.service.stream.StreamingDispatcher;
import io.helios.streaming.transport.ws.ConnectionHeartbeat;
import io.helios.streaming.transport.ws.StreamProtocolHandler;
import io.helios.streaming.transport.ws.StreamingWsHub;
import io.helios.streaming.transport.ws.WsMessages;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.handlers.PathHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Clock;

/**
 * Wires the streaming core together and owns its lifecycle.
 *
 * All shared state (connection registry, source registry, metrics) is created
 * here and passed to each component at construction.
 */
public final class StreamingServer {
    private static final Logger log = LoggerFactory.getLogger(StreamingServer.class);

    private final StreamingConfig config;
    private final ConnectionRegistry connections;
    private final SourceRegistry sources;
    private final StreamingMetrics metrics;
    private final StreamingDispatcher dispatcher;
    private final StatsBroadcaster broadcaster;
    private final ConnectionHeartbeat heartbeat;
    private final StreamingWsHub hub;

    private Undertow server;
    private int boundPort = -1;

    public StreamingServer(StreamingConfig config) {
        this(config, new StreamingMetrics(new CollectorRegistry()));
    }

    public StreamingServer(StreamingConfig config, StreamingMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
        this.connections = new ConnectionRegistry();
        this.sources = new SourceRegistry();

        WsMessages messages = new WsMessages(new ObjectMapper(), Clock.systemDefaultZone());
        this.dispatcher = new StreamingDispatcher(sources, connections, messages, metrics, config.dispatcherThreads());
        this.broadcaster = new StatsBroadcaster(connections, sources, dispatcher, messages, metrics, config.statsInterval());
        this.heartbeat = new ConnectionHeartbeat(config.pingInterval(), config.pingTimeout());

        StreamProtocolHandler protocol = new StreamProtocolHandler(
            connections, dispatcher, messages, metrics, config.rejectUnknownTypes());
        this.hub = new StreamingWsHub(protocol, heartbeat);
    }

    /**
     * Bind and start accepting connections, then start the stats broadcaster.
     *
     * @throws StreamingServerException if the listener cannot be bound
     */
    public synchronized void start() {
        if (server != null) {
            log.warn("[SERVER] Already started on port {}", boundPort);
            return;
        }

        // WebSocket upgrade on any path
        PathHandler paths = Handlers.path().addPrefixPath("/", hub.websocketHandler());

        Undertow undertow = Undertow.builder()
            .addHttpListener(config.port(), config.host())
            .setHandler(paths)
            .build();

        try {
            undertow.start();
        } catch (RuntimeException e) {
            broadcaster.stop();
            dispatcher.shutdown();
            heartbeat.shutdown();
            throw new StreamingServerException(config.host(), config.port(), "Failed to bind streaming server", e);
        }

        server = undertow;
        boundPort = resolvePort(undertow);
        broadcaster.start();

        log.info("[SERVER] Helios streaming server v{} listening on ws://{}:{}",
            WsMessages.SERVER_VERSION, config.host(), boundPort);
    }

    /**
     * Close the listener first so no frame can arrive mid-shutdown, then cancel
     * dispatchers and stop background tasks.
     */
    public synchronized void stop() {
        if (server == null) {
            return;
        }
        log.info("[SERVER] Shutting down ({} client(s) connected)", connections.count());
        server.stop();
        server = null;
        for (ClientSession session : connections.snapshot()) {
            dispatcher.release(session);
            connections.remove(session);
        }
        metrics.setClientsConnected(connections.count());
        broadcaster.stop();
        dispatcher.shutdown();
        heartbeat.shutdown();
        log.info("[SERVER] Stopped");
    }

    /**
     * Actual listening port (differs from the configured one when that is 0).
     */
    public int getPort() {
        return boundPort;
    }

    public ConnectionRegistry getConnections() {
        return connections;
    }

    public SourceRegistry getSources() {
        return sources;
    }

    public StreamingDispatcher getDispatcher() {
        return dispatcher;
    }

    public StatsBroadcaster getBroadcaster() {
        return broadcaster;
    }

    public StreamingMetrics getMetrics() {
        return metrics;
    }

    private int resolvePort(Undertow undertow) {
        for (Undertow.ListenerInfo info : undertow.getListenerInfo()) {
            SocketAddress address = info.getAddress();
            if (address instanceof InetSocketAddress) {
                return ((InetSocketAddress) address).getPort();
            }
        }
        return config.port();
    }
}
