package io.helios.streaming.service.stream;

import io.helios.streaming.domain.monitoring.ServerStats;
import io.helios.streaming.domain.session.ClientSession;
import io.helios.streaming.infrastructure.metrics.StreamingMetrics;
import io.helios.streaming.service.session.ConnectionRegistry;
import io.helios.streaming.service.signal.SourceRegistry;
import io.helios.streaming.transport.ws.WsMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic server_stats broadcast to every connected client.
 *
 * Runs independently of any session. Sessions whose delivery fails during a
 * sweep are removed from the registry (connection-closed detection).
 */
public final class StatsBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(StatsBroadcaster.class);

    private final ConnectionRegistry connections;
    private final SourceRegistry sources;
    private final StreamingDispatcher dispatcher;
    private final WsMessages messages;
    private final StreamingMetrics metrics;
    private final Duration interval;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> task;
    private volatile boolean running = false;

    public StatsBroadcaster(
            ConnectionRegistry connections,
            SourceRegistry sources,
            StreamingDispatcher dispatcher,
            WsMessages messages,
            StreamingMetrics metrics,
            Duration interval) {
        this.connections = connections;
        this.sources = sources;
        this.dispatcher = dispatcher;
        this.messages = messages;
        this.metrics = metrics;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stats-broadcaster");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("[STATS] Broadcaster already running");
            return;
        }
        running = true;
        task = scheduler.scheduleAtFixedRate(this::safeBroadcast,
            interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[STATS] Broadcaster started (interval: {}ms)", interval.toMillis());
    }

    public synchronized void stop() {
        boolean wasRunning = running;
        running = false;
        if (task != null) {
            task.cancel(false);
            task = null;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (wasRunning) {
            log.info("[STATS] Broadcaster stopped");
        }
    }

    public boolean isShutdown() {
        return scheduler.isShutdown();
    }

    /**
     * One sweep: build the stats once from a registry snapshot and push them to
     * every session in that snapshot.
     *
     * @return number of sessions the stats were delivered to
     */
    public int broadcastOnce() {
        List<ClientSession> snapshot = connections.snapshot();
        if (snapshot.isEmpty()) {
            return 0;
        }

        ServerStats stats = currentStats(snapshot.size());
        String json = messages.serverStats(stats);

        int delivered = 0;
        int dropped = 0;
        for (ClientSession session : snapshot) {
            if (session.send(json)) {
                delivered++;
            } else {
                dropped++;
                metrics.recordDeliveryFailure();
                connections.remove(session);
                dispatcher.release(session);
            }
        }

        if (dropped > 0) {
            metrics.setClientsConnected(connections.count());
            log.info("[STATS] Removed {} closed session(s) (total: {})", dropped, connections.count());
        }
        log.debug("[STATS] Broadcast to {} client(s)", delivered);
        return delivered;
    }

    ServerStats currentStats(int clientsConnected) {
        Runtime rt = Runtime.getRuntime();
        return new ServerStats(
            clientsConnected,
            sources.activeSources(),
            messages.uptimeSeconds(),
            rt.totalMemory() - rt.freeMemory(),
            metrics.totalDataPointsSent()
        );
    }

    private void safeBroadcast() {
        try {
            broadcastOnce();
        } catch (Exception e) {
            log.error("[STATS] Broadcast failed: {}", e.getMessage(), e);
        }
    }
}
