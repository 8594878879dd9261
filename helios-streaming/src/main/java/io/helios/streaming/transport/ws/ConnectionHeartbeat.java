package io.helios.streaming.transport.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keep-alive for client connections.
 *
 * Features:
 * - Periodic ping per watched connection
 * - Timeout detection when no pong arrives after a ping
 * - One timeout callback per connection, then the watch stops itself
 * - One shared scheduler thread for all connections
 *
 * Usage:
 * <pre>
 * ConnectionHeartbeat heartbeat = new ConnectionHeartbeat(
 *     Duration.ofSeconds(20),  // ping every 20 seconds
 *     Duration.ofSeconds(10)   // dead if no pong 10 seconds after a ping
 * );
 *
 * ConnectionHeartbeat.Watch watch = heartbeat.watch("client_1", () -> sendPing(), () -> closeConnection());
 * // When pong received:
 * watch.recordPong();
 * // On disconnect:
 * watch.stop();
 * </pre>
 */
public final class ConnectionHeartbeat {
    private static final Logger log = LoggerFactory.getLogger(ConnectionHeartbeat.class);

    private final Duration pingInterval;
    private final Duration timeout;
    private final ScheduledExecutorService scheduler;
    private final Map<String, Watch> watches = new ConcurrentHashMap<>();

    public ConnectionHeartbeat(Duration pingInterval, Duration timeout) {
        this.pingInterval = pingInterval;
        this.timeout = timeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ws-heartbeat");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start watching a connection.
     *
     * @param connectionId  unique id for logs and bookkeeping
     * @param pingFunction  sends one ping frame; an exception counts as a dead peer
     * @param onTimeout     invoked at most once when the peer is considered dead
     */
    public Watch watch(String connectionId, Runnable pingFunction, Runnable onTimeout) {
        Watch w = new Watch(connectionId, pingFunction, onTimeout);
        Watch previous = watches.put(connectionId, w);
        if (previous != null) {
            previous.stop();
        }
        w.start();
        return w;
    }

    public int watchedCount() {
        return watches.size();
    }

    public Duration getPingInterval() {
        return pingInterval;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void shutdown() {
        for (Watch w : watches.values()) {
            w.stop();
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
    }

    /**
     * Heartbeat state of one connection.
     */
    public final class Watch {
        private final String connectionId;
        private final Runnable pingFunction;
        private final Runnable onTimeout;
        private final AtomicBoolean expired = new AtomicBoolean(false);

        private volatile ScheduledFuture<?> pingTask;
        private volatile ScheduledFuture<?> timeoutTask;
        private volatile Instant lastPingTime;
        private volatile Instant lastPongTime;
        private volatile boolean running = false;

        private Watch(String connectionId, Runnable pingFunction, Runnable onTimeout) {
            this.connectionId = connectionId;
            this.pingFunction = pingFunction;
            this.onTimeout = onTimeout;
        }

        private synchronized void start() {
            running = true;
            lastPongTime = Instant.now();
            pingTask = scheduler.scheduleAtFixedRate(this::sendPing,
                pingInterval.toMillis(), pingInterval.toMillis(), TimeUnit.MILLISECONDS);
        }

        /**
         * Record receipt of a pong frame.
         */
        public void recordPong() {
            lastPongTime = Instant.now();
        }

        /**
         * Stop pinging; no timeout callback fires after this returns.
         */
        public synchronized void stop() {
            if (!running) {
                return;
            }
            running = false;
            if (pingTask != null) {
                pingTask.cancel(false);
                pingTask = null;
            }
            if (timeoutTask != null) {
                timeoutTask.cancel(false);
                timeoutTask = null;
            }
            watches.remove(connectionId, this);
        }

        public boolean isRunning() {
            return running;
        }

        public boolean isExpired() {
            return expired.get();
        }

        /**
         * @return Duration since last pong (or since the watch started), or null if never started
         */
        public Duration getTimeSinceLastPong() {
            Instant lastPong = lastPongTime;
            return lastPong == null ? null : Duration.between(lastPong, Instant.now());
        }

        private void sendPing() {
            if (!running) {
                return;
            }
            log.debug("[HEARTBEAT:{}] Sending ping", connectionId);
            lastPingTime = Instant.now();
            try {
                pingFunction.run();
            } catch (Exception e) {
                log.warn("[HEARTBEAT:{}] Ping failed: {}", connectionId, e.toString());
                expire();
                return;
            }
            scheduleTimeoutCheck();
        }

        private synchronized void scheduleTimeoutCheck() {
            if (!running) {
                return;
            }
            if (timeoutTask != null) {
                timeoutTask.cancel(false);
            }
            Instant pingAt = lastPingTime;
            timeoutTask = scheduler.schedule(() -> {
                Instant lastPong = lastPongTime;
                if (lastPong != null && !lastPong.isBefore(pingAt)) {
                    return;  // Pong received in time
                }
                log.warn("[HEARTBEAT:{}] No pong within {}ms of ping, closing", connectionId, timeout.toMillis());
                expire();
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        private void expire() {
            synchronized (this) {
                if (!running || !expired.compareAndSet(false, true)) {
                    return;
                }
                stop();
            }
            try {
                onTimeout.run();
            } catch (Exception e) {
                log.error("[HEARTBEAT:{}] Timeout callback threw exception", connectionId, e);
            }
        }
    }
}
