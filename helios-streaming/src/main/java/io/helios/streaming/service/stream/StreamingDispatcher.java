package io.helios.streaming.service.stream;

import io.helios.streaming.domain.session.ClientSession;
import io.helios.streaming.domain.session.Subscription;
import io.helios.streaming.infrastructure.metrics.StreamingMetrics;
import io.helios.streaming.service.session.ConnectionRegistry;
import io.helios.streaming.service.signal.SignalGenerator;
import io.helios.streaming.service.signal.SourceRegistry;
import io.helios.streaming.transport.ws.WsMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-session data push loops.
 *
 * Each subscribed session owns one fixed-delay task on a shared scheduler. A
 * task is bound to the session's dispatch generation at start; it stops
 * delivering the moment that generation is superseded (re-subscribe,
 * unsubscribe, disconnect) because the generation check and the write happen
 * under the session's send lock.
 */
public final class StreamingDispatcher {
    private static final Logger log = LoggerFactory.getLogger(StreamingDispatcher.class);

    private final SourceRegistry sources;
    private final ConnectionRegistry connections;
    private final WsMessages messages;
    private final StreamingMetrics metrics;
    private final ScheduledExecutorService scheduler;

    private final Map<ClientSession, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public StreamingDispatcher(
            SourceRegistry sources,
            ConnectionRegistry connections,
            WsMessages messages,
            StreamingMetrics metrics,
            int threads) {
        this.sources = sources;
        this.connections = connections;
        this.messages = messages;
        this.metrics = metrics;
        AtomicInteger seq = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "stream-dispatcher-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Replace the session's subscription: invalidate any prior dispatcher, send the
     * {@code subscribed} acknowledgment, then start pushing data.
     *
     * @return false if the session was closed before the new dispatcher could start
     */
    public boolean subscribe(ClientSession session, Subscription subscription) {
        if (scheduler.isShutdown()) {
            log.info("[DISPATCH] {} subscribe rejected, dispatcher is shut down", session);
            return false;
        }
        SignalGenerator generator = sources.getOrCreate(subscription.source());

        long generation = session.beginSubscription(
            subscription, messages.subscribed(subscription.source(), subscription.frequencyMs()));
        if (generation < 0 || session.isClosed()) {
            onDeliveryFailure(session, "subscribe ack");
            return false;
        }

        DispatchTask dispatch = new DispatchTask(session, generation, generator, subscription.source());
        ScheduledFuture<?> task;
        try {
            task = scheduler.scheduleWithFixedDelay(
                dispatch, 0, subscription.frequencyMs(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // shut down between the check above and scheduling
            session.endSubscription();
            log.info("[DISPATCH] {} subscribe rolled back, dispatcher is shut down", session);
            return false;
        }
        dispatch.self = task;

        ScheduledFuture<?> previous = tasks.put(session, task);
        if (previous != null && previous != task) {
            previous.cancel(false);
        }
        session.attachDispatch(generation, task);
        if (task.isCancelled()) {
            tasks.remove(session, task);
            return false;
        }

        log.info("[DISPATCH] {} subscribed source={} frequency={}ms generation={}",
            session, subscription.source(), subscription.frequencyMs(), generation);
        return true;
    }

    /**
     * Stop the session's dispatcher, if any.
     *
     * @return true if a subscription was active
     */
    public boolean unsubscribe(ClientSession session) {
        boolean wasSubscribed = session.endSubscription();
        ScheduledFuture<?> task = tasks.remove(session);
        if (task != null) {
            task.cancel(false);
        }
        if (wasSubscribed) {
            log.info("[DISPATCH] {} unsubscribed", session);
        }
        return wasSubscribed;
    }

    /**
     * Terminal cleanup on disconnect.
     */
    public void release(ClientSession session) {
        session.markClosed();
        ScheduledFuture<?> task = tasks.remove(session);
        if (task != null) {
            task.cancel(false);
        }
    }

    /**
     * Number of dispatch tasks still scheduled.
     */
    public int activeCount() {
        int n = 0;
        for (ScheduledFuture<?> f : tasks.values()) {
            if (!f.isDone()) {
                n++;
            }
        }
        return n;
    }

    public boolean isShutdown() {
        return scheduler.isShutdown();
    }

    public void shutdown() {
        log.info("[DISPATCH] Stopping {} dispatcher(s)", tasks.size());
        for (ClientSession session : tasks.keySet()) {
            release(session);
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
     * One generate-and-push step, bound to a single dispatch generation.
     */
    private final class DispatchTask implements Runnable {
        private final ClientSession session;
        private final long generation;
        private final SignalGenerator generator;
        private final String source;
        private volatile ScheduledFuture<?> self;

        private DispatchTask(ClientSession session, long generation, SignalGenerator generator, String source) {
            this.session = session;
            this.generation = generation;
            this.generator = generator;
            this.source = source;
        }

        @Override
        public void run() {
            try {
                if (!session.isCurrent(generation)) {
                    retire();
                    return;
                }
                if (!connections.contains(session)) {
                    log.debug("[DISPATCH] {} no longer registered, stopping", session);
                    release(session);
                    return;
                }

                // generated under the send lock so a stale task never advances the shared generator
                if (session.sendIfCurrent(generation, () -> messages.data(source, generator.generateDataPoint()))) {
                    metrics.recordDataPointSent(generator.getKind());
                } else if (session.isClosed()) {
                    onDeliveryFailure(session, "data");
                } else {
                    retire();
                }
            } catch (Exception e) {
                log.warn("[DISPATCH] Tick failed for {} source={}: {}", session, source, e.toString());
            }
        }

        private void retire() {
            ScheduledFuture<?> task = self;
            if (task != null) {
                task.cancel(false);
                tasks.remove(session, task);
            }
        }
    }

    private void onDeliveryFailure(ClientSession session, String what) {
        metrics.recordDeliveryFailure();
        if (connections.remove(session)) {
            metrics.setClientsConnected(connections.count());
            log.info("[DISPATCH] {} delivery of {} failed, session removed (total: {})",
                session, what, connections.count());
        }
        release(session);
    }
}
