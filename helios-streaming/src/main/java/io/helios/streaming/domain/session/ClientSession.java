package io.helios.streaming.domain.session;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Server-side state of one connected client.
 *
 * Every outbound write goes through {@link #sendLock}. Subscription changes
 * bump {@link #generation} under the same lock, so a dispatcher holding an
 * older generation can never write after its replacement has begun.
 */
public final class ClientSession {
    private final String sessionId;
    private final String clientId;
    private final OutboundChannel channel;
    private final Instant connectedAt;
    private volatile Instant lastActivity;    // volatile: written by I/O thread, read by dispatchers

    private final Object sendLock = new Object();

    // guarded by sendLock
    private long generation;
    private Subscription subscription;
    private SessionState state = SessionState.IDLE;
    private Future<?> dispatch;
    private boolean closed;

    private final AtomicLong dataPointsSent = new AtomicLong();

    public ClientSession(String clientId, OutboundChannel channel) {
        this.sessionId = UUID.randomUUID().toString();
        this.clientId = clientId;
        this.channel = channel;
        this.connectedAt = Instant.now();
        this.lastActivity = connectedAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getClientId() {
        return clientId;
    }

    public OutboundChannel getChannel() {
        return channel;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public void touch() {
        this.lastActivity = Instant.now();
    }

    public long getDataPointsSent() {
        return dataPointsSent.get();
    }

    public SessionState getState() {
        synchronized (sendLock) {
            return state;
        }
    }

    public Subscription getSubscription() {
        synchronized (sendLock) {
            return subscription;
        }
    }

    public long getGeneration() {
        synchronized (sendLock) {
            return generation;
        }
    }

    public boolean isClosed() {
        synchronized (sendLock) {
            return closed;
        }
    }

    /**
     * Send one frame unconditionally (control and stats messages).
     *
     * @return false if the session is closed or the channel rejected the frame
     */
    public boolean send(String json) {
        synchronized (sendLock) {
            return sendLocked(json);
        }
    }

    /**
     * Send one data frame only if {@code expectedGeneration} is still current.
     *
     * @return false if the subscription was replaced/cancelled, or delivery failed
     */
    public boolean sendIfCurrent(long expectedGeneration, String json) {
        return sendIfCurrent(expectedGeneration, () -> json);
    }

    /**
     * Like {@link #sendIfCurrent(long, String)}, but the frame is only built once the
     * generation check has passed, while the send lock is held.
     */
    public boolean sendIfCurrent(long expectedGeneration, Supplier<String> frame) {
        synchronized (sendLock) {
            if (closed || generation != expectedGeneration || state != SessionState.SUBSCRIBED) {
                return false;
            }
            boolean ok = sendLocked(frame.get());
            if (ok) {
                dataPointsSent.incrementAndGet();
            }
            return ok;
        }
    }

    /**
     * Whether {@code expectedGeneration} still identifies the active subscription.
     */
    public boolean isCurrent(long expectedGeneration) {
        synchronized (sendLock) {
            return !closed && generation == expectedGeneration && state == SessionState.SUBSCRIBED;
        }
    }

    /**
     * Replace any active subscription and acknowledge it, atomically with respect to
     * every other writer of this session. The prior dispatch (if any) is cancelled and
     * its generation invalidated before the acknowledgment is written.
     *
     * @return the new generation, or -1 if the session is already closed
     */
    public long beginSubscription(Subscription next, String ackJson) {
        synchronized (sendLock) {
            if (closed) {
                return -1;
            }
            generation++;
            cancelDispatchLocked();
            subscription = next;
            state = SessionState.SUBSCRIBED;
            sendLocked(ackJson);
            return generation;
        }
    }

    /**
     * Bind the running dispatch task to {@code forGeneration}. If the generation is
     * already stale the task is cancelled immediately.
     */
    public void attachDispatch(long forGeneration, Future<?> task) {
        synchronized (sendLock) {
            if (closed || generation != forGeneration) {
                task.cancel(false);
                return;
            }
            dispatch = task;
        }
    }

    /**
     * Cancel any active subscription and return to IDLE.
     *
     * @return true if a subscription was active
     */
    public boolean endSubscription() {
        synchronized (sendLock) {
            boolean wasSubscribed = state == SessionState.SUBSCRIBED;
            generation++;
            cancelDispatchLocked();
            subscription = null;
            state = SessionState.IDLE;
            return wasSubscribed;
        }
    }

    /**
     * Terminal transition: no further writes of any kind are attempted.
     */
    public void markClosed() {
        synchronized (sendLock) {
            if (closed) {
                return;
            }
            closed = true;
            generation++;
            cancelDispatchLocked();
            subscription = null;
            state = SessionState.IDLE;
        }
    }

    private boolean sendLocked(String json) {
        if (closed) {
            return false;
        }
        if (!channel.send(json)) {
            closed = true;
            generation++;
            cancelDispatchLocked();
            state = SessionState.IDLE;
            return false;
        }
        return true;
    }

    private void cancelDispatchLocked() {
        if (dispatch != null) {
            dispatch.cancel(false);
            dispatch = null;
        }
    }

    @Override
    public String toString() {
        return clientId + "/" + sessionId;
    }
}
