package io.helios.streaming.domain.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ClientSessionTest {

    @Mock
    private OutboundChannel channel;

    private ClientSession session;

    @BeforeEach
    void setUp() {
        session = new ClientSession("client_1", channel);
    }

    @Test
    void newSession_isIdle() {
        assertEquals(SessionState.IDLE, session.getState());
        assertNull(session.getSubscription());
        assertFalse(session.isClosed());
        assertEquals(0, session.getGeneration());
        assertEquals(0, session.getDataPointsSent());
    }

    @Test
    void send_forwardsToChannel() {
        when(channel.send("hello")).thenReturn(true);

        assertTrue(session.send("hello"));

        verify(channel).send("hello");
        assertFalse(session.isClosed());
    }

    @Test
    void send_failureClosesSession() {
        when(channel.send(anyString())).thenReturn(false);

        assertFalse(session.send("first"));
        assertTrue(session.isClosed());

        // Closed sessions never touch the channel again
        assertFalse(session.send("second"));
        verify(channel, times(1)).send(anyString());
    }

    @Test
    void beginSubscription_bumpsGenerationAndSendsAck() {
        when(channel.send(anyString())).thenReturn(true);

        long gen = session.beginSubscription(new Subscription("stock", 500), "ack");

        assertEquals(1, gen);
        assertEquals(SessionState.SUBSCRIBED, session.getState());
        assertEquals(new Subscription("stock", 500), session.getSubscription());
        assertTrue(session.isCurrent(gen));
        verify(channel).send("ack");
    }

    @Test
    void beginSubscription_invalidatesPreviousGeneration() {
        when(channel.send(anyString())).thenReturn(true);

        long first = session.beginSubscription(new Subscription("stock", 500), "ack1");
        CompletableFuture<Void> firstTask = new CompletableFuture<>();
        session.attachDispatch(first, firstTask);

        long second = session.beginSubscription(new Subscription("sensor", 100), "ack2");

        assertTrue(second > first);
        assertFalse(session.isCurrent(first));
        assertTrue(firstTask.isCancelled(), "Previous dispatch should be cancelled");
        assertFalse(session.sendIfCurrent(first, "stale"));
        assertTrue(session.sendIfCurrent(second, "fresh"));

        InOrder order = inOrder(channel);
        order.verify(channel).send("ack1");
        order.verify(channel).send("ack2");
        order.verify(channel).send("fresh");
        verify(channel, never()).send("stale");
        assertEquals(1, session.getDataPointsSent());
    }

    @Test
    void beginSubscription_onClosedSession_returnsMinusOne() {
        session.markClosed();

        assertEquals(-1, session.beginSubscription(new Subscription("stock", 500), "ack"));
        verifyNoInteractions(channel);
    }

    @Test
    void attachDispatch_staleGenerationCancelsTask() {
        when(channel.send(anyString())).thenReturn(true);
        long gen = session.beginSubscription(new Subscription("stock", 500), "ack");
        session.endSubscription();

        CompletableFuture<Void> task = new CompletableFuture<>();
        session.attachDispatch(gen, task);

        assertTrue(task.isCancelled());
    }

    @Test
    void endSubscription_returnsToIdle() {
        when(channel.send(anyString())).thenReturn(true);
        long gen = session.beginSubscription(new Subscription("stock", 500), "ack");
        CompletableFuture<Void> task = new CompletableFuture<>();
        session.attachDispatch(gen, task);

        assertTrue(session.endSubscription());

        assertEquals(SessionState.IDLE, session.getState());
        assertNull(session.getSubscription());
        assertFalse(session.isCurrent(gen));
        assertTrue(task.isCancelled());

        // idempotent
        assertFalse(session.endSubscription());
    }

    @Test
    void markClosed_blocksAllWrites() {
        when(channel.send(anyString())).thenReturn(true);
        long gen = session.beginSubscription(new Subscription("stock", 500), "ack");

        session.markClosed();

        assertTrue(session.isClosed());
        assertFalse(session.isCurrent(gen));
        assertFalse(session.send("x"));
        assertFalse(session.sendIfCurrent(gen, "y"));
        verify(channel, times(1)).send(anyString());
    }

    @Test
    void sendIfCurrent_failedDeliveryClosesSession() {
        when(channel.send("ack")).thenReturn(true);
        when(channel.send("data")).thenReturn(false);
        long gen = session.beginSubscription(new Subscription("stock", 500), "ack");

        assertFalse(session.sendIfCurrent(gen, "data"));

        assertTrue(session.isClosed());
        assertEquals(0, session.getDataPointsSent());
    }

    @Test
    void sendIfCurrent_staleGenerationNeverBuildsFrame() {
        when(channel.send(anyString())).thenReturn(true);
        long first = session.beginSubscription(new Subscription("stock", 500), "ack1");
        session.beginSubscription(new Subscription("stock", 500), "ack2");
        AtomicInteger built = new AtomicInteger();

        boolean sent = session.sendIfCurrent(first, () -> {
            built.incrementAndGet();
            return "data";
        });

        assertFalse(sent);
        assertEquals(0, built.get(), "Frame supplier must not run for a stale generation");
        verify(channel, never()).send("data");
    }

    @Test
    void sendIfCurrent_currentGenerationBuildsFrameOnce() {
        when(channel.send(anyString())).thenReturn(true);
        long gen = session.beginSubscription(new Subscription("stock", 500), "ack");
        AtomicInteger built = new AtomicInteger();

        assertTrue(session.sendIfCurrent(gen, () -> "data-" + built.incrementAndGet()));

        assertEquals(1, built.get());
        verify(channel).send("data-1");
        assertEquals(1, session.getDataPointsSent());
    }

    @Test
    void subscription_rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new Subscription("", 500));
        assertThrows(IllegalArgumentException.class, () -> new Subscription(null, 500));
        assertThrows(IllegalArgumentException.class, () -> new Subscription("stock", 0));
    }
}
