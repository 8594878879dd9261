package io.helios.streaming.transport.ws;

import io.helios.streaming.domain.session.ClientSession;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedBinaryMessage;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Undertow-native WebSocket endpoint:
 * - One {@link ClientSession} per connection, welcomed before receives resume
 * - Text frames handed to {@link StreamProtocolHandler}
 * - Ping/pong keep-alive via {@link ConnectionHeartbeat}
 * - Exactly-once disconnect cleanup (close frame, error or channel close)
 */
public final class StreamingWsHub {
    private static final Logger log = LoggerFactory.getLogger(StreamingWsHub.class);

    private static final byte[] PING_PAYLOAD = "helios".getBytes(StandardCharsets.UTF_8);

    private final StreamProtocolHandler protocol;
    private final ConnectionHeartbeat heartbeat;

    public StreamingWsHub(StreamProtocolHandler protocol, ConnectionHeartbeat heartbeat) {
        this.protocol = protocol;
        this.heartbeat = heartbeat;
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                handleConnect(channel);
            }
        });
    }

    private void handleConnect(WebSocketChannel channel) {
        UndertowOutboundChannel outbound = new UndertowOutboundChannel(channel);
        ClientSession session = protocol.onConnect(outbound);
        if (session == null) {
            outbound.close();
            return;
        }

        AtomicBoolean cleaned = new AtomicBoolean(false);
        ConnectionHeartbeat.Watch watch = heartbeat.watch(
            session.getSessionId(),
            () -> WebSockets.sendPing(ByteBuffer.wrap(PING_PAYLOAD), channel, null),
            outbound::close);

        Runnable cleanup = () -> {
            if (cleaned.compareAndSet(false, true)) {
                watch.stop();
                protocol.onDisconnect(session);
            }
        };

        channel.getCloseSetter().set(c -> cleanup.run());

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                protocol.onMessage(session, message.getData());
            }

            @Override
            protected void onFullPongMessage(WebSocketChannel ch, BufferedBinaryMessage message) throws IOException {
                watch.recordPong();
                super.onFullPongMessage(ch, message);
            }

            @Override
            protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                cleanup.run();
                super.onCloseMessage(cm, ch);
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                log.debug("[WS] Channel error for {}: {}", session, error.toString());
                cleanup.run();
                super.onError(ch, error);
            }
        });

        channel.resumeReceives();
        if (!channel.isOpen()) {
            cleanup.run();
        }
    }
}
