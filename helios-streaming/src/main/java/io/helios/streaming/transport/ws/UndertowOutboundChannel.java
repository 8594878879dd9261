package io.helios.streaming.transport.ws;

import io.helios.streaming.domain.session.OutboundChannel;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * {@link OutboundChannel} over an Undertow WebSocket channel. Sends are
 * asynchronous; a failed write closes the channel, which in turn runs the
 * hub's disconnect cleanup.
 */
final class UndertowOutboundChannel implements OutboundChannel {
    private static final Logger log = LoggerFactory.getLogger(UndertowOutboundChannel.class);

    private final WebSocketChannel channel;

    private final WebSocketCallback<Void> onComplete = new WebSocketCallback<>() {
        @Override
        public void complete(WebSocketChannel ch, Void context) {
        }

        @Override
        public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
            log.debug("[WS] Send to {} failed: {}", ch.getSourceAddress(), throwable.toString());
            closeQuietly(ch);
        }
    };

    UndertowOutboundChannel(WebSocketChannel channel) {
        this.channel = channel;
    }

    @Override
    public boolean send(String text) {
        if (!channel.isOpen() || channel.isCloseFrameSent()) {
            return false;
        }
        WebSockets.sendText(text, channel, onComplete);
        return true;
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen() && !channel.isCloseFrameSent();
    }

    @Override
    public void close() {
        closeQuietly(channel);
    }

    @Override
    public String describe() {
        return String.valueOf(channel.getSourceAddress());
    }

    static void closeQuietly(WebSocketChannel ch) {
        try {
            ch.close();
        } catch (IOException e) {
            log.debug("[WS] Close of {} failed: {}", ch.getSourceAddress(), e.toString());
        }
    }
}
