package io.helios.streaming.bootstrap;

/**
 * Exception thrown when the streaming server cannot start (e.g. the bind address is unavailable).
 */
public class StreamingServerException extends RuntimeException {

    private final String host;
    private final int port;

    public StreamingServerException(String host, int port, String message, Throwable cause) {
        super(String.format("[%s:%d] %s", host, port, message), cause);
        this.host = host;
        this.port = port;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }
}
