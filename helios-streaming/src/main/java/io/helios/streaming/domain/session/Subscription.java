package io.helios.streaming.domain.session;

/**
 * Active subscription of a session: source name and delivery cadence.
 */
public record Subscription(String source, long frequencyMs) {
    public Subscription {
        if (source == null || source.isEmpty()) {
            throw new IllegalArgumentException("source cannot be empty");
        }
        if (frequencyMs <= 0) {
            throw new IllegalArgumentException("frequencyMs must be positive: " + frequencyMs);
        }
    }
}
