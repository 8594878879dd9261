package io.helios.streaming.domain.session;

/**
 * Subscription lifecycle of a client session.
 */
public enum SessionState {
    /** Connected, no active dispatcher. */
    IDLE,

    /** Exactly one active dispatcher is pushing data. */
    SUBSCRIBED
}
