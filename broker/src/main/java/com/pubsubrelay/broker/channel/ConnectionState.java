package com.pubsubrelay.broker.channel;

/**
 * Lifecycle of one client connection.
 * <p>
 * A connection moves strictly forward; {@link #CLOSING} is entered exactly once, whatever the
 * close cause. Token parsing and authentication run before a {@code Connection} exists, so a
 * connection starts in {@link #BINDING}.
 * </p>
 */
public enum ConnectionState {
    BINDING,
    REPLAYING,
    READY,
    OPEN,
    CLOSING,
    CLOSED
}
