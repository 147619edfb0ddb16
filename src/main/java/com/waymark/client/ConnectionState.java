package com.waymark.client;

/**
 * Lifecycle of the connection owned by a {@link ResilientClient}.
 */
public enum ConnectionState {
    UNSET,
    INITIALIZING,
    READY,
    CLOSED
}
