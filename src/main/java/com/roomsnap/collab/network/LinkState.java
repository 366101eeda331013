package com.roomsnap.collab.network;

/**
 * Connection states of the {@link TransportLink}.
 * CONNECTION_LOST is terminal until {@link TransportLink#connect()} is called again.
 */
public enum LinkState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    CONNECTION_LOST
}
