package io.meshgraph.listener;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    BACKOFF
}
