package com.skein.transport;

public enum ConnectionState {
    CONNECTED,
    DISCONNECTED,
    BACKOFF
}
