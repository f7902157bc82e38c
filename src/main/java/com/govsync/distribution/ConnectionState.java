package com.govsync.distribution;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
