package com.work.gateway.core.watch;

/**
 * DISCONNECTED -> CONNECTING -> CONNECTED -> (error|close) -> RECONNECTING -> CONNECTING -> ...
 * 显式 disconnect() 或重连次数耗尽后回到 DISCONNECTED，不再自动重连。
 */
public enum WatcherState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING
}
