package com.work.gateway.core.watch;

import java.util.concurrent.CompletableFuture;

/**
 * 到远端节点的实时推送通道（通常是 WebSocket）。
 * 同一时刻最多一条底层连接，connect 会替换旧连接。
 */
public interface LiveChannel {

    /**
     * 异步建立连接，连接可用时 future 完成；握手失败时 future 异常完成（不会再回调 onClose）。
     */
    CompletableFuture<Void> connect(LiveChannelListener listener);

    void send(String text);

    boolean isOpen();

    void close();
}
