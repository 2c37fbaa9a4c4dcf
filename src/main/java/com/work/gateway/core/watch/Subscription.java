package com.work.gateway.core.watch;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * 一条实时订阅。所有可变字段只在 watcher 的事件循环线程上读写。
 * <p>
 * localId 是本地生成的请求 id；节点 ack 之后得到 serverId，
 * 之后的通知都按 serverId 路由。任一时刻只登记在 byLocalId / byServerId 其中一张表里。
 */
final class Subscription {

    private final long handleId;
    private final SubscriptionKind kind;
    private final String target;
    private final CompletableFuture<WatchResult> future;
    private final Consumer<JsonNode> listener;

    private long localId;
    private Long serverId;
    private ScheduledFuture<?> timeoutHandle;

    private Subscription(long handleId, SubscriptionKind kind, String target,
                         CompletableFuture<WatchResult> future, Consumer<JsonNode> listener) {
        this.handleId = handleId;
        this.kind = kind;
        this.target = target;
        this.future = future;
        this.listener = listener;
    }

    static Subscription oneShot(String target, CompletableFuture<WatchResult> future) {
        return new Subscription(-1L, SubscriptionKind.SIGNATURE, target, future, null);
    }

    static Subscription standing(long handleId, String accountKey, Consumer<JsonNode> listener) {
        return new Subscription(handleId, SubscriptionKind.ACCOUNT, accountKey, null, listener);
    }

    boolean isStanding() {
        return kind == SubscriptionKind.ACCOUNT;
    }

    /**
     * 重新绑定到一个新的请求 id（首次订阅或重连恢复时）。
     */
    void bind(long newLocalId) {
        this.localId = newLocalId;
        this.serverId = null;
    }

    void cancelTimeout() {
        if (timeoutHandle != null) {
            timeoutHandle.cancel(false);
            timeoutHandle = null;
        }
    }

    long getHandleId() {
        return handleId;
    }

    SubscriptionKind getKind() {
        return kind;
    }

    String getTarget() {
        return target;
    }

    CompletableFuture<WatchResult> getFuture() {
        return future;
    }

    Consumer<JsonNode> getListener() {
        return listener;
    }

    long getLocalId() {
        return localId;
    }

    Long getServerId() {
        return serverId;
    }

    void setServerId(Long serverId) {
        this.serverId = serverId;
    }

    void setTimeoutHandle(ScheduledFuture<?> timeoutHandle) {
        this.timeoutHandle = timeoutHandle;
    }
}
