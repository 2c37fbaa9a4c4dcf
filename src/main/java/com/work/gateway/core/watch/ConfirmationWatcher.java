package com.work.gateway.core.watch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.exception.SubscriptionLostException;
import com.work.gateway.core.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import static com.work.gateway.core.support.ValidationUtils.requireNonEmpty;
import static com.work.gateway.core.support.ValidationUtils.requireNonNull;
import static com.work.gateway.core.support.ValidationUtils.requirePositive;

/**
 * 通过长连接推送等待交易确认（每个 chain/network 一个实例）。
 * <p>
 * 并发模型：连接状态、订阅表、超时、重连计时全部只在一个单线程事件循环上读写，
 * 传输层回调和对外 API 都先投递到事件循环再处理，因此内部不需要加锁。
 * 每次建立连接分配一个新的 epoch，旧连接迟到的回调一律丢弃。
 * <p>
 * 订阅：
 * - 一次性（watch）：收到通知 / 超时 / 连接断开 三者之一即销毁，future 只完成一次
 * - 常驻（subscribeAccount）：连接断开时保留，重连成功后重新订阅
 * <p>
 * 重连：非主动断开时按 {@link ReconnectBackoff} 退避重试，最多 maxAttempts 次，
 * 耗尽后停在 DISCONNECTED；首次 connect 失败不重试，调用方回退到轮询。
 */
public class ConfirmationWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationWatcher.class);

    private final ChainKey chain;
    private final LiveChannel channel;
    private final JsonRpcSubscriptionCodec codec;
    private final ReconnectBackoff backoff;
    private final int maxAttempts;
    private final Duration defaultTimeout;
    private final GatewayMetrics metrics;
    private final ScheduledExecutorService loop;
    private final AtomicLong handleSequence = new AtomicLong();

    // ---- 以下字段只在事件循环线程上访问 ----
    private final Map<Long, Subscription> byLocalId = new HashMap<>();
    private final Map<Long, Subscription> byServerId = new HashMap<>();
    private final Map<Long, Subscription> standing = new LinkedHashMap<>();
    /**
     * 已在本地放弃（超时/取消）但节点尚未 ack 的请求，ack 到达后补发退订。
     */
    private final Map<Long, SubscriptionKind> abandoned = new HashMap<>();
    private long nextRequestId = 1;
    private long epoch;
    private int reconnectAttempts;
    private ScheduledFuture<?> reconnectTask;
    private CompletableFuture<Void> connecting;

    private volatile WatcherState state = WatcherState.DISCONNECTED;

    public ConfirmationWatcher(ChainKey chain, LiveChannel channel, JsonRpcSubscriptionCodec codec,
                               ReconnectBackoff backoff, int maxAttempts, Duration defaultTimeout,
                               GatewayMetrics metrics) {
        this.chain = requireNonNull(chain, "chain");
        this.channel = requireNonNull(channel, "channel");
        this.codec = requireNonNull(codec, "codec");
        this.backoff = requireNonNull(backoff, "backoff");
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be non-negative");
        }
        this.maxAttempts = maxAttempts;
        this.defaultTimeout = requirePositive(defaultTimeout, "defaultTimeout");
        this.metrics = requireNonNull(metrics, "metrics");
        this.loop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "confirmation-watcher-" + chain);
            t.setDaemon(true);
            return t;
        });
    }

    public ChainKey getChain() {
        return chain;
    }

    public WatcherState getState() {
        return state;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /**
     * 建立连接。已连接时直接完成；正在连接时复用同一次尝试；
     * 处于重连退避中时取消等待、立即重新发起。
     * 失败时 future 以 {@link SubscriptionLostException} 异常完成，且不会自动重试。
     */
    public CompletableFuture<Void> connect() {
        CompletableFuture<Void> result = new CompletableFuture<>();
        boolean posted = post(() -> {
            if (state == WatcherState.CONNECTED) {
                result.complete(null);
                return;
            }
            if (state == WatcherState.CONNECTING && connecting != null) {
                propagate(connecting, result);
                return;
            }
            cancelReconnectTask();
            reconnectAttempts = 0;
            propagate(openConnection(false), result);
        });
        if (!posted) {
            result.completeExceptionally(new SubscriptionLostException("watcher is closed: " + chain));
        }
        return result;
    }

    public CompletableFuture<WatchResult> watch(String target) {
        return watch(target, defaultTimeout);
    }

    /**
     * 等待 target（交易签名/哈希）的确认通知。
     * <p>
     * - 收到成功通知：CONFIRMED；通知带执行错误：FAILED
     * - 超时：TIMEOUT（不是异常）
     * - 未连接 / 连接断开 / 节点拒绝订阅：以 {@link SubscriptionLostException} 异常完成
     */
    public CompletableFuture<WatchResult> watch(String target, Duration timeout) {
        requireNonEmpty(target, "target");
        requirePositive(timeout, "timeout");
        CompletableFuture<WatchResult> future = new CompletableFuture<>();
        boolean posted = post(() -> {
            if (state != WatcherState.CONNECTED) {
                future.completeExceptionally(new SubscriptionLostException(
                        "live watcher is not connected (state=" + state + "): " + chain));
                return;
            }
            Subscription sub = Subscription.oneShot(target, future);
            sub.setTimeoutHandle(loop.schedule(() -> onTimeout(sub), timeout.toMillis(), TimeUnit.MILLISECONDS));
            register(sub);
            metrics.watcherEvent("watch");
        });
        if (!posted) {
            future.completeExceptionally(new SubscriptionLostException("watcher is closed: " + chain));
        }
        return future;
    }

    /**
     * 常驻账户订阅。未连接时先登记，连接（或重连）成功后自动发出订阅。
     * listener 在事件循环线程上调用，不应阻塞。
     */
    public StandingSubscription subscribeAccount(String accountKey, Consumer<JsonNode> listener) {
        requireNonEmpty(accountKey, "accountKey");
        requireNonNull(listener, "listener");
        Subscription sub = Subscription.standing(handleSequence.incrementAndGet(), accountKey, listener);
        boolean posted = post(() -> {
            standing.put(sub.getHandleId(), sub);
            if (state == WatcherState.CONNECTED) {
                register(sub);
            }
        });
        if (!posted) {
            throw new SubscriptionLostException("watcher is closed: " + chain);
        }
        return new StandingSubscription(this, sub);
    }

    void cancelStanding(Subscription sub) {
        post(() -> {
            if (standing.remove(sub.getHandleId()) == null) {
                return;
            }
            release(sub);
            log.info("Cancelled account subscription {} on {}", sub.getTarget(), chain);
        });
    }

    /**
     * 主动断开：不再自动重连，所有一次性订阅以异常完成；常驻订阅保留登记，下次 connect 后恢复。
     */
    public CompletableFuture<Void> disconnect() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        boolean posted = post(() -> {
            cancelReconnectTask();
            epoch++;
            SubscriptionLostException reason = new SubscriptionLostException("watcher disconnected: " + chain);
            if (connecting != null) {
                connecting.completeExceptionally(reason);
                connecting = null;
            }
            rejectOneShots(reason);
            WatcherState previous = state;
            state = WatcherState.DISCONNECTED;
            channel.close();
            if (previous != WatcherState.DISCONNECTED) {
                log.info("Live watcher for {} disconnected", chain);
            }
            done.complete(null);
        });
        if (!posted) {
            done.complete(null);
        }
        return done;
    }

    @Override
    public void close() {
        try {
            disconnect().get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Live watcher for {} did not disconnect cleanly: {}", chain, e.toString());
        } finally {
            loop.shutdownNow();
        }
    }

    /**
     * 等待事件循环处理完此前投递的所有任务（仅测试使用）。
     */
    void flush() throws Exception {
        CompletableFuture.runAsync(() -> { }, loop).get(5, TimeUnit.SECONDS);
    }

    // ------------------------------------------------------------------ 连接管理

    private CompletableFuture<Void> openConnection(boolean isReconnect) {
        state = WatcherState.CONNECTING;
        long connectionEpoch = ++epoch;
        CompletableFuture<Void> current = new CompletableFuture<>();
        connecting = current;
        CompletableFuture<Void> attempt;
        try {
            attempt = channel.connect(listenerFor(connectionEpoch));
        } catch (RuntimeException e) {
            attempt = new CompletableFuture<>();
            attempt.completeExceptionally(e);
        }
        log.info("Connecting live watcher for {} (reconnect={})", chain, isReconnect);
        attempt.whenComplete((v, err) -> post(() -> onConnectResult(connectionEpoch, err, isReconnect)));
        return current;
    }

    private void onConnectResult(long connectionEpoch, Throwable err, boolean isReconnect) {
        if (connectionEpoch != epoch || state != WatcherState.CONNECTING) {
            // 连接过程中被 disconnect 取代
            if (err == null && state == WatcherState.DISCONNECTED) {
                channel.close();
            }
            return;
        }
        CompletableFuture<Void> current = connecting;
        connecting = null;
        if (err == null) {
            state = WatcherState.CONNECTED;
            reconnectAttempts = 0;
            log.info("Live watcher for {} connected", chain);
            metrics.watcherEvent("connected");
            restoreStanding();
            current.complete(null);
            return;
        }
        if (isReconnect) {
            log.warn("Reconnect attempt {}/{} for {} failed: {}", reconnectAttempts, maxAttempts, chain, err.toString());
            state = WatcherState.RECONNECTING;
            current.completeExceptionally(new SubscriptionLostException("reconnect failed: " + chain, err));
            scheduleReconnect();
        } else {
            log.warn("Live watcher for {} failed to connect, falling back to polling: {}", chain, err.toString());
            state = WatcherState.DISCONNECTED;
            metrics.watcherEvent("connect_failed");
            current.completeExceptionally(new SubscriptionLostException("failed to connect live watcher: " + chain, err));
        }
    }

    private void onConnectionLost(long connectionEpoch, String reason) {
        if (connectionEpoch != epoch || state != WatcherState.CONNECTED) {
            return;
        }
        epoch++;
        log.warn("Live connection for {} lost: {}", chain, reason);
        metrics.watcherEvent("lost");
        rejectOneShots(new SubscriptionLostException("live connection lost: " + reason));
        state = WatcherState.RECONNECTING;
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (reconnectAttempts >= maxAttempts) {
            log.error("Live watcher for {} gave up after {} reconnect attempt(s)", chain, reconnectAttempts);
            metrics.watcherEvent("reconnect_exhausted");
            state = WatcherState.DISCONNECTED;
            return;
        }
        reconnectAttempts++;
        Duration delay = backoff.delay(reconnectAttempts);
        log.info("Attempting reconnection {}/{} for {} in {}ms", reconnectAttempts, maxAttempts, chain, delay.toMillis());
        reconnectTask = loop.schedule(() -> {
            reconnectTask = null;
            if (state == WatcherState.RECONNECTING) {
                openConnection(true);
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelReconnectTask() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    private void restoreStanding() {
        for (Subscription sub : standing.values()) {
            register(sub);
        }
        if (!standing.isEmpty()) {
            log.info("Restored {} account subscription(s) on {}", standing.size(), chain);
        }
    }

    /**
     * 断连时一次性订阅全部以异常完成；常驻订阅只清空绑定，等待恢复。
     */
    private void rejectOneShots(SubscriptionLostException reason) {
        List<Subscription> all = new ArrayList<>(byLocalId.values());
        all.addAll(byServerId.values());
        byLocalId.clear();
        byServerId.clear();
        abandoned.clear();
        for (Subscription sub : all) {
            if (!sub.isStanding()) {
                sub.cancelTimeout();
                sub.getFuture().completeExceptionally(reason);
            }
        }
    }

    private LiveChannelListener listenerFor(long connectionEpoch) {
        return new LiveChannelListener() {
            @Override
            public void onMessage(String text) {
                post(() -> {
                    if (connectionEpoch == epoch) {
                        handleMessage(text);
                    }
                });
            }

            @Override
            public void onClose(int statusCode, String reason) {
                post(() -> onConnectionLost(connectionEpoch, "closed code=" + statusCode + " reason=" + reason));
            }

            @Override
            public void onError(Throwable error) {
                post(() -> onConnectionLost(connectionEpoch, "error " + error));
            }
        };
    }

    // ------------------------------------------------------------------ 订阅表

    private void register(Subscription sub) {
        long requestId = nextRequestId++;
        sub.bind(requestId);
        byLocalId.put(requestId, sub);
        send(codec.subscribe(sub.getKind(), requestId, sub.getTarget()));
    }

    /**
     * 从订阅表摘除并（尽可能）向节点退订。
     */
    private void release(Subscription sub) {
        Long serverId = sub.getServerId();
        if (serverId != null) {
            if (byServerId.get(serverId) == sub) {
                byServerId.remove(serverId);
                sendUnsubscribe(sub.getKind(), serverId);
            }
        } else if (byLocalId.get(sub.getLocalId()) == sub) {
            byLocalId.remove(sub.getLocalId());
            abandoned.put(sub.getLocalId(), sub.getKind());
        }
    }

    private void onTimeout(Subscription sub) {
        if (sub.getFuture().isDone()) {
            return;
        }
        release(sub);
        log.info("Timed out waiting for live confirmation of {} on {}", sub.getTarget(), chain);
        metrics.watcherEvent("timeout");
        sub.getFuture().complete(WatchResult.timeout());
    }

    private void handleMessage(String text) {
        LiveMessage message;
        try {
            message = codec.decode(text);
        } catch (JsonProcessingException e) {
            log.error("Error parsing live message on {}: {}", chain, e.getOriginalMessage());
            return;
        }
        switch (message.getKind()) {
            case ACK:
                onAck(message.getRequestId(), message.getServerId());
                break;
            case NOTIFICATION:
                onNotification(message);
                break;
            case ERROR:
                onErrorMessage(message);
                break;
            default:
                log.debug("Ignoring live message on {}: {}", chain, text);
        }
    }

    private void onAck(long requestId, long serverId) {
        Subscription sub = byLocalId.remove(requestId);
        if (sub == null) {
            SubscriptionKind kind = abandoned.remove(requestId);
            if (kind != null) {
                sendUnsubscribe(kind, serverId);
            } else {
                log.debug("Ack for unknown request {} on {}", requestId, chain);
            }
            return;
        }
        sub.setServerId(serverId);
        Subscription clash = byServerId.put(serverId, sub);
        if (clash != null && clash != sub) {
            log.warn("Server subscription id {} reused on {}, dropping previous subscription for {}",
                    serverId, chain, clash.getTarget());
            if (!clash.isStanding()) {
                clash.cancelTimeout();
                clash.getFuture().completeExceptionally(
                        new SubscriptionLostException("subscription replaced on node: " + clash.getTarget()));
            }
        }
    }

    private void onNotification(LiveMessage message) {
        Subscription sub = byServerId.get(message.getServerId());
        if (sub == null) {
            log.warn("Dropping notification for unknown subscription {} on {}", message.getServerId(), chain);
            metrics.watcherEvent("dropped");
            return;
        }
        if (sub.isStanding()) {
            try {
                sub.getListener().accept(message.getResult());
            } catch (RuntimeException e) {
                log.error("Account listener for {} on {} failed", sub.getTarget(), chain, e);
            }
            return;
        }
        byServerId.remove(message.getServerId());
        sub.cancelTimeout();
        sendUnsubscribe(sub.getKind(), message.getServerId());
        if (codec.isFailure(message.getResult())) {
            log.info("Transaction {} failed on {} (live)", sub.getTarget(), chain);
            metrics.watcherEvent("failed");
            sub.getFuture().complete(WatchResult.failed(message.getResult()));
        } else {
            log.info("Transaction {} confirmed on {} (live)", sub.getTarget(), chain);
            metrics.watcherEvent("confirmed");
            sub.getFuture().complete(WatchResult.confirmed(message.getResult()));
        }
    }

    private void onErrorMessage(LiveMessage message) {
        Long requestId = message.getRequestId();
        Subscription sub = requestId == null ? null : byLocalId.remove(requestId);
        if (sub == null) {
            if (requestId != null) {
                abandoned.remove(requestId);
            }
            log.warn("Node error on {}: {}", chain, message.getErrorMessage());
            return;
        }
        if (sub.isStanding()) {
            standing.remove(sub.getHandleId());
            log.error("Node rejected account subscription {} on {}: {}", sub.getTarget(), chain, message.getErrorMessage());
            return;
        }
        sub.cancelTimeout();
        log.warn("Node rejected subscription for {} on {}: {}", sub.getTarget(), chain, message.getErrorMessage());
        sub.getFuture().completeExceptionally(new SubscriptionLostException(
                "subscription rejected by node: " + message.getErrorMessage()));
    }

    private void sendUnsubscribe(SubscriptionKind kind, long serverId) {
        send(codec.unsubscribe(kind, nextRequestId++, serverId));
    }

    private void send(String text) {
        try {
            channel.send(text);
        } catch (RuntimeException e) {
            // 连接已坏，随后的 onClose/onError 会触发重连
            log.warn("Failed to send live message on {}: {}", chain, e.toString());
        }
    }

    private boolean post(Runnable task) {
        try {
            loop.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Unexpected error in live watcher loop for {}", chain, e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("Live watcher for {} is closed, dropping task", chain);
            return false;
        }
    }

    private static <T> void propagate(CompletableFuture<T> source, CompletableFuture<T> target) {
        source.whenComplete((v, err) -> {
            if (err != null) {
                target.completeExceptionally(err);
            } else {
                target.complete(v);
            }
        });
    }
}
