package com.work.gateway.core.watch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.exception.SubscriptionLostException;
import com.work.gateway.core.metrics.NoopGatewayMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConfirmationWatcherTest {

    private static final ChainKey KEY = ChainKey.of("sol", "devnet");
    private static final int MAX_ATTEMPTS = 3;

    private final ObjectMapper mapper = new ObjectMapper();
    private FakeLiveChannel channel;
    private ConfirmationWatcher watcher;

    /**
     * 脚本化的传输层：记录发出的报文，测试手动注入入站消息与断连。
     */
    static class FakeLiveChannel implements LiveChannel {

        final List<String> sent = new CopyOnWriteArrayList<>();
        final AtomicInteger connects = new AtomicInteger();
        volatile boolean refuse;
        volatile boolean open;
        volatile LiveChannelListener listener;

        @Override
        public CompletableFuture<Void> connect(LiveChannelListener listener) {
            connects.incrementAndGet();
            CompletableFuture<Void> f = new CompletableFuture<>();
            if (refuse) {
                f.completeExceptionally(new java.io.IOException("connection refused"));
                return f;
            }
            this.listener = listener;
            open = true;
            f.complete(null);
            return f;
        }

        @Override
        public void send(String text) {
            sent.add(text);
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
        }

        void receive(String json) {
            listener.onMessage(json);
        }

        void drop() {
            open = false;
            listener.onClose(1006, "abnormal closure");
        }
    }

    @BeforeEach
    public void setUp() {
        channel = new FakeLiveChannel();
        watcher = new ConfirmationWatcher(KEY, channel,
                new JsonRpcSubscriptionCodec(mapper, SubscriptionMethods.defaults()),
                new ReconnectBackoff(Duration.ofMillis(10), Duration.ofMillis(40)),
                MAX_ATTEMPTS, Duration.ofSeconds(30), new NoopGatewayMetrics());
    }

    @AfterEach
    public void tearDown() {
        watcher.close();
    }

    private void connect() throws Exception {
        watcher.connect().get(2, TimeUnit.SECONDS);
        assertEquals(WatcherState.CONNECTED, watcher.getState());
    }

    private JsonNode sentAt(int i) throws Exception {
        return mapper.readTree(channel.sent.get(i));
    }

    private List<JsonNode> sentWithMethod(String method) throws Exception {
        List<JsonNode> out = new ArrayList<>();
        for (String s : channel.sent) {
            JsonNode n = mapper.readTree(s);
            if (method.equals(n.path("method").asText())) {
                out.add(n);
            }
        }
        return out;
    }

    private void ack(long requestId, long serverId) throws Exception {
        channel.receive("{\"jsonrpc\":\"2.0\",\"id\":" + requestId + ",\"result\":" + serverId + "}");
        watcher.flush();
    }

    private void notifySignature(long serverId, String err) throws Exception {
        channel.receive("{\"jsonrpc\":\"2.0\",\"method\":\"signatureNotification\",\"params\":{\"subscription\":"
                + serverId + ",\"result\":{\"context\":{\"slot\":5},\"value\":{\"err\":" + err + "}}}}");
        watcher.flush();
    }

    private void awaitState(WatcherState expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (watcher.getState() != expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(expected, watcher.getState());
    }

    private static Throwable failureOf(CompletableFuture<?> f) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(2, TimeUnit.SECONDS));
        return e.getCause();
    }

    @Test
    public void notification_after_ack_resolves_and_unsubscribes() throws Exception {
        connect();
        CompletableFuture<WatchResult> f = watcher.watch("sig-1", Duration.ofSeconds(5));
        watcher.flush();

        JsonNode subscribe = sentAt(0);
        assertEquals("signatureSubscribe", subscribe.get("method").asText());
        assertEquals("sig-1", subscribe.get("params").get(0).asText());
        assertEquals("confirmed", subscribe.get("params").get(1).get("commitment").asText());
        long requestId = subscribe.get("id").asLong();

        ack(requestId, 777);
        assertFalse(f.isDone());
        notifySignature(777, "null");

        WatchResult result = f.get(2, TimeUnit.SECONDS);
        assertTrue(result.isConfirmed());
        assertEquals(WatchResult.Outcome.CONFIRMED, result.getOutcome());
        assertEquals(5, result.getData().path("context").path("slot").asInt());

        List<JsonNode> unsubscribes = sentWithMethod("signatureUnsubscribe");
        assertEquals(1, unsubscribes.size());
        assertEquals(777, unsubscribes.get(0).get("params").get(0).asLong());
    }

    @Test
    public void remapped_server_id_resolves_the_subscription_it_was_remapped_from() throws Exception {
        connect();
        List<CompletableFuture<WatchResult>> futures = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            futures.add(watcher.watch("sig-" + i, Duration.ofSeconds(5)));
        }
        watcher.flush();
        assertEquals(7, sentAt(6).get("id").asLong());
        assertEquals("sig-7", sentAt(6).get("params").get(0).asText());

        // localId=7 -> serverId=42；localId=3 恰好拿到 serverId=7
        ack(7, 42);
        ack(3, 7);
        notifySignature(42, "null");

        assertTrue(futures.get(6).get(2, TimeUnit.SECONDS).isConfirmed());
        assertFalse(futures.get(2).isDone());
        for (int i = 0; i < 6; i++) {
            assertFalse(futures.get(i).isDone(), "watch #" + (i + 1) + " must still be pending");
        }
    }

    @Test
    public void notification_for_unacknowledged_subscription_is_dropped() throws Exception {
        connect();
        CompletableFuture<WatchResult> f = watcher.watch("sig-1", Duration.ofSeconds(5));
        watcher.flush();

        notifySignature(500, "null");
        assertFalse(f.isDone());

        ack(1, 500);
        notifySignature(500, "null");
        assertTrue(f.get(2, TimeUnit.SECONDS).isConfirmed());
    }

    @Test
    public void notification_with_execution_error_resolves_as_failed() throws Exception {
        connect();
        CompletableFuture<WatchResult> f = watcher.watch("sig-1", Duration.ofSeconds(5));
        watcher.flush();
        ack(1, 9);

        notifySignature(9, "{\"InstructionError\":[0,\"Custom\"]}");

        WatchResult result = f.get(2, TimeUnit.SECONDS);
        assertEquals(WatchResult.Outcome.FAILED, result.getOutcome());
        assertFalse(result.isConfirmed());
    }

    @Test
    public void timeout_resolves_unconfirmed_instead_of_failing() throws Exception {
        connect();
        CompletableFuture<WatchResult> f = watcher.watch("sig-1", Duration.ofMillis(50));

        WatchResult result = f.get(2, TimeUnit.SECONDS);
        assertEquals(WatchResult.Outcome.TIMEOUT, result.getOutcome());
        assertFalse(result.isConfirmed());

        // 超时后才到的 ack：补发退订，不会再次完成 future
        ack(1, 31);
        List<JsonNode> unsubscribes = sentWithMethod("signatureUnsubscribe");
        assertEquals(1, unsubscribes.size());
        assertEquals(31, unsubscribes.get(0).get("params").get(0).asLong());
    }

    @Test
    public void node_error_rejects_the_subscription() throws Exception {
        connect();
        CompletableFuture<WatchResult> f = watcher.watch("bad-sig", Duration.ofSeconds(5));
        watcher.flush();

        channel.receive("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32602,\"message\":\"Invalid param\"}}");

        Throwable cause = failureOf(f);
        assertInstanceOf(SubscriptionLostException.class, cause);
        assertTrue(cause.getMessage().contains("Invalid param"));
    }

    @Test
    public void connection_loss_rejects_every_pending_watch() throws Exception {
        connect();
        CompletableFuture<WatchResult> acked = watcher.watch("sig-1", Duration.ofSeconds(5));
        CompletableFuture<WatchResult> unacked = watcher.watch("sig-2", Duration.ofSeconds(5));
        watcher.flush();
        ack(1, 100);

        channel.drop();
        watcher.flush();

        assertTrue(acked.isCompletedExceptionally());
        assertTrue(unacked.isCompletedExceptionally());
        assertInstanceOf(SubscriptionLostException.class, failureOf(acked));
        assertInstanceOf(SubscriptionLostException.class, failureOf(unacked));

        // 重连成功后一次性订阅不会恢复
        awaitState(WatcherState.CONNECTED);
        watcher.flush();
        assertEquals(2, sentWithMethod("signatureSubscribe").size());
    }

    @Test
    public void standing_subscription_is_restored_after_reconnect_and_stale_callbacks_are_ignored() throws Exception {
        List<JsonNode> received = Collections.synchronizedList(new ArrayList<>());
        StandingSubscription handle = watcher.subscribeAccount("acct-1", received::add);
        connect();
        watcher.flush();

        assertEquals(1, sentWithMethod("accountSubscribe").size());
        ack(1, 70);
        LiveChannelListener firstConnection = channel.listener;

        channel.drop();
        watcher.flush();
        awaitState(WatcherState.CONNECTED);
        watcher.flush();
        assertEquals(2, channel.connects.get());

        List<JsonNode> subscribes = sentWithMethod("accountSubscribe");
        assertEquals(2, subscribes.size());
        long restoredId = subscribes.get(1).get("id").asLong();
        ack(restoredId, 71);

        channel.receive("{\"jsonrpc\":\"2.0\",\"method\":\"accountNotification\",\"params\":{\"subscription\":71,"
                + "\"result\":{\"value\":{\"lamports\":10}}}}");
        watcher.flush();
        assertEquals(1, received.size());
        assertEquals(10, received.get(0).path("value").path("lamports").asInt());

        // 旧连接迟到的断开回调不影响新连接
        firstConnection.onClose(1006, "late");
        watcher.flush();
        assertEquals(WatcherState.CONNECTED, watcher.getState());

        handle.cancel();
        watcher.flush();
        List<JsonNode> unsubscribes = sentWithMethod("accountUnsubscribe");
        assertEquals(1, unsubscribes.size());
        assertEquals(71, unsubscribes.get(0).get("params").get(0).asLong());
    }

    @Test
    public void reconnect_is_bounded_then_stays_disconnected() throws Exception {
        connect();
        channel.refuse = true;

        channel.drop();
        awaitState(WatcherState.DISCONNECTED);

        assertEquals(1 + MAX_ATTEMPTS, channel.connects.get());
        Thread.sleep(150);
        assertEquals(1 + MAX_ATTEMPTS, channel.connects.get());

        // 显式 connect 可以重新初始化
        channel.refuse = false;
        connect();
    }

    @Test
    public void initial_connect_failure_does_not_retry() throws Exception {
        channel.refuse = true;

        Throwable cause = failureOf(watcher.connect());
        assertInstanceOf(SubscriptionLostException.class, cause);
        assertEquals(WatcherState.DISCONNECTED, watcher.getState());

        Thread.sleep(100);
        assertEquals(1, channel.connects.get());
    }

    @Test
    public void watch_while_disconnected_fails_immediately() {
        CompletableFuture<WatchResult> f = watcher.watch("sig-1", Duration.ofSeconds(5));

        assertInstanceOf(SubscriptionLostException.class, failureOf(f));
        assertTrue(channel.sent.isEmpty());
    }

    @Test
    public void explicit_disconnect_rejects_pending_and_never_reconnects() throws Exception {
        connect();
        CompletableFuture<WatchResult> f = watcher.watch("sig-1", Duration.ofSeconds(5));

        watcher.disconnect().get(2, TimeUnit.SECONDS);

        assertInstanceOf(SubscriptionLostException.class, failureOf(f));
        assertEquals(WatcherState.DISCONNECTED, watcher.getState());
        assertFalse(channel.isOpen());
        Thread.sleep(100);
        assertEquals(1, channel.connects.get());
    }
}
