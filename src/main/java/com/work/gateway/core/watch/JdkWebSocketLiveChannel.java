package com.work.gateway.core.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;

import static com.work.gateway.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 JDK {@link java.net.http.WebSocket} 的实时通道。
 * 分片文本帧在 onText 中拼接完整后再交给 listener。
 */
public class JdkWebSocketLiveChannel implements LiveChannel {

    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketLiveChannel.class);

    private final URI uri;
    private final HttpClient httpClient;
    private final Duration connectTimeout;
    private final AtomicReference<WebSocket> socketRef = new AtomicReference<>();

    /**
     * JDK WebSocket 要求上一条 sendText 完成后才能发送下一条，这里把发送串起来。
     */
    private CompletableFuture<WebSocket> lastSend;

    public JdkWebSocketLiveChannel(URI uri, Duration connectTimeout) {
        this(uri, HttpClient.newBuilder().connectTimeout(connectTimeout).build(), connectTimeout);
    }

    public JdkWebSocketLiveChannel(URI uri, HttpClient httpClient, Duration connectTimeout) {
        this.uri = requireNonNull(uri, "uri");
        this.httpClient = requireNonNull(httpClient, "httpClient");
        this.connectTimeout = requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public CompletableFuture<Void> connect(LiveChannelListener listener) {
        requireNonNull(listener, "listener");
        WebSocket previous = socketRef.getAndSet(null);
        if (previous != null) {
            previous.abort();
        }
        return httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, new Adapter(listener))
                .thenAccept(ws -> {
                    synchronized (this) {
                        lastSend = CompletableFuture.completedFuture(ws);
                    }
                    socketRef.set(ws);
                    log.info("WebSocket connected to {}", uri);
                });
    }

    @Override
    public void send(String text) {
        WebSocket ws = socketRef.get();
        if (ws == null) {
            throw new IllegalStateException("WebSocket is not connected: " + uri);
        }
        synchronized (this) {
            // 上一条失败不影响后续发送
            lastSend = lastSend.exceptionally(e -> ws)
                    .thenCompose(w -> w.sendText(text, true))
                    .whenComplete((w, e) -> {
                        if (e != null) {
                            log.warn("WebSocket send failed on {}: {}", uri, e.getMessage());
                        }
                    });
        }
    }

    @Override
    public boolean isOpen() {
        WebSocket ws = socketRef.get();
        return ws != null && !ws.isOutputClosed() && !ws.isInputClosed();
    }

    @Override
    public void close() {
        WebSocket ws = socketRef.getAndSet(null);
        if (ws != null && !ws.isOutputClosed()) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "disconnect")
                    .exceptionally(e -> {
                        log.debug("WebSocket close handshake failed for {}: {}", uri, e.getMessage());
                        ws.abort();
                        return ws;
                    });
        }
    }

    private final class Adapter implements WebSocket.Listener {

        private final LiveChannelListener listener;
        private final StringBuilder buffer = new StringBuilder();

        private Adapter(LiveChannelListener listener) {
            this.listener = listener;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String payload = buffer.toString();
                buffer.setLength(0);
                listener.onMessage(payload);
            }
            return WebSocket.Listener.super.onText(webSocket, data, last);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            socketRef.compareAndSet(webSocket, null);
            listener.onClose(statusCode, reason);
            return WebSocket.Listener.super.onClose(webSocket, statusCode, reason);
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            socketRef.compareAndSet(webSocket, null);
            listener.onError(error);
        }
    }
}
