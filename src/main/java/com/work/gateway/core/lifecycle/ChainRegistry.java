package com.work.gateway.core.lifecycle;

import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.exception.GatewayException;
import com.work.gateway.core.gas.GasPriceOracle;
import com.work.gateway.core.watch.ConfirmationWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.work.gateway.core.support.ValidationUtils.requireNonNull;

/**
 * 按 (chain, network) 持有 {@link ChainContext}，并负责整体启动与关闭。
 * <p>
 * start：各链 NonceManager.init（失败即启动失败）-> 连接实时推送（失败只记日志，回退轮询）-> 启动 gas 后台刷新。
 */
public class ChainRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChainRegistry.class);

    private final Map<ChainKey, ChainContext> contexts = new LinkedHashMap<>();
    private final GasPriceOracle gasOracle;
    private final Duration connectWait;
    private final List<AutoCloseable> resources = new ArrayList<>();

    public ChainRegistry(GasPriceOracle gasOracle, Duration connectWait) {
        this.gasOracle = requireNonNull(gasOracle, "gasOracle");
        this.connectWait = requireNonNull(connectWait, "connectWait");
    }

    public synchronized void register(ChainContext context) {
        requireNonNull(context, "context");
        if (contexts.putIfAbsent(context.getKey(), context) != null) {
            throw new IllegalArgumentException("chain already registered: " + context.getKey());
        }
    }

    /**
     * 随注册表一起关闭的共享资源（执行器、计时器等），按登记的逆序关闭。
     */
    public synchronized void addResource(AutoCloseable resource) {
        resources.add(requireNonNull(resource, "resource"));
    }

    public synchronized ChainContext get(ChainKey key) {
        ChainContext context = contexts.get(requireNonNull(key, "key"));
        if (context == null) {
            throw new IllegalArgumentException("unknown chain: " + key);
        }
        return context;
    }

    public TransactionLifecycleCoordinator coordinator(ChainKey key) {
        return get(key).getCoordinator();
    }

    public synchronized Collection<ChainContext> contexts() {
        return Collections.unmodifiableCollection(new ArrayList<>(contexts.values()));
    }

    public GasPriceOracle getGasOracle() {
        return gasOracle;
    }

    public void start() {
        for (ChainContext context : contexts()) {
            context.getNonceManager().init();
        }
        for (ChainContext context : contexts()) {
            context.getWatcher().ifPresent(this::connectQuietly);
        }
        gasOracle.start();
        log.info("chain registry started chains={}", contexts.keySet());
    }

    private void connectQuietly(ConfirmationWatcher watcher) {
        try {
            watcher.connect().get(connectWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("interrupted while connecting watcher for " + watcher.getChain(), e);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("live watcher unavailable chain={}, status will be polled: {}", watcher.getChain(), e.toString());
        }
    }

    @Override
    public void close() {
        for (ChainContext context : contexts()) {
            context.close();
        }
        gasOracle.close();
        List<AutoCloseable> toClose;
        synchronized (this) {
            toClose = new ArrayList<>(resources);
        }
        Collections.reverse(toClose);
        for (AutoCloseable resource : toClose) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("failed to close {}: {}", resource, e.toString());
            }
        }
        log.info("chain registry closed");
    }
}
