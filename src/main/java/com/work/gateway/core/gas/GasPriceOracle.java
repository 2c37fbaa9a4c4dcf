package com.work.gateway.core.gas;

import com.work.gateway.core.chain.ChainAdapter;
import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.chain.FeeQuote;
import com.work.gateway.core.exception.RemoteUnavailableException;
import com.work.gateway.core.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.work.gateway.core.support.ValidationUtils.requireNonNull;
import static com.work.gateway.core.support.ValidationUtils.requirePositive;

/**
 * 按 (chain, network) 拉取并缓存网络 fee（gwei）。
 * <p>
 * - current：缓存未过 TTL 直接返回，否则触发 refresh
 * - refresh：base fee (+ priority fee) -> 链特定修正 -> 写缓存
 * - 拉取失败：记录日志并返回上一次成功的值（即使已过期），只有从未成功过时才向上抛
 * - 可选后台定时刷新，使读取大多命中缓存
 */
public class GasPriceOracle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GasPriceOracle.class);

    private static final class Source {
        final ChainAdapter adapter;
        final FeeAdjustment adjustment;
        final Duration refreshInterval;

        Source(ChainAdapter adapter, FeeAdjustment adjustment, Duration refreshInterval) {
            this.adapter = adapter;
            this.adjustment = adjustment;
            this.refreshInterval = refreshInterval;
        }
    }

    private final Duration ttl;
    private final Clock clock;
    private final GatewayMetrics metrics;
    private final Map<ChainKey, Source> sources = new ConcurrentHashMap<>();
    private final Map<ChainKey, GasPriceCache> cache = new ConcurrentHashMap<>();
    private final Map<ChainKey, Object> locks = new ConcurrentHashMap<>();
    private ScheduledExecutorService timer;

    public GasPriceOracle(Duration ttl, Clock clock, GatewayMetrics metrics) {
        this.ttl = requirePositive(ttl, "ttl");
        this.clock = requireNonNull(clock, "clock");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    /**
     * @param refreshInterval 后台刷新间隔，null 表示不启用后台刷新
     */
    public void register(ChainAdapter adapter, FeeAdjustment adjustment, Duration refreshInterval) {
        requireNonNull(adapter, "adapter");
        sources.put(adapter.getChainKey(), new Source(adapter,
                adjustment == null ? FeeAdjustment.none() : adjustment, refreshInterval));
    }

    public BigDecimal current(ChainKey chain) {
        GasPriceCache c = cache.get(requireNonNull(chain, "chain"));
        if (c != null && c.isFresh(clock.instant())) {
            return c.getValue();
        }
        return refresh(chain);
    }

    /**
     * 与 current 相同，但返回完整快照（含 fetchedAt 与是否来自旧值兜底）。
     */
    public GasPriceCache read(ChainKey chain) {
        current(chain);
        return cache.get(chain);
    }

    public BigDecimal refresh(ChainKey chain) {
        Source source = source(chain);
        synchronized (locks.computeIfAbsent(chain, k -> new Object())) {
            try {
                FeeQuote quote = source.adapter.feeEstimate();
                metrics.rpcRequest("feeEstimate");
                BigDecimal value = source.adjustment.apply(quote.total());
                Instant now = clock.instant();
                cache.put(chain, new GasPriceCache(value, now, ttl, false));
                metrics.gasRefresh("ok");
                log.info("[GAS PRICE] chain={} estimated {} GWEI (base={} priority={})",
                        chain, value.toPlainString(), quote.getBaseFee().toPlainString(),
                        quote.getPriorityFee() == null ? "-" : quote.getPriorityFee().toPlainString());
                return value;
            } catch (RuntimeException e) {
                GasPriceCache previous = cache.get(chain);
                if (previous == null) {
                    metrics.gasRefresh("error");
                    log.error("Failed to estimate gas price chain={} (no cached value): {}", chain, e.toString());
                    if (e instanceof RemoteUnavailableException) {
                        throw e;
                    }
                    throw new RemoteUnavailableException("gas price 拉取失败且无缓存 chain=" + chain, e);
                }
                metrics.gasRefresh("fallback");
                log.warn("Failed to estimate gas price chain={}, using value fetched at {}: {}",
                        chain, previous.getFetchedAt(), e.toString());
                cache.put(chain, previous.asFallback());
                return previous.getValue();
            }
        }
    }

    /**
     * 为配置了 refreshInterval 的链启动后台刷新。
     */
    public synchronized void start() {
        if (timer != null) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gas-price-refresh");
            t.setDaemon(true);
            return t;
        });
        for (Map.Entry<ChainKey, Source> e : sources.entrySet()) {
            Duration interval = e.getValue().refreshInterval;
            if (interval == null || interval.isZero() || interval.isNegative()) {
                continue;
            }
            ChainKey chain = e.getKey();
            timer.scheduleWithFixedDelay(() -> backgroundRefresh(chain), 0L, interval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("gas price background refresh scheduled chain={} interval={}", chain, interval);
        }
    }

    private void backgroundRefresh(ChainKey chain) {
        try {
            refresh(chain);
        } catch (RuntimeException e) {
            // 只有从未成功过才会走到这里，refresh 已记录 error 日志；下一个周期继续尝试
            log.debug("background gas refresh failed chain={}", chain, e);
        }
    }

    private Source source(ChainKey chain) {
        Source s = sources.get(requireNonNull(chain, "chain"));
        if (s == null) {
            throw new IllegalArgumentException("未注册的链: " + chain);
        }
        return s;
    }

    @Override
    public synchronized void close() {
        if (timer != null) {
            timer.shutdownNow();
            timer = null;
        }
    }
}
