package com.work.gateway.core.gas;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * 单个 (chain, network) 的报价缓存快照。
 *
 * fallback = true 表示最近一次强制刷新失败，当前值是上一次成功拉取的旧值。
 */
public final class GasPriceCache {

    private final BigDecimal value;
    private final Instant fetchedAt;
    private final Duration ttl;
    private final boolean fallback;

    public GasPriceCache(BigDecimal value, Instant fetchedAt, Duration ttl, boolean fallback) {
        this.value = value;
        this.fetchedAt = fetchedAt;
        this.ttl = ttl;
        this.fallback = fallback;
    }

    public boolean isFresh(Instant now) {
        return Duration.between(fetchedAt, now).compareTo(ttl) < 0;
    }

    GasPriceCache asFallback() {
        return new GasPriceCache(value, fetchedAt, ttl, true);
    }

    public BigDecimal getValue() {
        return value;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    public Duration getTtl() {
        return ttl;
    }

    public boolean isFallback() {
        return fallback;
    }
}
