package com.work.gateway.core.watch;

import java.time.Duration;

import static com.work.gateway.core.support.ValidationUtils.requirePositive;

/**
 * 指数退避：delay(n) = min(base * 2^n, cap)。
 */
public final class ReconnectBackoff {

    private final long baseMillis;
    private final long capMillis;

    public ReconnectBackoff(Duration base, Duration cap) {
        this.baseMillis = requirePositive(base, "base").toMillis();
        this.capMillis = requirePositive(cap, "cap").toMillis();
        if (capMillis < baseMillis) {
            throw new IllegalArgumentException("cap must not be less than base");
        }
    }

    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative");
        }
        int shift = Math.min(attempt, 62);
        if (baseMillis > (capMillis >> shift)) {
            return Duration.ofMillis(capMillis);
        }
        return Duration.ofMillis(Math.min(baseMillis << shift, capMillis));
    }
}
