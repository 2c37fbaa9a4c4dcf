package com.work.gateway.core.support;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;

/**
 * core 组件构造参数与入参的校验，失败统一抛 IllegalArgumentException。
 */
public final class ValidationUtils {

    private ValidationUtils() {
        throw new AssertionError("no instances");
    }

    public static String requireNonEmpty(String value, String name) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    public static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    /**
     * 超时、TTL 一类的时长必须严格为正
     */
    public static Duration requirePositive(Duration duration, String name) {
        if (requireNonNull(duration, name).isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0, got " + duration);
        }
        return duration;
    }

    public static long requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, got " + value);
        }
        return value;
    }

    /**
     * 出价、倍数必须严格为正
     */
    public static BigDecimal requirePositive(BigDecimal value, String name) {
        if (requireNonNull(value, name).signum() <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, got " + value);
        }
        return value;
    }

    /**
     * 地址统一小写，避免同一地址因大小写不同落到两个临界区。
     */
    public static String normalizeAddress(String address) {
        return requireNonEmpty(address, "address").trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 0x 开头的十六进制哈希按小写存取，大小写不同的查询命中同一条记录。
     * 其他编码（如 base58 签名）大小写敏感，只去掉首尾空白。
     */
    public static String normalizeTxHash(String txHash) {
        String trimmed = requireNonEmpty(txHash, "txHash").trim();
        if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
            return trimmed.toLowerCase(Locale.ROOT);
        }
        return trimmed;
    }
}
