package com.work.gateway.core.gas;

import java.math.BigDecimal;

/**
 * 链特定的报价修正：adjusted = max(raw * multiplier, floor)。
 * 用于已知会低报 fee 的网络。
 */
public final class FeeAdjustment {

    private static final FeeAdjustment NONE = new FeeAdjustment(null, BigDecimal.ONE);

    private final BigDecimal floor;
    private final BigDecimal multiplier;

    public FeeAdjustment(BigDecimal floor, BigDecimal multiplier) {
        if (multiplier != null && multiplier.signum() <= 0) {
            throw new IllegalArgumentException("multiplier 必须大于0");
        }
        this.floor = floor;
        this.multiplier = multiplier == null ? BigDecimal.ONE : multiplier;
    }

    public static FeeAdjustment none() {
        return NONE;
    }

    public BigDecimal apply(BigDecimal raw) {
        BigDecimal scaled = raw.multiply(multiplier);
        if (floor != null && scaled.compareTo(floor) < 0) {
            return floor;
        }
        return scaled;
    }

    public BigDecimal getFloor() {
        return floor;
    }

    public BigDecimal getMultiplier() {
        return multiplier;
    }
}
