package com.work.gateway.core.chain;

import java.math.BigDecimal;

import static com.work.gateway.core.support.ValidationUtils.requireNonNull;

/**
 * 节点报价（单位 gwei）。priorityFee 为 null 表示该链没有 priority fee 概念。
 */
public class FeeQuote {

    private final BigDecimal baseFee;
    private final BigDecimal priorityFee;

    public FeeQuote(BigDecimal baseFee, BigDecimal priorityFee) {
        this.baseFee = requireNonNull(baseFee, "baseFee");
        this.priorityFee = priorityFee;
    }

    public static FeeQuote baseOnly(BigDecimal baseFee) {
        return new FeeQuote(baseFee, null);
    }

    public BigDecimal getBaseFee() {
        return baseFee;
    }

    public BigDecimal getPriorityFee() {
        return priorityFee;
    }

    public BigDecimal total() {
        return priorityFee == null ? baseFee : baseFee.add(priorityFee);
    }
}
