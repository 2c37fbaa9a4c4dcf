package com.work.gateway.core.lifecycle;

import java.math.BigDecimal;

import static com.work.gateway.core.support.ValidationUtils.requireNonEmpty;
import static com.work.gateway.core.support.ValidationUtils.requireNonNull;

/**
 * 调用方构造并签名好的交易，以及它实际出价的 fee（gwei），后者用于启发式分类。
 */
public final class SignedTransaction {

    private final String rawTx;
    private final BigDecimal fee;

    public SignedTransaction(String rawTx, BigDecimal fee) {
        this.rawTx = requireNonEmpty(rawTx, "rawTx");
        this.fee = requireNonNull(fee, "fee");
    }

    public String getRawTx() {
        return rawTx;
    }

    public BigDecimal getFee() {
        return fee;
    }
}
