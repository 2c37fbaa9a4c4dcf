package com.work.gateway.core.lifecycle;

import java.math.BigDecimal;

public final class CancelResult {

    public enum Outcome {
        /**
         * 取消交易已提交，txHash 为取消交易的哈希。
         */
        CANCEL_SUBMITTED,
        /**
         * 取消交易提交失败，但原交易已经上链，txHash 为原交易哈希。不是错误。
         */
        ALREADY_CONFIRMED
    }

    private final Outcome outcome;
    private final String txHash;
    private final long nonce;
    private final BigDecimal fee;

    private CancelResult(Outcome outcome, String txHash, long nonce, BigDecimal fee) {
        this.outcome = outcome;
        this.txHash = txHash;
        this.nonce = nonce;
        this.fee = fee;
    }

    public static CancelResult submitted(String cancelTxHash, long nonce, BigDecimal fee) {
        return new CancelResult(Outcome.CANCEL_SUBMITTED, cancelTxHash, nonce, fee);
    }

    public static CancelResult alreadyConfirmed(String originalTxHash, long nonce) {
        return new CancelResult(Outcome.ALREADY_CONFIRMED, originalTxHash, nonce, null);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getTxHash() {
        return txHash;
    }

    public long getNonce() {
        return nonce;
    }

    /**
     * 取消交易的出价；ALREADY_CONFIRMED 时为 null。
     */
    public BigDecimal getFee() {
        return fee;
    }

    @Override
    public String toString() {
        return "CancelResult{" + outcome + ", txHash=" + txHash + ", nonce=" + nonce + ", fee=" + fee + '}';
    }
}
