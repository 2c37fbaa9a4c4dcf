package com.work.gateway.core.pending;

import com.work.gateway.core.chain.ChainKey;

import java.math.BigDecimal;
import java.time.Instant;

import static com.work.gateway.core.support.ValidationUtils.normalizeTxHash;
import static com.work.gateway.core.support.ValidationUtils.requireNonEmpty;
import static com.work.gateway.core.support.ValidationUtils.requireNonNegative;
import static com.work.gateway.core.support.ValidationUtils.requireNonNull;

/**
 * 已提交、尚未确认的交易。由 PendingTransactionStore 独占持有。
 */
public final class PendingTransaction {

    private final String txHash;
    private final ChainKey chain;
    private final long chainId;
    private final String fromAddress;
    private final long nonce;
    private final Instant submittedAt;
    private final BigDecimal feeAtSubmission;
    private final PendingTxStatus status;
    private final Instant updatedAt;

    public PendingTransaction(String txHash,
                              ChainKey chain,
                              long chainId,
                              String fromAddress,
                              long nonce,
                              Instant submittedAt,
                              BigDecimal feeAtSubmission,
                              PendingTxStatus status,
                              Instant updatedAt) {
        this.txHash = normalizeTxHash(txHash);
        this.chain = requireNonNull(chain, "chain");
        this.chainId = chainId;
        this.fromAddress = requireNonEmpty(fromAddress, "fromAddress");
        this.nonce = requireNonNegative(nonce, "nonce");
        this.submittedAt = requireNonNull(submittedAt, "submittedAt");
        this.feeAtSubmission = requireNonNull(feeAtSubmission, "feeAtSubmission");
        this.status = requireNonNull(status, "status");
        this.updatedAt = updatedAt == null ? submittedAt : updatedAt;
    }

    /**
     * 刚提交成功时的初始条目。
     */
    public static PendingTransaction submitted(String txHash, ChainKey chain, long chainId, String fromAddress,
                                               long nonce, BigDecimal fee, Instant now) {
        return new PendingTransaction(txHash, chain, chainId, fromAddress, nonce, now, fee, PendingTxStatus.PENDING, now);
    }

    public PendingTransaction withStatus(PendingTxStatus newStatus, Instant now) {
        return new PendingTransaction(txHash, chain, chainId, fromAddress, nonce, submittedAt, feeAtSubmission, newStatus, now);
    }

    public String getTxHash() {
        return txHash;
    }

    public ChainKey getChain() {
        return chain;
    }

    public long getChainId() {
        return chainId;
    }

    public String getFromAddress() {
        return fromAddress;
    }

    public long getNonce() {
        return nonce;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public BigDecimal getFeeAtSubmission() {
        return feeAtSubmission;
    }

    public PendingTxStatus getStatus() {
        return status;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "PendingTransaction{" + chain + " " + txHash + " from=" + fromAddress + " nonce=" + nonce
                + " fee=" + feeAtSubmission.toPlainString() + " status=" + status + '}';
    }
}
