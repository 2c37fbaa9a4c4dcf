package com.work.gateway.core.lifecycle;

import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.pending.PendingTransaction;
import com.work.gateway.core.pending.PendingTxStatus;

import java.util.Optional;

/**
 * 一次状态查询的结果。pending 为登记簿中的条目（终态时为驱逐前的最后快照）。
 */
public final class TxStatusReport {

    private final ChainKey chain;
    private final String txHash;
    private final PendingTxStatus status;
    private final PendingTransaction pending;
    private final Long blockNumber;

    public TxStatusReport(ChainKey chain, String txHash, PendingTxStatus status,
                          PendingTransaction pending, Long blockNumber) {
        this.chain = chain;
        this.txHash = txHash;
        this.status = status;
        this.pending = pending;
        this.blockNumber = blockNumber;
    }

    public ChainKey getChain() {
        return chain;
    }

    public String getTxHash() {
        return txHash;
    }

    public PendingTxStatus getStatus() {
        return status;
    }

    public Optional<PendingTransaction> getPending() {
        return Optional.ofNullable(pending);
    }

    /**
     * 上链区块号，仅 CONFIRMED / FAILED 时有值。
     */
    public Optional<Long> getBlockNumber() {
        return Optional.ofNullable(blockNumber);
    }

    @Override
    public String toString() {
        return "TxStatusReport{" + chain + ", txHash=" + txHash + ", status=" + status + ", blockNumber=" + blockNumber + '}';
    }
}
