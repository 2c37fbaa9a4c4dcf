package com.work.gateway.core.pending;

import com.work.gateway.core.chain.ChainKey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 在途交易的持久化端口（跨重启保留，保证“提交后、确认前”崩溃不丢状态）。
 */
public interface PendingTransactionRepository {

    void insert(PendingTransaction tx);

    /**
     * 仅更新 status / updatedAt。
     */
    void updateStatus(PendingTransaction tx);

    Optional<PendingTransaction> find(ChainKey chain, String txHash);

    /**
     * 查找同一 (chain, address, nonce) 下非终态的条目。
     */
    Optional<PendingTransaction> findActiveByNonce(ChainKey chain, String fromAddress, long nonce);

    List<PendingTransaction> listByChain(ChainKey chain);

    boolean delete(ChainKey chain, String txHash);

    /**
     * 原子地删除 evicted（可为 null）并插入 replacement。
     */
    void replace(PendingTransaction evicted, PendingTransaction replacement);

    /**
     * 删除 submittedAt 早于 cutoff 的所有条目，返回删除条数。
     */
    int deleteSubmittedBefore(Instant cutoff);
}
