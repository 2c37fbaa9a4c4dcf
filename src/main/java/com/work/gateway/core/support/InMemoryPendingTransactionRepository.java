package com.work.gateway.core.support;

import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.pending.PendingTransaction;
import com.work.gateway.core.pending.PendingTransactionRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 纯内存实现，方便在没有数据库的环境下演示组件行为。
 * 注意：不具备跨重启持久性。
 */
public class InMemoryPendingTransactionRepository implements PendingTransactionRepository {

    private final Map<String, PendingTransaction> table = new ConcurrentHashMap<>();

    @Override
    public void insert(PendingTransaction tx) {
        if (table.putIfAbsent(key(tx.getChain(), tx.getTxHash()), tx) != null) {
            throw new IllegalStateException("pending tx 已存在: " + tx.getTxHash());
        }
    }

    @Override
    public void updateStatus(PendingTransaction tx) {
        table.computeIfPresent(key(tx.getChain(), tx.getTxHash()), (k, old) -> old.withStatus(tx.getStatus(), tx.getUpdatedAt()));
    }

    @Override
    public Optional<PendingTransaction> find(ChainKey chain, String txHash) {
        return Optional.ofNullable(table.get(key(chain, txHash)));
    }

    @Override
    public Optional<PendingTransaction> findActiveByNonce(ChainKey chain, String fromAddress, long nonce) {
        return table.values().stream()
                .filter(tx -> tx.getChain().equals(chain))
                .filter(tx -> tx.getFromAddress().equals(fromAddress))
                .filter(tx -> tx.getNonce() == nonce)
                .filter(tx -> !tx.getStatus().isTerminal())
                .findFirst();
    }

    @Override
    public List<PendingTransaction> listByChain(ChainKey chain) {
        List<PendingTransaction> out = new ArrayList<>();
        for (PendingTransaction tx : table.values()) {
            if (tx.getChain().equals(chain)) {
                out.add(tx);
            }
        }
        out.sort(Comparator.comparing(PendingTransaction::getSubmittedAt));
        return out;
    }

    @Override
    public boolean delete(ChainKey chain, String txHash) {
        return table.remove(key(chain, txHash)) != null;
    }

    @Override
    public synchronized void replace(PendingTransaction evicted, PendingTransaction replacement) {
        if (evicted != null) {
            delete(evicted.getChain(), evicted.getTxHash());
        }
        insert(replacement);
    }

    @Override
    public int deleteSubmittedBefore(Instant cutoff) {
        int n = 0;
        for (Map.Entry<String, PendingTransaction> e : table.entrySet()) {
            if (e.getValue().getSubmittedAt().isBefore(cutoff) && table.remove(e.getKey(), e.getValue())) {
                n++;
            }
        }
        return n;
    }

    private static String key(ChainKey chain, String txHash) {
        return chain + "|" + ValidationUtils.normalizeTxHash(txHash);
    }
}
