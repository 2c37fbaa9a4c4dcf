package com.work.gateway.repository.impl;

import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.pending.PendingTransaction;
import com.work.gateway.core.pending.PendingTransactionRepository;
import com.work.gateway.core.pending.PendingTxStatus;
import com.work.gateway.repository.entity.PendingTransactionEntity;
import com.work.gateway.repository.mapper.PendingTransactionMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.work.gateway.core.support.ValidationUtils.normalizeTxHash;
import static com.work.gateway.core.support.ValidationUtils.requireNonEmpty;
import static com.work.gateway.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 MyBatis-Plus 的 PendingTransactionRepository 实现。
 * replace 的删除与插入在同一个数据库事务中完成。
 */
public class MybatisPendingTransactionRepository implements PendingTransactionRepository {

    private final PendingTransactionMapper mapper;
    private final TransactionTemplate transactionTemplate;

    public MybatisPendingTransactionRepository(PendingTransactionMapper mapper, TransactionTemplate transactionTemplate) {
        this.mapper = requireNonNull(mapper, "mapper");
        this.transactionTemplate = requireNonNull(transactionTemplate, "transactionTemplate");
    }

    @Override
    public void insert(PendingTransaction tx) {
        requireNonNull(tx, "tx");
        mapper.insert(convert(tx));
    }

    @Override
    public void updateStatus(PendingTransaction tx) {
        requireNonNull(tx, "tx");
        mapper.updateStatus(id(tx.getChain(), tx.getTxHash()), tx.getStatus().name(), tx.getUpdatedAt());
    }

    @Override
    public Optional<PendingTransaction> find(ChainKey chain, String txHash) {
        requireNonNull(chain, "chain");
        requireNonEmpty(txHash, "txHash");
        return Optional.ofNullable(mapper.selectById(id(chain, txHash))).map(this::convert);
    }

    @Override
    public Optional<PendingTransaction> findActiveByNonce(ChainKey chain, String fromAddress, long nonce) {
        requireNonNull(chain, "chain");
        requireNonEmpty(fromAddress, "fromAddress");
        return Optional.ofNullable(mapper.selectActiveByNonce(chain.getChain(), chain.getNetwork(), fromAddress, nonce))
                .map(this::convert);
    }

    @Override
    public List<PendingTransaction> listByChain(ChainKey chain) {
        requireNonNull(chain, "chain");
        List<PendingTransaction> out = new ArrayList<>();
        for (PendingTransactionEntity entity : mapper.selectByChain(chain.getChain(), chain.getNetwork())) {
            out.add(convert(entity));
        }
        return out;
    }

    @Override
    public boolean delete(ChainKey chain, String txHash) {
        return mapper.deleteById(id(chain, txHash)) > 0;
    }

    @Override
    public void replace(PendingTransaction evicted, PendingTransaction replacement) {
        requireNonNull(replacement, "replacement");
        transactionTemplate.executeWithoutResult(status -> {
            if (evicted != null) {
                mapper.deleteById(id(evicted.getChain(), evicted.getTxHash()));
            }
            mapper.insert(convert(replacement));
        });
    }

    @Override
    public int deleteSubmittedBefore(Instant cutoff) {
        requireNonNull(cutoff, "cutoff");
        return mapper.deleteSubmittedBefore(cutoff);
    }

    private PendingTransactionEntity convert(PendingTransaction tx) {
        PendingTransactionEntity entity = new PendingTransactionEntity();
        entity.setId(id(tx.getChain(), tx.getTxHash()));
        entity.setTxHash(tx.getTxHash());
        entity.setChain(tx.getChain().getChain());
        entity.setNetwork(tx.getChain().getNetwork());
        entity.setChainId(tx.getChainId());
        entity.setFromAddress(tx.getFromAddress());
        entity.setNonce(tx.getNonce());
        entity.setSubmittedAt(tx.getSubmittedAt());
        entity.setFeeAtSubmission(tx.getFeeAtSubmission());
        entity.setStatus(tx.getStatus().name());
        entity.setUpdatedAt(tx.getUpdatedAt());
        return entity;
    }

    private PendingTransaction convert(PendingTransactionEntity entity) {
        return new PendingTransaction(entity.getTxHash(),
                ChainKey.of(entity.getChain(), entity.getNetwork()),
                entity.getChainId(),
                entity.getFromAddress(),
                entity.getNonce(),
                entity.getSubmittedAt(),
                entity.getFeeAtSubmission(),
                PendingTxStatus.valueOf(entity.getStatus()),
                entity.getUpdatedAt());
    }

    private static String id(ChainKey chain, String txHash) {
        return chain + "|" + normalizeTxHash(txHash);
    }
}
