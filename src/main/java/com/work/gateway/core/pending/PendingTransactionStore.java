package com.work.gateway.core.pending;

import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.exception.NonceConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.work.gateway.core.support.ValidationUtils.requireNonEmpty;
import static com.work.gateway.core.support.ValidationUtils.requireNonNull;
import static com.work.gateway.core.support.ValidationUtils.requirePositive;

/**
 * 在途交易登记簿：记录、查询、启发式分类、驱逐。
 * <p>
 * 分类规则：已等待时长 > durationLimit 且 当前网络 fee > 提交时 fee -> 大概率失败；否则大概率成功。
 * 两个条件必须同时成立：只是等得久可能是网络空闲，只是 fee 偏低也可能很快被打包。
 * <p>
 * 只有 Coordinator 写入该登记簿。
 */
public class PendingTransactionStore {

    private static final Logger log = LoggerFactory.getLogger(PendingTransactionStore.class);

    private final PendingTransactionRepository repository;
    private final Duration durationLimit;
    private final Duration retention;
    private final Clock clock;

    // record / replace 的“先查后写”需要原子化
    private final Object writeLock = new Object();

    public PendingTransactionStore(PendingTransactionRepository repository,
                                   Duration durationLimit,
                                   Duration retention,
                                   Clock clock) {
        this.repository = requireNonNull(repository, "repository");
        this.durationLimit = requirePositive(durationLimit, "durationLimit");
        this.retention = requirePositive(retention, "retention");
        this.clock = requireNonNull(clock, "clock");
    }

    /**
     * 每次提交只调用一次（不是每次重试）。同 (chain, address, nonce) 已有非终态条目时拒绝。
     */
    public void record(PendingTransaction tx) {
        requireNonNull(tx, "tx");
        synchronized (writeLock) {
            Optional<PendingTransaction> existing = repository.findActiveByNonce(tx.getChain(), tx.getFromAddress(), tx.getNonce());
            if (existing.isPresent()) {
                PendingTransaction other = existing.get();
                if (other.getTxHash().equals(tx.getTxHash())) {
                    log.warn("pending tx already recorded chain={} txHash={}", tx.getChain(), tx.getTxHash());
                    return;
                }
                log.error("NONCE CONFLICT in pending store chain={} address={} nonce={} existing={} incoming={}",
                        tx.getChain(), tx.getFromAddress(), tx.getNonce(), other.getTxHash(), tx.getTxHash());
                throw new NonceConflictException("nonce " + tx.getNonce() + " 已被在途交易 " + other.getTxHash() + " 占用");
            }
            repository.insert(tx);
        }
        log.info("pending tx recorded {}", tx);
    }

    /**
     * replace-by-fee：驱逐该 nonce 上的在途条目（通常就是 original）并记录替换交易。
     * original 只用于校验同地址同 nonce，可为 null。
     */
    public void replace(PendingTransaction original, PendingTransaction replacement) {
        requireNonNull(replacement, "replacement");
        synchronized (writeLock) {
            if (original != null
                    && (original.getNonce() != replacement.getNonce()
                    || !original.getFromAddress().equals(replacement.getFromAddress()))) {
                throw new IllegalArgumentException("replacement 必须与原交易同地址同 nonce");
            }
            // 同一 nonce 至多一条非终态条目；original 已被驱逐时这里可能为空
            PendingTransaction evicted = repository.findActiveByNonce(
                    replacement.getChain(), replacement.getFromAddress(), replacement.getNonce()).orElse(null);
            repository.replace(evicted, replacement);
        }
        log.info("pending tx replaced original={} replacement={}",
                original == null ? null : original.getTxHash(), replacement.getTxHash());
    }

    public Optional<PendingTransaction> get(ChainKey chain, String txHash) {
        requireNonNull(chain, "chain");
        requireNonEmpty(txHash, "txHash");
        return repository.find(chain, txHash);
    }

    public Optional<PendingTransaction> findActiveByNonce(ChainKey chain, String fromAddress, long nonce) {
        requireNonNull(chain, "chain");
        requireNonEmpty(fromAddress, "fromAddress");
        return repository.findActiveByNonce(chain, fromAddress, nonce);
    }

    public List<PendingTransaction> listActive(ChainKey chain) {
        requireNonNull(chain, "chain");
        return repository.listByChain(chain);
    }

    /**
     * 计算并持久化启发式状态。currentFee 为 null（拿不到当前报价）时返回 PENDING，不做猜测。
     */
    public PendingTxStatus classify(PendingTransaction tx, BigDecimal currentFee) {
        requireNonNull(tx, "tx");
        if (tx.getStatus().isTerminal()) {
            return tx.getStatus();
        }
        PendingTxStatus status = decide(tx, currentFee, clock.instant());
        if (status != tx.getStatus()) {
            repository.updateStatus(tx.withStatus(status, clock.instant()));
        }
        return status;
    }

    private PendingTxStatus decide(PendingTransaction tx, BigDecimal currentFee, Instant now) {
        if (currentFee == null) {
            return PendingTxStatus.PENDING;
        }
        Duration elapsed = Duration.between(tx.getSubmittedAt(), now);
        if (elapsed.compareTo(durationLimit) > 0 && currentFee.compareTo(tx.getFeeAtSubmission()) > 0) {
            return PendingTxStatus.MEMPOOL_LIKELY_FAIL;
        }
        return PendingTxStatus.MEMPOOL_LIKELY_SUCCEED;
    }

    /**
     * 节点给出终态后调用：驱逐条目并返回带终态的副本。
     */
    public PendingTransaction complete(PendingTransaction tx, PendingTxStatus terminal) {
        requireNonNull(tx, "tx");
        if (terminal == null || !terminal.isTerminal()) {
            throw new IllegalArgumentException("terminal 必须为 CONFIRMED 或 FAILED");
        }
        evict(tx.getChain(), tx.getTxHash());
        log.info("pending tx finished chain={} txHash={} status={}", tx.getChain(), tx.getTxHash(), terminal);
        return tx.withStatus(terminal, clock.instant());
    }

    public boolean evict(ChainKey chain, String txHash) {
        requireNonNull(chain, "chain");
        requireNonEmpty(txHash, "txHash");
        return repository.delete(chain, txHash);
    }

    /**
     * 驱逐超过保留期的条目，返回驱逐条数。
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int n = repository.deleteSubmittedBefore(cutoff);
        if (n > 0) {
            log.info("purged {} pending tx submitted before {}", n, cutoff);
        }
        return n;
    }
}
