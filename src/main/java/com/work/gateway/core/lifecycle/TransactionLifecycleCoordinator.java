package com.work.gateway.core.lifecycle;

import com.work.gateway.core.chain.CancelTransactionSigner;
import com.work.gateway.core.chain.ChainAdapter;
import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.chain.ChainTxStatus;
import com.work.gateway.core.exception.NotSubmittedException;
import com.work.gateway.core.exception.RemoteUnavailableException;
import com.work.gateway.core.exception.SubscriptionLostException;
import com.work.gateway.core.gas.GasPriceOracle;
import com.work.gateway.core.metrics.GatewayMetrics;
import com.work.gateway.core.nonce.NonceManager;
import com.work.gateway.core.pending.PendingTransaction;
import com.work.gateway.core.pending.PendingTransactionStore;
import com.work.gateway.core.pending.PendingTxStatus;
import com.work.gateway.core.watch.ConfirmationWatcher;
import com.work.gateway.core.watch.WatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static com.work.gateway.core.support.ValidationUtils.normalizeAddress;
import static com.work.gateway.core.support.ValidationUtils.requireNonEmpty;
import static com.work.gateway.core.support.ValidationUtils.requireNonNegative;
import static com.work.gateway.core.support.ValidationUtils.requireNonNull;
import static com.work.gateway.core.support.ValidationUtils.requirePositive;

/**
 * 交易生命周期编排（每个 chain/network 一个实例），本身不持有状态：
 * 分配 nonce -> 构造签名 -> 提交 -> 登记在途 -> 等待确认（实时推送或轮询）-> 终态驱逐。
 * <p>
 * 取消交易走 replace-by-fee：同 nonce、给自己转 0、更高的 fee，
 * 必须走 NonceManager 的显式 nonce 路径，否则会分到新号而无法顶掉卡单。
 */
public class TransactionLifecycleCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TransactionLifecycleCoordinator.class);

    private final ChainAdapter adapter;
    private final NonceManager nonceManager;
    private final PendingTransactionStore store;
    private final GasPriceOracle gasOracle;
    private final ConfirmationWatcher watcher;
    private final CancelTransactionSigner cancelSigner;
    private final BigDecimal cancelFeeMultiplier;
    private final int notFoundRetries;
    private final Duration notFoundRetryDelay;
    private final Clock clock;
    private final GatewayMetrics metrics;

    /**
     * @param watcher      为 null 表示该链不启用实时推送，watchConfirmation 直接回退
     * @param cancelSigner 为 null 表示该链不支持取消
     */
    public TransactionLifecycleCoordinator(ChainAdapter adapter,
                                           NonceManager nonceManager,
                                           PendingTransactionStore store,
                                           GasPriceOracle gasOracle,
                                           ConfirmationWatcher watcher,
                                           CancelTransactionSigner cancelSigner,
                                           BigDecimal cancelFeeMultiplier,
                                           int notFoundRetries,
                                           Duration notFoundRetryDelay,
                                           Clock clock,
                                           GatewayMetrics metrics) {
        this.adapter = requireNonNull(adapter, "adapter");
        this.nonceManager = requireNonNull(nonceManager, "nonceManager");
        this.store = requireNonNull(store, "store");
        this.gasOracle = requireNonNull(gasOracle, "gasOracle");
        this.watcher = watcher;
        this.cancelSigner = cancelSigner;
        this.cancelFeeMultiplier = requirePositive(cancelFeeMultiplier, "cancelFeeMultiplier");
        this.notFoundRetries = (int) requireNonNegative(notFoundRetries, "notFoundRetries");
        this.notFoundRetryDelay = requireNonNull(notFoundRetryDelay, "notFoundRetryDelay");
        this.clock = requireNonNull(clock, "clock");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    public ChainKey getChainKey() {
        return adapter.getChainKey();
    }

    public long allocateNonce(String address) {
        return nonceManager.allocate(address);
    }

    public long currentNonce(String address) {
        return nonceManager.currentNonce(address);
    }

    public long peekNextNonce(String address) {
        return nonceManager.peekNextNonce(address);
    }

    public BigDecimal currentFee() {
        return gasOracle.current(getChainKey());
    }

    /**
     * 自动分配 nonce 并提交，返回 txHash。
     */
    public String submitWithNonce(String address, SignedTransactionBuilder builder) {
        return submitWithNonce(address, null, builder);
    }

    /**
     * @param explicitNonce 非 null 时为 replace-by-fee：复用该 nonce，成功后替换登记簿中同 nonce 的在途条目
     */
    public String submitWithNonce(String address, Long explicitNonce, SignedTransactionBuilder builder) {
        String addr = normalizeAddress(address);
        requireNonNull(builder, "builder");
        // 在临界区外取报价：拿不到报价时什么都没发生
        BigDecimal suggestedFee = currentFee();
        ChainKey chain = getChainKey();

        return nonceManager.provide(explicitNonce, addr, nonce -> {
            SignedTransaction signed = buildSigned(builder, nonce, suggestedFee);
            Optional<PendingTransaction> stuck = explicitNonce == null
                    ? Optional.empty()
                    : store.findActiveByNonce(chain, addr, nonce);

            String txHash = adapter.submitRaw(signed.getRawTx());
            PendingTransaction entry = PendingTransaction.submitted(txHash, chain, adapter.getChainId(), addr,
                    nonce, signed.getFee(), clock.instant());
            if (stuck.isPresent()) {
                store.replace(stuck.get(), entry);
            } else {
                store.record(entry);
            }
            log.info("tx submitted chain={} address={} nonce={} fee={} txHash={}",
                    chain, addr, nonce, signed.getFee(), txHash);
            return txHash;
        });
    }

    /**
     * 取消卡住的交易，fee 取 max(当前报价, 卡单出价) * cancelFeeMultiplier。
     */
    public CancelResult cancelPending(String address, long nonce) {
        String addr = normalizeAddress(address);
        BigDecimal base = currentFee();
        Optional<PendingTransaction> stuck = store.findActiveByNonce(getChainKey(), addr, nonce);
        if (stuck.isPresent() && stuck.get().getFeeAtSubmission().compareTo(base) > 0) {
            base = stuck.get().getFeeAtSubmission();
        }
        return cancelPending(addr, nonce, base.multiply(cancelFeeMultiplier));
    }

    /**
     * 以显式 nonce 提交一笔自转账顶掉卡单。
     * <p>
     * bumpedFee 必须严格高于卡单的出价。提交失败时先查原交易状态：
     * 原交易已经上链则返回 ALREADY_CONFIRMED，而不是报错。
     */
    public CancelResult cancelPending(String address, long nonce, BigDecimal bumpedFee) {
        if (cancelSigner == null) {
            throw new IllegalStateException("cancel is not supported on " + getChainKey());
        }
        String addr = normalizeAddress(address);
        requireNonNegative(nonce, "nonce");
        requirePositive(bumpedFee, "bumpedFee");
        ChainKey chain = getChainKey();

        Optional<PendingTransaction> stuck = store.findActiveByNonce(chain, addr, nonce);
        if (stuck.isPresent() && bumpedFee.compareTo(stuck.get().getFeeAtSubmission()) <= 0) {
            throw new IllegalArgumentException("bumpedFee " + bumpedFee + " must be greater than "
                    + stuck.get().getFeeAtSubmission() + " of " + stuck.get().getTxHash());
        }

        return nonceManager.provide(nonce, addr, n -> {
            String raw;
            try {
                raw = cancelSigner.signSelfTransfer(addr, n, bumpedFee, adapter.getChainId());
            } catch (RuntimeException e) {
                throw new NotSubmittedException("failed to sign cancel transaction for nonce " + n, e);
            }
            String cancelHash;
            try {
                cancelHash = adapter.submitRaw(raw);
            } catch (RuntimeException e) {
                Optional<CancelResult> raced = alreadyConfirmed(stuck.orElse(null), n);
                if (raced.isPresent()) {
                    log.info("cancel raced with confirmation chain={} address={} nonce={} original={}",
                            chain, addr, n, raced.get().getTxHash());
                    return raced.get();
                }
                throw e;
            }
            PendingTransaction replacement = PendingTransaction.submitted(cancelHash, chain, adapter.getChainId(),
                    addr, n, bumpedFee, clock.instant());
            store.replace(stuck.orElse(null), replacement);
            log.info("cancel submitted chain={} address={} nonce={} fee={} cancelTx={} original={}",
                    chain, addr, n, bumpedFee, cancelHash, stuck.map(PendingTransaction::getTxHash).orElse(null));
            return CancelResult.submitted(cancelHash, n, bumpedFee);
        });
    }

    /**
     * 主动查询节点。
     * <p>
     * - 有 receipt：CONFIRMED / FAILED，并驱逐登记簿条目
     * - 在 mempool：登记过则做启发式分类，否则 MEMPOOL_UNKNOWN
     * - 查不到（重试 notFoundRetries 次后）：PENDING，绝不猜测成终态
     */
    public TxStatusReport getStatus(String txHash) {
        requireNonEmpty(txHash, "txHash");
        ChainKey chain = getChainKey();
        Optional<PendingTransaction> pending = store.get(chain, txHash);
        ChainTxStatus onChain = pollWithRetries(txHash);

        TxStatusReport report;
        switch (onChain.getKind()) {
            case CONFIRMED:
            case FAILED: {
                PendingTxStatus terminal = onChain.getKind() == ChainTxStatus.Kind.CONFIRMED
                        ? PendingTxStatus.CONFIRMED
                        : PendingTxStatus.FAILED;
                PendingTransaction last = pending.map(p -> store.complete(p, terminal)).orElse(null);
                report = new TxStatusReport(chain, txHash, terminal, last, onChain.getBlockNumber());
                break;
            }
            case IN_MEMPOOL:
                if (pending.isPresent()) {
                    PendingTransaction p = pending.get();
                    PendingTxStatus status = store.classify(p, feeForClassification());
                    report = new TxStatusReport(chain, txHash, status, p.withStatus(status, clock.instant()), null);
                } else {
                    report = new TxStatusReport(chain, txHash, PendingTxStatus.MEMPOOL_UNKNOWN, null, null);
                }
                break;
            default:
                report = new TxStatusReport(chain, txHash, PendingTxStatus.PENDING, pending.orElse(null), null);
        }
        metrics.statusPoll(report.getStatus().name());
        log.debug("status {}", report);
        return report;
    }

    public CompletableFuture<WatchResult> watchConfirmation(String txHash) {
        return watchConfirmation(txHash, watcher == null ? null : watcher.getDefaultTimeout());
    }

    /**
     * 通过实时推送等待确认；CONFIRMED / FAILED 时驱逐登记簿条目。
     * 未启用推送或未连接时以 {@link SubscriptionLostException} 异常完成，调用方改用 getStatus 轮询。
     */
    public CompletableFuture<WatchResult> watchConfirmation(String txHash, Duration timeout) {
        requireNonEmpty(txHash, "txHash");
        if (watcher == null) {
            CompletableFuture<WatchResult> f = new CompletableFuture<>();
            f.completeExceptionally(new SubscriptionLostException("live watcher disabled on " + getChainKey()));
            return f;
        }
        return watcher.watch(txHash, timeout).thenApply(result -> {
            if (result.getOutcome() != WatchResult.Outcome.TIMEOUT) {
                PendingTxStatus terminal = result.isConfirmed() ? PendingTxStatus.CONFIRMED : PendingTxStatus.FAILED;
                store.get(getChainKey(), txHash).ifPresent(p -> store.complete(p, terminal));
            }
            return result;
        });
    }

    private SignedTransaction buildSigned(SignedTransactionBuilder builder, long nonce, BigDecimal suggestedFee) {
        SignedTransaction signed;
        try {
            signed = builder.build(nonce, suggestedFee);
        } catch (NotSubmittedException e) {
            throw e;
        } catch (Exception e) {
            throw new NotSubmittedException("failed to build transaction for nonce " + nonce + ": " + e.getMessage(), e);
        }
        if (signed == null) {
            throw new NotSubmittedException("builder returned no transaction for nonce " + nonce);
        }
        return signed;
    }

    private ChainTxStatus pollWithRetries(String txHash) {
        ChainTxStatus status = adapter.txStatus(txHash);
        for (int i = 0; i < notFoundRetries && status.getKind() == ChainTxStatus.Kind.NOT_FOUND; i++) {
            try {
                Thread.sleep(notFoundRetryDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return status;
            }
            status = adapter.txStatus(txHash);
        }
        return status;
    }

    /**
     * 拿不到报价时返回 null，分类结果为 PENDING。
     */
    private BigDecimal feeForClassification() {
        try {
            return gasOracle.current(getChainKey());
        } catch (RemoteUnavailableException e) {
            log.warn("fee unavailable for classification chain={} err={}", getChainKey(), e.getMessage());
            return null;
        }
    }

    private Optional<CancelResult> alreadyConfirmed(PendingTransaction original, long nonce) {
        if (original == null) {
            return Optional.empty();
        }
        ChainTxStatus status;
        try {
            status = adapter.txStatus(original.getTxHash());
        } catch (RemoteUnavailableException e) {
            log.warn("cannot verify original tx after cancel failure chain={} txHash={} err={}",
                    getChainKey(), original.getTxHash(), e.getMessage());
            return Optional.empty();
        }
        if (!status.isTerminal()) {
            return Optional.empty();
        }
        store.complete(original, status.getKind() == ChainTxStatus.Kind.CONFIRMED
                ? PendingTxStatus.CONFIRMED
                : PendingTxStatus.FAILED);
        return Optional.of(CancelResult.alreadyConfirmed(original.getTxHash(), nonce));
    }
}
