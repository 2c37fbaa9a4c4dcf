package com.work.gateway.chain.mock;

import com.work.gateway.core.chain.ChainAdapter;
import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.chain.ChainTxStatus;
import com.work.gateway.core.chain.FeeQuote;
import com.work.gateway.core.exception.NotSubmittedException;
import org.web3j.crypto.Hash;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import static com.work.gateway.core.support.ValidationUtils.normalizeAddress;
import static com.work.gateway.core.support.ValidationUtils.requireNonNull;

/**
 * 内存版链，仅用于本地演示与测试。
 * <p>
 * 原始交易格式为 "mock|from|nonce|fee"（见 {@link #encodeRaw}）；
 * 提交后 receiptDelay 内处于 mempool，之后出回执；同 (from, nonce) 的后一笔会顶掉前一笔。
 */
public class MockChainAdapter implements ChainAdapter {

    private static final String RAW_PREFIX = "mock|";

    private final ChainKey chainKey;
    private final long chainId;
    private final Clock clock;
    private final Duration receiptDelay;

    private final Map<String, Long> reportedNonces = new ConcurrentHashMap<>();
    private final Map<String, MockTx> txs = new ConcurrentHashMap<>();
    private final Map<String, String> hashBySlot = new ConcurrentHashMap<>();
    private final AtomicLong blockNumber = new AtomicLong(1);

    private volatile BigDecimal baseFee = new BigDecimal("20");
    private volatile BigDecimal priorityFee;

    private static final class MockTx {
        final Instant sentAt;
        volatile long blockNumber = -1L;

        MockTx(Instant sentAt) {
            this.sentAt = sentAt;
        }
    }

    public MockChainAdapter(ChainKey chainKey, long chainId, Clock clock, Duration receiptDelay) {
        this.chainKey = requireNonNull(chainKey, "chainKey");
        this.chainId = chainId;
        this.clock = requireNonNull(clock, "clock");
        this.receiptDelay = requireNonNull(receiptDelay, "receiptDelay");
    }

    public static String encodeRaw(String from, long nonce, BigDecimal fee) {
        return RAW_PREFIX + normalizeAddress(from) + "|" + nonce + "|" + fee.toPlainString();
    }

    @Override
    public ChainKey getChainKey() {
        return chainKey;
    }

    @Override
    public long getChainId() {
        return chainId;
    }

    @Override
    public long reportedNonce(String address) {
        return reportedNonces.getOrDefault(normalizeAddress(address), 0L);
    }

    @Override
    public String submitRaw(String signedTx) {
        if (signedTx == null || !signedTx.startsWith(RAW_PREFIX)) {
            throw new NotSubmittedException("malformed mock transaction");
        }
        String[] parts = signedTx.split("\\|");
        if (parts.length != 4) {
            throw new NotSubmittedException("malformed mock transaction: " + signedTx);
        }
        String from = parts[1];
        long nonce;
        try {
            nonce = Long.parseLong(parts[2]);
        } catch (NumberFormatException e) {
            throw new NotSubmittedException("malformed nonce in mock transaction: " + parts[2], e);
        }
        String txHash = Hash.sha3String(signedTx);
        String previous = hashBySlot.put(from + "|" + nonce, txHash);
        if (previous != null && !previous.equals(txHash)) {
            txs.remove(previous);
        }
        txs.put(txHash, new MockTx(clock.instant()));
        reportedNonces.merge(from, nonce + 1, Math::max);
        return txHash;
    }

    @Override
    public FeeQuote feeEstimate() {
        return new FeeQuote(baseFee, priorityFee);
    }

    @Override
    public ChainTxStatus txStatus(String txHash) {
        MockTx tx = txs.get(txHash);
        if (tx == null) {
            return ChainTxStatus.notFound();
        }
        if (clock.instant().isBefore(tx.sentAt.plus(receiptDelay))) {
            return ChainTxStatus.inMempool();
        }
        synchronized (tx) {
            if (tx.blockNumber < 0) {
                tx.blockNumber = blockNumber.getAndIncrement();
            }
        }
        return ChainTxStatus.confirmed(tx.blockNumber);
    }

    public void setBaseFee(BigDecimal baseFee) {
        this.baseFee = requireNonNull(baseFee, "baseFee");
    }

    public void setPriorityFee(BigDecimal priorityFee) {
        this.priorityFee = priorityFee;
    }

    /**
     * 模拟其他进程/钱包已在链上用过若干 nonce。
     */
    public void setReportedNonce(String address, long count) {
        reportedNonces.put(normalizeAddress(address), count);
    }
}
