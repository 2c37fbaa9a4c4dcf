package com.work.gateway.core.nonce;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.work.gateway.core.chain.ChainAdapter;
import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.exception.GatewayException;
import com.work.gateway.core.exception.NonceConflictException;
import com.work.gateway.core.exception.NotSubmittedException;
import com.work.gateway.core.exception.RemoteUnavailableException;
import com.work.gateway.core.execution.AddressSerialExecutor;
import com.work.gateway.core.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.work.gateway.core.support.ValidationUtils.normalizeAddress;
import static com.work.gateway.core.support.ValidationUtils.requireNonNegative;
import static com.work.gateway.core.support.ValidationUtils.requireNonNull;

/**
 * 负责“如何为某个地址分配正确的 nonce”。
 * <p>
 * 流程（自动分配）：
 * 1. 进入该地址的串行临界区（FIFO 排队，不拒绝）
 * 2. candidate = max(lastAllocated + 1, 节点报告的交易数)
 * 3. 执行 action(candidate)
 * 4. 成功或结果不确定 -> 提交 lastAllocated = candidate；明确未提交 -> 不提交
 * <p>
 * 显式 nonce（取消 / replace-by-fee）直接调用 action，不触碰 lastAllocated。
 */
public class NonceManager {

    private static final Logger log = LoggerFactory.getLogger(NonceManager.class);

    private final ChainAdapter chain;
    private final NonceRecordRepository repository;
    private final AddressSerialExecutor executor;
    private final Duration syncTtl;
    private final Clock clock;
    private final GatewayMetrics metrics;
    private final Cache<String, NonceRecord> records;

    public NonceManager(ChainAdapter chain,
                        NonceRecordRepository repository,
                        AddressSerialExecutor executor,
                        Duration syncTtl,
                        int cacheSize,
                        Clock clock,
                        GatewayMetrics metrics) {
        this.chain = requireNonNull(chain, "chain");
        this.repository = requireNonNull(repository, "repository");
        this.executor = requireNonNull(executor, "executor");
        this.syncTtl = requireNonNull(syncTtl, "syncTtl");
        this.clock = requireNonNull(clock, "clock");
        this.metrics = requireNonNull(metrics, "metrics");
        this.records = Caffeine.newBuilder()
                .maximumSize(Math.max(1, cacheSize))
                .build();
    }

    public ChainKey getChainKey() {
        return chain.getChainKey();
    }

    /**
     * 启动时对所有已知地址与节点对账（取最大值），修复重启后本地状态落后或超前的问题。
     * 节点不可达时直接失败，不做静默重试：这是 readiness 的前置条件。
     */
    public void init() {
        List<NonceRecord> known = repository.listByChain(chain.getChainKey());
        for (NonceRecord record : known) {
            String address = record.getAddress();
            try {
                executor.execute(sectionKey(address), () -> {
                    NonceRecord current = load(address);
                    return sync(current);
                });
            } catch (RemoteUnavailableException e) {
                throw new RemoteUnavailableException("nonce 对账失败 chain=" + chain.getChainKey() + " address=" + address, e);
            }
        }
        log.info("NonceManager initialized chain={} reconciled={}", chain.getChainKey(), known.size());
    }

    /**
     * 领取一个 nonce 并立即提交（nonce 已离开组件，视为已消耗）。
     */
    public long allocate(String address) {
        return provide(null, address, nonce -> nonce);
    }

    /**
     * @param explicitNonce 非 null 时走显式 nonce 路径（取消/替换），不进入分配逻辑
     * @param address       签名地址
     * @param action        拿到 nonce 后执行的动作
     */
    public <T> T provide(Long explicitNonce, String address, NonceAction<T> action) {
        String addr = normalizeAddress(address);
        requireNonNull(action, "action");

        if (explicitNonce != null) {
            requireNonNegative(explicitNonce, "explicitNonce");
            metrics.nonceAllocated("explicit");
            return invoke(action, explicitNonce);
        }

        return executor.execute(sectionKey(addr), () -> {
            NonceRecord record = loadSynced(addr);
            long candidate = record.nextCandidate();
            T result;
            try {
                result = action.apply(candidate);
            } catch (NotSubmittedException e) {
                // 确定没有对外提交：不提交 candidate。节点拒绝可能意味着本地落后（nonce too low），
                // 下一次分配前重新对账
                NonceRecord unsynced = record.unsynced();
                repository.save(unsynced);
                records.put(addr, unsynced);
                metrics.nonceAllocated("released");
                log.info("nonce not consumed chain={} address={} nonce={} reason={}",
                        chain.getChainKey(), addr, candidate, e.getMessage());
                throw e;
            } catch (Exception e) {
                // 结果不确定：宁可留下 gap，也不能复用 nonce
                commit(record, candidate);
                metrics.nonceAllocated("ambiguous");
                log.warn("nonce committed after ambiguous failure chain={} address={} nonce={} err={}",
                        chain.getChainKey(), addr, candidate, e.toString());
                throw wrap(e);
            }
            commit(record, candidate);
            metrics.nonceAllocated("committed");
            return result;
        });
    }

    /**
     * 最近一次已分配的 nonce，没有则返回 -1。
     */
    public long currentNonce(String address) {
        String addr = normalizeAddress(address);
        return executor.execute(sectionKey(addr), () -> load(addr).getLastAllocated());
    }

    /**
     * 下一次自动分配会使用的 nonce（不提交）。
     */
    public long peekNextNonce(String address) {
        String addr = normalizeAddress(address);
        return executor.execute(sectionKey(addr), () -> loadSynced(addr).nextCandidate());
    }

    private <T> T invoke(NonceAction<T> action, long nonce) {
        try {
            return action.apply(nonce);
        } catch (Exception e) {
            throw wrap(e);
        }
    }

    private void commit(NonceRecord record, long candidate) {
        if (candidate <= record.getLastAllocated()) {
            log.error("NONCE CONFLICT chain={} address={} candidate={} lastAllocated={}",
                    chain.getChainKey(), record.getAddress(), candidate, record.getLastAllocated());
            throw new NonceConflictException("nonce 未严格递增: candidate=" + candidate
                    + " lastAllocated=" + record.getLastAllocated() + " address=" + record.getAddress());
        }
        NonceRecord updated = record.withLastAllocated(candidate);
        repository.save(updated);
        records.put(updated.getAddress(), updated);
    }

    // 以下方法只能在该地址的临界区内调用

    private NonceRecord load(String addr) {
        NonceRecord cached = records.getIfPresent(addr);
        if (cached != null) {
            return cached;
        }
        NonceRecord record = repository.find(chain.getChainKey(), addr)
                .orElseGet(() -> NonceRecord.fresh(chain.getChainKey(), addr));
        records.put(addr, record);
        return record;
    }

    private NonceRecord loadSynced(String addr) {
        NonceRecord record = load(addr);
        Instant now = clock.instant();
        if (record.getSyncedAt() == null || !record.getSyncedAt().plus(syncTtl).isAfter(now)) {
            record = sync(record);
        }
        return record;
    }

    private NonceRecord sync(NonceRecord record) {
        long remoteCount = chain.reportedNonce(record.getAddress());
        metrics.rpcRequest("reportedNonce");
        NonceRecord reconciled = record.reconcile(remoteCount, clock.instant());
        if (reconciled.getLastAllocated() != record.getLastAllocated()) {
            log.info("nonce reconciled chain={} address={} local={} remoteCount={}",
                    chain.getChainKey(), record.getAddress(), record.getLastAllocated(), remoteCount);
        }
        repository.save(reconciled);
        records.put(reconciled.getAddress(), reconciled);
        return reconciled;
    }

    private String sectionKey(String addr) {
        return chain.getChainKey() + "|" + addr;
    }

    private static RuntimeException wrap(Exception e) {
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new GatewayException("nonce action 执行异常: " + msg, e);
    }
}
