package com.work.gateway.core.nonce;

import com.work.gateway.core.chain.ChainKey;

import java.time.Instant;

import static com.work.gateway.core.support.ValidationUtils.requireNonEmpty;
import static com.work.gateway.core.support.ValidationUtils.requireNonNull;

/**
 * 每个 (chain, address) 一条记录；只在串行临界区内被修改，进程生命周期内不删除。
 *
 * lastAllocated = -1 表示尚未分配过。syncedAt 为 null 表示从未与节点对账。
 */
public final class NonceRecord {

    public static final long NONE = -1L;

    private final ChainKey chain;
    private final String address;
    private final long lastAllocated;
    private final Instant syncedAt;

    public NonceRecord(ChainKey chain, String address, long lastAllocated, Instant syncedAt) {
        this.chain = requireNonNull(chain, "chain");
        this.address = requireNonEmpty(address, "address");
        this.lastAllocated = lastAllocated;
        this.syncedAt = syncedAt;
    }

    public static NonceRecord fresh(ChainKey chain, String address) {
        return new NonceRecord(chain, address, NONE, null);
    }

    /**
     * 与节点报告的交易数对账：取两者最大值。
     * remoteCount 是“下一个可用 nonce”，所以对应的已用最大值是 remoteCount - 1。
     */
    public NonceRecord reconcile(long remoteCount, Instant now) {
        long merged = Math.max(lastAllocated, remoteCount - 1);
        return new NonceRecord(chain, address, merged, now);
    }

    public NonceRecord withLastAllocated(long nonce) {
        return new NonceRecord(chain, address, nonce, syncedAt);
    }

    /**
     * 清掉对账时间，下次使用前强制与节点对账。
     */
    public NonceRecord unsynced() {
        return new NonceRecord(chain, address, lastAllocated, null);
    }

    public long nextCandidate() {
        return lastAllocated + 1;
    }

    public ChainKey getChain() {
        return chain;
    }

    public String getAddress() {
        return address;
    }

    public long getLastAllocated() {
        return lastAllocated;
    }

    public Instant getSyncedAt() {
        return syncedAt;
    }

    @Override
    public String toString() {
        return "NonceRecord{" + chain + "|" + address + ", lastAllocated=" + lastAllocated + ", syncedAt=" + syncedAt + '}';
    }
}
