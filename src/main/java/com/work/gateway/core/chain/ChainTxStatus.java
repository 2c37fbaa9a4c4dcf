package com.work.gateway.core.chain;

/**
 * 节点对一笔交易给出的事实状态（不含任何启发式推断）。
 */
public class ChainTxStatus {

    public enum Kind {
        /**
         * 已上链且执行成功。
         */
        CONFIRMED,
        /**
         * 已上链但执行失败（receipt.status = 0）。
         */
        FAILED,
        /**
         * 节点能查到交易但尚无 receipt。
         */
        IN_MEMPOOL,
        /**
         * 节点完全查不到该交易。
         */
        NOT_FOUND
    }

    private final Kind kind;
    private final long blockNumber;

    private ChainTxStatus(Kind kind, long blockNumber) {
        this.kind = kind;
        this.blockNumber = blockNumber;
    }

    public static ChainTxStatus confirmed(long blockNumber) {
        return new ChainTxStatus(Kind.CONFIRMED, blockNumber);
    }

    public static ChainTxStatus failed(long blockNumber) {
        return new ChainTxStatus(Kind.FAILED, blockNumber);
    }

    public static ChainTxStatus inMempool() {
        return new ChainTxStatus(Kind.IN_MEMPOOL, -1L);
    }

    public static ChainTxStatus notFound() {
        return new ChainTxStatus(Kind.NOT_FOUND, -1L);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 所在区块高度；未上链时为 -1。
     */
    public long getBlockNumber() {
        return blockNumber;
    }

    public boolean isTerminal() {
        return kind == Kind.CONFIRMED || kind == Kind.FAILED;
    }
}
