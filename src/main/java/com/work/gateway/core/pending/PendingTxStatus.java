package com.work.gateway.core.pending;

/**
 * 在途交易状态。CONFIRMED / FAILED 为终态，到达后条目被驱逐。
 */
public enum PendingTxStatus {
    /**
     * 无法判断（节点查不到、或缺少分类所需数据），不猜测终态。
     */
    PENDING(0),
    MEMPOOL_LIKELY_SUCCEED(2),
    MEMPOOL_LIKELY_FAIL(3),
    /**
     * 节点 mempool 中存在，但本地没有提交记录，无法启发式判断。
     */
    MEMPOOL_UNKNOWN(0),
    CONFIRMED(1),
    FAILED(-1);

    private final int legacyCode;

    PendingTxStatus(int legacyCode) {
        this.legacyCode = legacyCode;
    }

    /**
     * 旧版 poll 接口的数字状态码：-1 失败，0 未知，1 成功，2 大概率成功，3 大概率失败。
     */
    public int getLegacyCode() {
        return legacyCode;
    }

    public boolean isTerminal() {
        return this == CONFIRMED || this == FAILED;
    }
}
