package com.work.gateway.core.watch;

public enum SubscriptionKind {
    /**
     * 一次性：等待某笔交易签名/哈希的确认通知。
     */
    SIGNATURE,
    /**
     * 常驻：账户有任何变化都通知，重连后自动恢复。
     */
    ACCOUNT
}
