package com.work.gateway.core.chain;

/**
 * 核心组件可见的链交互最小端口，每条链各自实现。
 *
 * 核心代码只依赖这四个能力，从不按链名分支。
 * 所有方法都可能阻塞任意时长；节点不可达时抛 RemoteUnavailableException。
 */
public interface ChainAdapter {

    ChainKey getChainKey();

    long getChainId();

    /**
     * 节点报告的地址交易数（EVM: eth_getTransactionCount(pending)），即下一个可用 nonce。
     */
    long reportedNonce(String address);

    /**
     * 提交已签名的原始交易，返回 txHash。
     * 节点明确拒绝时抛 NotSubmittedException；超时等不确定结果抛 RemoteUnavailableException。
     */
    String submitRaw(String signedTx);

    /**
     * 当前网络报价。
     */
    FeeQuote feeEstimate();

    /**
     * 查询交易的事实状态（receipt / mempool / 不存在）。
     */
    ChainTxStatus txStatus(String txHash);
}
