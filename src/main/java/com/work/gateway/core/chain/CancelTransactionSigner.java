package com.work.gateway.core.chain;

import java.math.BigDecimal;

/**
 * 构造并签名“取消交易”：同 nonce、给自己转 0、更高的 fee（replace-by-fee）。
 *
 * 私钥的存储与加解密不在核心范围内，由宿主提供实现。
 */
@FunctionalInterface
public interface CancelTransactionSigner {

    /**
     * @param address 发送方（同时也是接收方）
     * @param nonce   被卡住交易的 nonce
     * @param feeGwei 提升后的 fee
     * @param chainId 链 id（EIP-155）
     * @return 已签名的原始交易
     */
    String signSelfTransfer(String address, long nonce, BigDecimal feeGwei, long chainId);
}
