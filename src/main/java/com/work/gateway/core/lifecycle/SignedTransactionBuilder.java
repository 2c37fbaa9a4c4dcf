package com.work.gateway.core.lifecycle;

import java.math.BigDecimal;

/**
 * 拿到 nonce 与建议 fee 后构造并签名交易。
 * 这里抛出的任何异常都视为“未提交”，nonce 不会被消耗。
 */
@FunctionalInterface
public interface SignedTransactionBuilder {

    SignedTransaction build(long nonce, BigDecimal suggestedFee) throws Exception;
}
