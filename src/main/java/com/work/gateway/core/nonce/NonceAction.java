package com.work.gateway.core.nonce;

/**
 * 在拿到 nonce 之后执行的业务动作（通常是：构造签名交易并提交）。
 *
 * 抛 NotSubmittedException 表示“确定没有提交出去”，候选 nonce 不会被提交；
 * 其他任何异常都按“可能已提交”处理，nonce 会被提交以避免复用。
 */
@FunctionalInterface
public interface NonceAction<T> {

    T apply(long nonce) throws Exception;
}
