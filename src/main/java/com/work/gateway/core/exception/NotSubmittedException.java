package com.work.gateway.core.exception;

/**
 * 在任何对外可观测的提交发生之前就失败了（构造/签名失败、节点明确拒绝）。
 *
 * NonceManager 看到该异常时不会提交候选 nonce，避免浪费号段。
 * 其他任何异常都按“可能已提交”处理。
 */
public class NotSubmittedException extends GatewayException {

    public NotSubmittedException(String message) {
        super(message);
    }

    public NotSubmittedException(String message, Throwable cause) {
        super(message, cause);
    }
}
