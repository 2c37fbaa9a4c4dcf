package com.work.gateway.core.exception;

/**
 * nonce 冲突：临界区本应在结构上杜绝该情况，出现即意味着对账逻辑有 bug。
 * 对当前请求是致命的，不可重试。
 */
public class NonceConflictException extends GatewayException {

    public NonceConflictException(String message) {
        super(message);
    }
}
