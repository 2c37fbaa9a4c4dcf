package com.work.gateway.core.exception;

/**
 * 网关核心的统一异常类型，便于调用方捕获或转换为接口错误码。
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可由调用方重试解决。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
