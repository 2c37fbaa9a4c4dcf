package com.work.gateway.core.exception;

/**
 * 远端节点不可达 / 超时 / 返回 JSON-RPC 错误。
 *
 * 由调用方决定是否重试；除 GasPriceOracle 的旧值兜底路径外，不允许被静默吞掉。
 */
public class RemoteUnavailableException extends GatewayException {

    public RemoteUnavailableException(String message) {
        super(message);
    }

    public RemoteUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
