package com.work.gateway.core.exception;

/**
 * 实时订阅未能给出结果（连接断开、watcher 未连接、节点拒绝订阅）。
 * 结果是“未知”而不是“失败”，调用方应回退到轮询。
 */
public class SubscriptionLostException extends GatewayException {

    public SubscriptionLostException(String message) {
        super(message);
    }

    public SubscriptionLostException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
