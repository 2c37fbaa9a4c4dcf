package com.work.gateway.core.watch;

/**
 * 常驻订阅的句柄，调用 cancel() 取消；连接断开重连后由 watcher 自动恢复。
 */
public final class StandingSubscription {

    private final ConfirmationWatcher watcher;
    private final Subscription subscription;

    StandingSubscription(ConfirmationWatcher watcher, Subscription subscription) {
        this.watcher = watcher;
        this.subscription = subscription;
    }

    public String getAccountKey() {
        return subscription.getTarget();
    }

    public void cancel() {
        watcher.cancelStanding(subscription);
    }
}
