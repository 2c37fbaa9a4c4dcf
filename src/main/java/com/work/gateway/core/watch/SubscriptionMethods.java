package com.work.gateway.core.watch;

import static com.work.gateway.core.support.ValidationUtils.requireNonEmpty;

/**
 * 节点订阅协议的方法名，不同链的命名不一样，按链配置。
 */
public final class SubscriptionMethods {

    private final String signatureSubscribe;
    private final String signatureUnsubscribe;
    private final String accountSubscribe;
    private final String accountUnsubscribe;
    private final String commitment;

    public SubscriptionMethods(String signatureSubscribe, String signatureUnsubscribe,
                               String accountSubscribe, String accountUnsubscribe, String commitment) {
        this.signatureSubscribe = requireNonEmpty(signatureSubscribe, "signatureSubscribe");
        this.signatureUnsubscribe = requireNonEmpty(signatureUnsubscribe, "signatureUnsubscribe");
        this.accountSubscribe = requireNonEmpty(accountSubscribe, "accountSubscribe");
        this.accountUnsubscribe = requireNonEmpty(accountUnsubscribe, "accountUnsubscribe");
        this.commitment = commitment;
    }

    public static SubscriptionMethods defaults() {
        return new SubscriptionMethods("signatureSubscribe", "signatureUnsubscribe",
                "accountSubscribe", "accountUnsubscribe", "confirmed");
    }

    public String subscribeMethod(SubscriptionKind kind) {
        return kind == SubscriptionKind.SIGNATURE ? signatureSubscribe : accountSubscribe;
    }

    public String unsubscribeMethod(SubscriptionKind kind) {
        return kind == SubscriptionKind.SIGNATURE ? signatureUnsubscribe : accountUnsubscribe;
    }

    /**
     * 为 null 时订阅请求不带 commitment 参数。
     */
    public String getCommitment() {
        return commitment;
    }
}
