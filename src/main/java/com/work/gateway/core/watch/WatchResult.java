package com.work.gateway.core.watch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * watch() 的结果。超时不是错误：confirmed = false，调用方应回退到轮询。
 */
public final class WatchResult {

    public enum Outcome {
        CONFIRMED,
        /**
         * 节点通知交易已上链但执行失败。
         */
        FAILED,
        TIMEOUT
    }

    private final Outcome outcome;
    private final JsonNode data;

    private WatchResult(Outcome outcome, JsonNode data) {
        this.outcome = outcome;
        this.data = data;
    }

    public static WatchResult confirmed(JsonNode data) {
        return new WatchResult(Outcome.CONFIRMED, data);
    }

    public static WatchResult failed(JsonNode data) {
        return new WatchResult(Outcome.FAILED, data);
    }

    public static WatchResult timeout() {
        return new WatchResult(Outcome.TIMEOUT, null);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isConfirmed() {
        return outcome == Outcome.CONFIRMED;
    }

    /**
     * 通知原文中的 result 节点；超时时为 null。
     */
    public JsonNode getData() {
        return data;
    }
}
