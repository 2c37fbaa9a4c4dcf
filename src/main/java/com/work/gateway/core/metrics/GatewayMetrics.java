package com.work.gateway.core.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口，平台可通过自定义 Bean 接入具体实现。
 */
public interface GatewayMetrics {

    /**
     * 每次对远端节点发出请求调用一次，op 为操作名。
     */
    default void rpcRequest(String op) {
    }

    default void nonceAllocated(String result) {
    }

    default void gasRefresh(String result) {
    }

    default void statusPoll(String status) {
    }

    default void watcherEvent(String event) {
    }
}
