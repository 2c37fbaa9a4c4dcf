package com.work.gateway.core.metrics;

/**
 * 默认 no-op 实现：单元测试及不需要任何指标输出的场景使用。
 */
public class NoopGatewayMetrics implements GatewayMetrics {
}
