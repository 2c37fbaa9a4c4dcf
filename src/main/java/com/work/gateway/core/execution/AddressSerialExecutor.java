package com.work.gateway.core.execution;

import java.util.concurrent.Callable;

/**
 * 统一的“按地址串行执行”入口，即 nonce 分配的临界区。
 *
 * 约束：
 * - 同一 key 的工作严格按提交顺序（FIFO）串行执行，互斥
 * - 不同 key 之间不保证顺序
 * - 竞争通过排队解决，而不是拒绝（队列满除外）
 *
 * 注意：work 内部不能再向同一个 executor 提交同 key 的工作，否则会自锁。
 */
public interface AddressSerialExecutor {

    <T> T execute(String key, Callable<T> work);
}
