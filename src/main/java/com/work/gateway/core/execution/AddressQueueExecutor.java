package com.work.gateway.core.execution;

import com.work.gateway.core.exception.GatewayException;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static com.work.gateway.core.support.ValidationUtils.requireNonEmpty;
import static com.work.gateway.core.support.ValidationUtils.requireNonNull;

/**
 * 每个地址一条 FIFO 等待队列，队首任务在共享线程池上执行，执行完再调度下一个。
 * <p>
 * - 同一地址同一时刻只有一个任务在跑，严格按入队顺序
 * - 调用方无限期等待自己的任务完成，没有截止时间
 * - 调用线程被中断时，只撤回尚未开始的任务；已经开始的任务（可能已把交易发出去）继续等到结果
 * - 每个地址的排队长度有上限，超出时抛 {@link DispatchRejectedException}
 */
public class AddressQueueExecutor implements AddressSerialExecutor, AutoCloseable {

    public static final class DispatchRejectedException extends GatewayException {
        public DispatchRejectedException(String message) {
            super(message);
        }

        @Override
        public boolean isRetryable() {
            return true;
        }
    }

    private final ExecutorService pool;
    private final int maxQueuedPerAddress;
    private final Object lock = new Object();
    // guarded by lock
    private final Map<String, AddressQueue> queues = new HashMap<>();
    private boolean closed;

    public AddressQueueExecutor(int threads, int maxQueuedPerAddress, String threadNamePrefix) {
        if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
        if (maxQueuedPerAddress <= 0) throw new IllegalArgumentException("maxQueuedPerAddress must be > 0");
        this.maxQueuedPerAddress = maxQueuedPerAddress;
        String prefix = (threadNamePrefix == null || threadNamePrefix.trim().isEmpty())
                ? "nonce-section-"
                : threadNamePrefix.trim();
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r);
            t.setName(prefix + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        this.pool = Executors.newFixedThreadPool(threads, tf);
    }

    @Override
    public <T> T execute(String key, Callable<T> work) {
        requireNonEmpty(key, "key");
        requireNonNull(work, "work");
        Task<T> task = new Task<>(work);
        AddressQueue queue;
        boolean schedule = false;
        synchronized (lock) {
            if (closed) {
                throw new DispatchRejectedException("executor is closed, key=" + key);
            }
            queue = queues.computeIfAbsent(key, k -> new AddressQueue());
            if (queue.waiting.size() >= maxQueuedPerAddress) {
                throw new DispatchRejectedException("address queue is full key=" + key
                        + " waiting=" + queue.waiting.size());
            }
            queue.waiting.addLast(task);
            if (!queue.draining) {
                queue.draining = true;
                schedule = true;
            }
        }
        if (schedule) {
            dispatch(key, queue);
        }
        return await(key, queue, task);
    }

    /**
     * 当前排队（未开始）的任务数，只用于观测。
     */
    public int queuedCount(String key) {
        synchronized (lock) {
            AddressQueue queue = queues.get(key);
            return queue == null ? 0 : queue.waiting.size();
        }
    }

    private void dispatch(String key, AddressQueue queue) {
        try {
            pool.execute(() -> runNext(key, queue));
        } catch (RejectedExecutionException e) {
            // 线程池已关闭：已入队的任务由当前线程执行完，调用方不能被晾着
            runAll(key, queue);
        }
    }

    private void runNext(String key, AddressQueue queue) {
        Task<?> next = takeNext(key, queue);
        if (next == null) {
            return;
        }
        next.run();
        dispatch(key, queue);
    }

    private void runAll(String key, AddressQueue queue) {
        Task<?> next;
        while ((next = takeNext(key, queue)) != null) {
            next.run();
        }
    }

    private Task<?> takeNext(String key, AddressQueue queue) {
        synchronized (lock) {
            Task<?> next = queue.waiting.pollFirst();
            if (next == null) {
                queue.draining = false;
                queues.remove(key, queue);
                return null;
            }
            next.started = true;
            return next;
        }
    }

    private <T> T await(String key, AddressQueue queue, Task<T> task) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return task.result.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                    synchronized (lock) {
                        if (!task.started) {
                            queue.waiting.remove(task);
                            throw new GatewayException("dispatch interrupted before start, key=" + key, e);
                        }
                    }
                    // 已开始执行：结果必须交回调用方，继续等
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                    if (cause instanceof Error) throw (Error) cause;
                    String msg = (cause != null && cause.getMessage() != null) ? cause.getMessage() : "address task failed";
                    throw new GatewayException(msg, cause);
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            closed = true;
        }
        pool.shutdown();
    }

    private static final class AddressQueue {
        private final ArrayDeque<Task<?>> waiting = new ArrayDeque<>();
        private boolean draining;
    }

    private static final class Task<T> {
        private final Callable<T> work;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        private boolean started;

        private Task(Callable<T> work) {
            this.work = work;
        }

        private void run() {
            try {
                result.complete(work.call());
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        }
    }
}
