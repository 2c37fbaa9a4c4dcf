package com.work.gateway.core.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static com.work.gateway.core.support.ValidationUtils.requirePositive;

/**
 * 统计远端请求数，按固定周期打印一次后清零。
 */
public class RequestCountingGatewayMetrics implements GatewayMetrics, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestCountingGatewayMetrics.class);

    private final Duration logInterval;
    private final AtomicLong requests = new AtomicLong();
    private ScheduledExecutorService timer;

    public RequestCountingGatewayMetrics(Duration logInterval) {
        this.logInterval = requirePositive(logInterval, "logInterval");
    }

    public synchronized void start() {
        if (timer != null) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gateway-metrics");
            t.setDaemon(true);
            return t;
        });
        long ms = logInterval.toMillis();
        timer.scheduleWithFixedDelay(this::logAndReset, ms, ms, TimeUnit.MILLISECONDS);
    }

    @Override
    public void rpcRequest(String op) {
        requests.incrementAndGet();
    }

    long logAndReset() {
        long n = requests.getAndSet(0);
        log.info("{} request(s) sent in last {} seconds.", n, logInterval.getSeconds());
        return n;
    }

    @Override
    public synchronized void close() {
        if (timer != null) {
            timer.shutdownNow();
            timer = null;
        }
    }
}
