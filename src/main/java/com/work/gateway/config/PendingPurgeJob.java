package com.work.gateway.config;

import com.work.gateway.core.pending.PendingTransactionStore;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 定期清理超过保留期的在途条目（节点一直查不到、也没人再来查询的交易）。
 */
@Component
public class PendingPurgeJob {

    private final PendingTransactionStore store;

    public PendingPurgeJob(PendingTransactionStore store) {
        this.store = store;
    }

    @Scheduled(fixedDelayString = "${gateway.pending.purge-interval-ms:600000}",
            initialDelayString = "${gateway.pending.purge-interval-ms:600000}")
    @Transactional(timeout = 300)
    public void runOnce() {
        store.purgeExpired();
    }
}
