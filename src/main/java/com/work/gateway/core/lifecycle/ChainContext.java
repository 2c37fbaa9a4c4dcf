package com.work.gateway.core.lifecycle;

import com.work.gateway.core.chain.ChainAdapter;
import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.nonce.NonceManager;
import com.work.gateway.core.watch.ConfirmationWatcher;

import java.util.Optional;

import static com.work.gateway.core.support.ValidationUtils.requireNonNull;

/**
 * 一个 (chain, network) 的全部组件。由 {@link ChainRegistry} 持有，不存在全局静态实例表。
 */
public final class ChainContext implements AutoCloseable {

    private final ChainAdapter adapter;
    private final NonceManager nonceManager;
    private final ConfirmationWatcher watcher;
    private final TransactionLifecycleCoordinator coordinator;

    public ChainContext(ChainAdapter adapter, NonceManager nonceManager,
                        ConfirmationWatcher watcher, TransactionLifecycleCoordinator coordinator) {
        this.adapter = requireNonNull(adapter, "adapter");
        this.nonceManager = requireNonNull(nonceManager, "nonceManager");
        this.watcher = watcher;
        this.coordinator = requireNonNull(coordinator, "coordinator");
    }

    public ChainKey getKey() {
        return adapter.getChainKey();
    }

    public ChainAdapter getAdapter() {
        return adapter;
    }

    public NonceManager getNonceManager() {
        return nonceManager;
    }

    public Optional<ConfirmationWatcher> getWatcher() {
        return Optional.ofNullable(watcher);
    }

    public TransactionLifecycleCoordinator getCoordinator() {
        return coordinator;
    }

    @Override
    public void close() {
        if (watcher != null) {
            watcher.close();
        }
    }
}
