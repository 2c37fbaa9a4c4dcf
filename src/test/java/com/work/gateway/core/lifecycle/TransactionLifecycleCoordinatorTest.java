package com.work.gateway.core.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.gateway.chain.mock.MockCancelTransactionSigner;
import com.work.gateway.chain.mock.MockChainAdapter;
import com.work.gateway.core.chain.CancelTransactionSigner;
import com.work.gateway.core.chain.ChainAdapter;
import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.exception.NotSubmittedException;
import com.work.gateway.core.exception.SubscriptionLostException;
import com.work.gateway.core.execution.AddressQueueExecutor;
import com.work.gateway.core.gas.GasPriceOracle;
import com.work.gateway.core.metrics.NoopGatewayMetrics;
import com.work.gateway.core.nonce.NonceManager;
import com.work.gateway.core.pending.PendingTransaction;
import com.work.gateway.core.pending.PendingTransactionStore;
import com.work.gateway.core.pending.PendingTxStatus;
import com.work.gateway.core.support.InMemoryNonceRecordRepository;
import com.work.gateway.core.support.InMemoryPendingTransactionRepository;
import com.work.gateway.core.support.MutableClock;
import com.work.gateway.core.watch.ConfirmationWatcher;
import com.work.gateway.core.watch.WatchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class TransactionLifecycleCoordinatorTest {

    private static final ChainKey KEY = ChainKey.of("evm", "local");
    private static final String ADDR = "0xAbC0000000000000000000000000000000000001";
    private static final String NORMALIZED = ADDR.toLowerCase();

    private MutableClock clock;
    private MockChainAdapter chain;
    private AddressQueueExecutor executor;
    private GasPriceOracle gasOracle;
    private PendingTransactionStore store;
    private TransactionLifecycleCoordinator coordinator;

    private final SignedTransactionBuilder builder =
            (nonce, fee) -> new SignedTransaction(MockChainAdapter.encodeRaw(ADDR, nonce, fee), fee);

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        chain = new MockChainAdapter(KEY, 1337L, clock, Duration.ofMinutes(10));
        chain.setReportedNonce(ADDR, 5);
        executor = new AddressQueueExecutor(4, 1000, "coordinator-test-");
        gasOracle = new GasPriceOracle(Duration.ofSeconds(10), clock, new NoopGatewayMetrics());
        store = new PendingTransactionStore(new InMemoryPendingTransactionRepository(),
                Duration.ofMinutes(3), Duration.ofHours(24), clock);
        coordinator = coordinatorFor(chain, null, new MockCancelTransactionSigner());
    }

    @AfterEach
    public void tearDown() {
        executor.close();
        gasOracle.close();
    }

    private TransactionLifecycleCoordinator coordinatorFor(ChainAdapter adapter, ConfirmationWatcher watcher,
                                                           CancelTransactionSigner signer) {
        gasOracle.register(adapter, null, null);
        NonceManager nonceManager = new NonceManager(adapter, new InMemoryNonceRecordRepository(), executor,
                Duration.ofMinutes(5), 100, clock, new NoopGatewayMetrics());
        return new TransactionLifecycleCoordinator(adapter, nonceManager, store, gasOracle, watcher, signer,
                new BigDecimal("2"), 2, Duration.ofMillis(1), clock, new NoopGatewayMetrics());
    }

    @Test
    public void submitted_transaction_is_classified_then_evicted_on_receipt() {
        String txHash = coordinator.submitWithNonce(ADDR, builder);

        PendingTransaction entry = store.findActiveByNonce(KEY, NORMALIZED, 5).orElseThrow();
        assertEquals(txHash, entry.getTxHash());
        assertEquals(0, new BigDecimal("20").compareTo(entry.getFeeAtSubmission()));

        clock.advance(Duration.ofMinutes(2));
        chain.setBaseFee(new BigDecimal("25"));
        TxStatusReport early = coordinator.getStatus(txHash);
        assertEquals(PendingTxStatus.MEMPOOL_LIKELY_SUCCEED, early.getStatus());
        assertTrue(early.getPending().isPresent());

        clock.advance(Duration.ofMinutes(2));
        chain.setBaseFee(new BigDecimal("30"));
        assertEquals(PendingTxStatus.MEMPOOL_LIKELY_FAIL, coordinator.getStatus(txHash).getStatus());

        clock.advance(Duration.ofMinutes(7));
        TxStatusReport done = coordinator.getStatus(txHash);
        assertEquals(PendingTxStatus.CONFIRMED, done.getStatus());
        assertTrue(done.getBlockNumber().isPresent());
        assertFalse(store.get(KEY, txHash).isPresent());
    }

    @Test
    public void consecutive_submissions_use_consecutive_nonces() {
        coordinator.submitWithNonce(ADDR, builder);
        coordinator.submitWithNonce(ADDR, builder);

        assertEquals(6, coordinator.currentNonce(ADDR));
        assertEquals(7, coordinator.peekNextNonce(ADDR));
        assertEquals(2, store.listActive(KEY).size());
    }

    @Test
    public void builder_failure_does_not_consume_the_nonce() {
        SignedTransactionBuilder broken = (nonce, fee) -> {
            throw new IOException("signer offline");
        };

        NotSubmittedException e = assertThrows(NotSubmittedException.class,
                () -> coordinator.submitWithNonce(ADDR, broken));
        assertTrue(e.getMessage().contains("signer offline"));

        assertEquals(5, coordinator.peekNextNonce(ADDR));
        assertTrue(store.listActive(KEY).isEmpty());
        coordinator.submitWithNonce(ADDR, builder);
        assertEquals(5, coordinator.currentNonce(ADDR));
    }

    @Test
    public void cancel_replaces_the_stuck_entry_with_higher_fee() {
        String stuckHash = coordinator.submitWithNonce(ADDR, builder);

        CancelResult result = coordinator.cancelPending(ADDR, 5);

        assertEquals(CancelResult.Outcome.CANCEL_SUBMITTED, result.getOutcome());
        assertEquals(5, result.getNonce());
        assertEquals(0, new BigDecimal("40").compareTo(result.getFee()));
        assertNotEquals(stuckHash, result.getTxHash());

        PendingTransaction active = store.findActiveByNonce(KEY, NORMALIZED, 5).orElseThrow();
        assertEquals(result.getTxHash(), active.getTxHash());
        assertFalse(store.get(KEY, stuckHash).isPresent());

        // 原交易已被顶掉，节点查不到：只能报 PENDING
        TxStatusReport replaced = coordinator.getStatus(stuckHash);
        assertEquals(PendingTxStatus.PENDING, replaced.getStatus());
        assertFalse(replaced.getPending().isPresent());
    }

    @Test
    public void cancel_fee_must_exceed_stuck_fee() {
        coordinator.submitWithNonce(ADDR, builder);

        assertThrows(IllegalArgumentException.class,
                () -> coordinator.cancelPending(ADDR, 5, new BigDecimal("20")));
        assertEquals(1, store.listActive(KEY).size());
    }

    @Test
    public void cancel_losing_the_race_reports_already_confirmed() {
        MockChainAdapter spyChain = spy(chain);
        TransactionLifecycleCoordinator racing = coordinatorFor(spyChain, null, new MockCancelTransactionSigner());
        String stuckHash = racing.submitWithNonce(ADDR, builder);

        clock.advance(Duration.ofMinutes(11));
        doThrow(new NotSubmittedException("nonce too low")).when(spyChain).submitRaw(anyString());

        CancelResult result = racing.cancelPending(ADDR, 5);

        assertEquals(CancelResult.Outcome.ALREADY_CONFIRMED, result.getOutcome());
        assertEquals(stuckHash, result.getTxHash());
        assertFalse(store.get(KEY, stuckHash).isPresent());
    }

    @Test
    public void cancel_failure_is_rethrown_while_original_still_pending() {
        MockChainAdapter spyChain = spy(chain);
        TransactionLifecycleCoordinator racing = coordinatorFor(spyChain, null, new MockCancelTransactionSigner());
        String stuckHash = racing.submitWithNonce(ADDR, builder);
        doThrow(new NotSubmittedException("replacement underpriced")).when(spyChain).submitRaw(anyString());

        assertThrows(NotSubmittedException.class, () -> racing.cancelPending(ADDR, 5));
        assertTrue(store.get(KEY, stuckHash).isPresent());
    }

    @Test
    public void cancel_requires_a_signer() {
        TransactionLifecycleCoordinator noCancel = coordinatorFor(chain, null, null);

        assertThrows(IllegalStateException.class, () -> noCancel.cancelPending(ADDR, 5, BigDecimal.TEN));
    }

    @Test
    public void watch_without_live_watcher_fails_fast() {
        CompletableFuture<WatchResult> f = coordinator.watchConfirmation("0xdead");

        ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(1, TimeUnit.SECONDS));
        assertInstanceOf(SubscriptionLostException.class, e.getCause());
    }

    @Test
    public void live_confirmation_evicts_entry_but_timeout_keeps_it() throws Exception {
        ConfirmationWatcher watcher = mock(ConfirmationWatcher.class);
        TransactionLifecycleCoordinator live = coordinatorFor(chain, watcher, null);
        String first = live.submitWithNonce(ADDR, builder);
        String second = live.submitWithNonce(ADDR, builder);
        when(watcher.watch(eq(first), any())).thenReturn(
                CompletableFuture.completedFuture(WatchResult.confirmed(new ObjectMapper().createObjectNode())));
        when(watcher.watch(eq(second), any())).thenReturn(
                CompletableFuture.completedFuture(WatchResult.timeout()));

        assertTrue(live.watchConfirmation(first, Duration.ofSeconds(5)).get(1, TimeUnit.SECONDS).isConfirmed());
        assertEquals(WatchResult.Outcome.TIMEOUT,
                live.watchConfirmation(second, Duration.ofSeconds(5)).get(1, TimeUnit.SECONDS).getOutcome());

        assertFalse(store.get(KEY, first).isPresent());
        assertTrue(store.get(KEY, second).isPresent());
        verify(watcher).watch(first, Duration.ofSeconds(5));
    }
}
