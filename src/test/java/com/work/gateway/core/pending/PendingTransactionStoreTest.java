package com.work.gateway.core.pending;

import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.exception.NonceConflictException;
import com.work.gateway.core.support.InMemoryPendingTransactionRepository;
import com.work.gateway.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PendingTransactionStoreTest {

    private static final ChainKey KEY = ChainKey.of("evm", "local");

    private InMemoryPendingTransactionRepository repository;
    private MutableClock clock;
    private PendingTransactionStore store;

    @BeforeEach
    public void setUp() {
        repository = new InMemoryPendingTransactionRepository();
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        store = new PendingTransactionStore(repository, Duration.ofMinutes(3), Duration.ofHours(24), clock);
    }

    private PendingTransaction tx(String hash, long nonce, String fee) {
        return PendingTransaction.submitted(hash, KEY, 1337L, "0xabc", nonce, new BigDecimal(fee), clock.instant());
    }

    @Test
    public void long_wait_and_higher_market_fee_is_likely_fail() {
        PendingTransaction t = tx("0x1", 1, "5");
        store.record(t);
        clock.advance(Duration.ofMinutes(4));

        assertEquals(PendingTxStatus.MEMPOOL_LIKELY_FAIL, store.classify(t, new BigDecimal("10")));
        assertEquals(PendingTxStatus.MEMPOOL_LIKELY_FAIL, store.get(KEY, "0x1").get().getStatus());
    }

    @Test
    public void hex_hash_lookup_ignores_case() {
        store.record(tx("0xABcdEF01", 1, "5"));

        assertTrue(store.get(KEY, "0xabcdef01").isPresent());
        assertTrue(store.get(KEY, "0XABCDEF01").isPresent());
        assertEquals("0xabcdef01", store.get(KEY, "0xAbCdEf01").get().getTxHash());
        assertTrue(store.evict(KEY, "0xABCDEF01"));
        assertFalse(store.get(KEY, "0xabcdef01").isPresent());
    }

    @Test
    public void base58_signature_keeps_its_case() {
        store.record(tx("5VERv8NMvzbJMEkV8xnrLkEaWRtSz9CosKDYjCJjBRnb", 1, "5"));

        assertTrue(store.get(KEY, "5VERv8NMvzbJMEkV8xnrLkEaWRtSz9CosKDYjCJjBRnb").isPresent());
        assertFalse(store.get(KEY, "5verv8nmvzbjmekv8xnrlkeawrtsz9coskdyjcjjbrnb").isPresent());
    }

    @Test
    public void short_wait_is_likely_succeed_regardless_of_fee() {
        PendingTransaction t = tx("0x1", 1, "5");
        store.record(t);
        clock.advance(Duration.ofMinutes(1));

        assertEquals(PendingTxStatus.MEMPOOL_LIKELY_SUCCEED, store.classify(t, new BigDecimal("500")));
    }

    @Test
    public void equal_fee_after_long_wait_is_still_likely_succeed() {
        PendingTransaction t = tx("0x1", 1, "5");
        store.record(t);
        clock.advance(Duration.ofMinutes(4));

        assertEquals(PendingTxStatus.MEMPOOL_LIKELY_SUCCEED, store.classify(t, new BigDecimal("5.000")));
    }

    @Test
    public void elapsed_exactly_at_limit_is_not_over_the_limit() {
        PendingTransaction t = tx("0x1", 1, "5");
        store.record(t);
        clock.advance(Duration.ofMinutes(3));

        assertEquals(PendingTxStatus.MEMPOOL_LIKELY_SUCCEED, store.classify(t, new BigDecimal("10")));
    }

    @Test
    public void unknown_current_fee_is_pending_not_a_guess() {
        PendingTransaction t = tx("0x1", 1, "5");
        store.record(t);
        clock.advance(Duration.ofMinutes(10));

        assertEquals(PendingTxStatus.PENDING, store.classify(t, null));
    }

    @Test
    public void second_active_entry_at_same_nonce_is_rejected() {
        store.record(tx("0x1", 9, "5"));

        assertThrows(NonceConflictException.class, () -> store.record(tx("0x2", 9, "6")));
        // 同一哈希重复记录只告警
        store.record(tx("0x1", 9, "5"));
        assertEquals(1, store.listActive(KEY).size());
    }

    @Test
    public void replace_evicts_stuck_entry_and_records_replacement() {
        PendingTransaction stuck = tx("0xstuck", 4, "5");
        store.record(stuck);

        store.replace(stuck, tx("0xcancel", 4, "10"));

        assertFalse(store.get(KEY, "0xstuck").isPresent());
        assertEquals("0xcancel", store.findActiveByNonce(KEY, "0xabc", 4).get().getTxHash());
    }

    @Test
    public void replace_rejects_a_different_nonce() {
        PendingTransaction stuck = tx("0xstuck", 4, "5");
        store.record(stuck);

        assertThrows(IllegalArgumentException.class, () -> store.replace(stuck, tx("0xother", 5, "10")));
    }

    @Test
    public void complete_evicts_and_returns_terminal_copy() {
        PendingTransaction t = tx("0x1", 1, "5");
        store.record(t);

        PendingTransaction done = store.complete(t, PendingTxStatus.CONFIRMED);

        assertEquals(PendingTxStatus.CONFIRMED, done.getStatus());
        assertFalse(store.get(KEY, "0x1").isPresent());
        assertThrows(IllegalArgumentException.class, () -> store.complete(t, PendingTxStatus.MEMPOOL_UNKNOWN));
    }

    @Test
    public void purge_removes_only_entries_past_retention() {
        store.record(tx("0xold", 1, "5"));
        clock.advance(Duration.ofHours(23));
        store.record(tx("0xnew", 2, "5"));
        clock.advance(Duration.ofHours(2));

        assertEquals(1, store.purgeExpired());
        assertFalse(store.get(KEY, "0xold").isPresent());
        assertTrue(store.get(KEY, "0xnew").isPresent());
    }
}
