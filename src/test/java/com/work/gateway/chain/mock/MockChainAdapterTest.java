package com.work.gateway.chain.mock;

import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.chain.ChainTxStatus;
import com.work.gateway.core.exception.NotSubmittedException;
import com.work.gateway.core.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class MockChainAdapterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final MockChainAdapter chain =
            new MockChainAdapter(ChainKey.of("evm", "local"), 1337L, clock, Duration.ofSeconds(30));

    @Test
    public void transaction_moves_from_mempool_to_confirmed() {
        String hash = chain.submitRaw(MockChainAdapter.encodeRaw("0xAAA", 0, new BigDecimal("20")));

        assertEquals(ChainTxStatus.Kind.IN_MEMPOOL, chain.txStatus(hash).getKind());
        assertEquals(1, chain.reportedNonce("0xaaa"));

        clock.advance(Duration.ofSeconds(31));
        ChainTxStatus status = chain.txStatus(hash);
        assertEquals(ChainTxStatus.Kind.CONFIRMED, status.getKind());
        assertEquals(status.getBlockNumber(), chain.txStatus(hash).getBlockNumber());
    }

    @Test
    public void same_slot_replaces_previous_transaction() {
        String first = chain.submitRaw(MockChainAdapter.encodeRaw("0xaaa", 3, new BigDecimal("20")));
        String second = chain.submitRaw(MockChainAdapter.encodeRaw("0xaaa", 3, new BigDecimal("40")));

        assertEquals(ChainTxStatus.Kind.NOT_FOUND, chain.txStatus(first).getKind());
        assertEquals(ChainTxStatus.Kind.IN_MEMPOOL, chain.txStatus(second).getKind());
        assertEquals(4, chain.reportedNonce("0xaaa"));
    }

    @Test
    public void malformed_raw_is_rejected_before_submission() {
        assertThrows(NotSubmittedException.class, () -> chain.submitRaw("0xf86b"));
        assertThrows(NotSubmittedException.class, () -> chain.submitRaw("mock|0xaaa|x|1"));
    }

    @Test
    public void fee_quote_reflects_configured_fees() {
        chain.setBaseFee(new BigDecimal("15"));
        chain.setPriorityFee(new BigDecimal("2"));

        assertEquals(0, new BigDecimal("17").compareTo(chain.feeEstimate().total()));
    }
}
