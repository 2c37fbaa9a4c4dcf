package com.work.gateway.chain.mock;

import com.work.gateway.core.chain.CancelTransactionSigner;

import java.math.BigDecimal;

public class MockCancelTransactionSigner implements CancelTransactionSigner {

    @Override
    public String signSelfTransfer(String address, long nonce, BigDecimal feeGwei, long chainId) {
        return MockChainAdapter.encodeRaw(address, nonce, feeGwei);
    }
}
