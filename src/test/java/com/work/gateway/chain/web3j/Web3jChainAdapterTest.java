package com.work.gateway.chain.web3j;

import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.chain.ChainTxStatus;
import com.work.gateway.core.chain.FeeQuote;
import com.work.gateway.core.exception.NotSubmittedException;
import com.work.gateway.core.exception.RemoteUnavailableException;
import com.work.gateway.core.metrics.GatewayMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthMaxPriorityFeePerGas;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.EthTransaction;
import org.web3j.protocol.core.methods.response.Transaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.io.IOException;
import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.*;

@SuppressWarnings({"rawtypes", "unchecked"})
public class Web3jChainAdapterTest {

    private static final ChainKey KEY = ChainKey.of("evm", "sepolia");
    private static final String HASH = "0x" + "ab".repeat(32);

    private Web3j web3j;
    private GatewayMetrics metrics;
    private Web3jChainAdapter adapter;

    @BeforeEach
    public void setUp() {
        web3j = mock(Web3j.class);
        metrics = mock(GatewayMetrics.class);
        adapter = new Web3jChainAdapter(KEY, 11155111L, web3j, false, metrics);
    }

    private static Request requestReturning(Response<?> response) throws IOException {
        Request request = mock(Request.class);
        when(request.send()).thenReturn(response);
        return request;
    }

    private static Request requestFailing(IOException error) throws IOException {
        Request request = mock(Request.class);
        when(request.send()).thenThrow(error);
        return request;
    }

    @Test
    public void reported_nonce_reads_pending_count() throws Exception {
        EthGetTransactionCount count = new EthGetTransactionCount();
        count.setResult("0x2a");
        doReturn(requestReturning(count)).when(web3j).ethGetTransactionCount("0xabc", DefaultBlockParameterName.PENDING);

        assertEquals(42, adapter.reportedNonce("0xabc"));
        verify(metrics).rpcRequest("eth_getTransactionCount");
    }

    @Test
    public void fee_estimate_converts_wei_to_gwei() throws Exception {
        EthGasPrice gasPrice = new EthGasPrice();
        gasPrice.setResult("0x4a817c800"); // 20 gwei
        doReturn(requestReturning(gasPrice)).when(web3j).ethGasPrice();

        FeeQuote quote = adapter.feeEstimate();

        assertEquals(0, new BigDecimal("20").compareTo(quote.getBaseFee()));
        assertNull(quote.getPriorityFee());
        verify(web3j, never()).ethMaxPriorityFeePerGas();
    }

    @Test
    public void fee_estimate_adds_priority_fee_when_enabled() throws Exception {
        Web3jChainAdapter eip1559 = new Web3jChainAdapter(KEY, 11155111L, web3j, true, metrics);
        EthGasPrice gasPrice = new EthGasPrice();
        gasPrice.setResult("0x4a817c800");
        EthMaxPriorityFeePerGas tip = new EthMaxPriorityFeePerGas();
        tip.setResult("0x77359400"); // 2 gwei
        doReturn(requestReturning(gasPrice)).when(web3j).ethGasPrice();
        doReturn(requestReturning(tip)).when(web3j).ethMaxPriorityFeePerGas();

        assertEquals(0, new BigDecimal("22").compareTo(eip1559.feeEstimate().total()));
    }

    @Test
    public void rejected_submission_is_not_submitted() throws Exception {
        EthSendTransaction rejected = new EthSendTransaction();
        rejected.setError(new Response.Error(-32000, "nonce too low"));
        doReturn(requestReturning(rejected)).when(web3j).ethSendRawTransaction("0xf86b");

        NotSubmittedException e = assertThrows(NotSubmittedException.class, () -> adapter.submitRaw("0xf86b"));
        assertTrue(e.getMessage().contains("nonce too low"));
    }

    @Test
    public void transport_failure_on_submit_is_ambiguous() throws Exception {
        doReturn(requestFailing(new IOException("read timed out"))).when(web3j).ethSendRawTransaction("0xf86b");

        assertThrows(RemoteUnavailableException.class, () -> adapter.submitRaw("0xf86b"));
    }

    @Test
    public void accepted_submission_returns_hash() throws Exception {
        EthSendTransaction accepted = new EthSendTransaction();
        accepted.setResult(HASH);
        doReturn(requestReturning(accepted)).when(web3j).ethSendRawTransaction("0xf86b");

        assertEquals(HASH, adapter.submitRaw("0xf86b"));
    }

    @Test
    public void receipt_status_decides_confirmed_or_failed() throws Exception {
        TransactionReceipt ok = new TransactionReceipt();
        ok.setBlockNumber("0x10");
        ok.setStatus("0x1");
        EthGetTransactionReceipt okResp = new EthGetTransactionReceipt();
        okResp.setResult(ok);
        doReturn(requestReturning(okResp)).when(web3j).ethGetTransactionReceipt(HASH);

        ChainTxStatus confirmed = adapter.txStatus(HASH);
        assertEquals(ChainTxStatus.Kind.CONFIRMED, confirmed.getKind());
        assertEquals(16, confirmed.getBlockNumber());

        TransactionReceipt reverted = new TransactionReceipt();
        reverted.setBlockNumber("0x11");
        reverted.setStatus("0x0");
        EthGetTransactionReceipt revertedResp = new EthGetTransactionReceipt();
        revertedResp.setResult(reverted);
        doReturn(requestReturning(revertedResp)).when(web3j).ethGetTransactionReceipt(HASH);

        assertEquals(ChainTxStatus.Kind.FAILED, adapter.txStatus(HASH).getKind());
        verify(web3j, never()).ethGetTransactionByHash(HASH);
    }

    @Test
    public void missing_receipt_falls_back_to_transaction_lookup() throws Exception {
        doReturn(requestReturning(new EthGetTransactionReceipt())).when(web3j).ethGetTransactionReceipt(HASH);
        EthTransaction inPool = new EthTransaction();
        inPool.setResult(new Transaction());
        doReturn(requestReturning(inPool)).when(web3j).ethGetTransactionByHash(HASH);

        assertEquals(ChainTxStatus.Kind.IN_MEMPOOL, adapter.txStatus(HASH).getKind());

        doReturn(requestReturning(new EthTransaction())).when(web3j).ethGetTransactionByHash(HASH);
        assertEquals(ChainTxStatus.Kind.NOT_FOUND, adapter.txStatus(HASH).getKind());
    }

    @Test
    public void rpc_error_on_read_is_remote_unavailable() throws Exception {
        EthGasPrice broken = new EthGasPrice();
        broken.setError(new Response.Error(-32603, "internal error"));
        doReturn(requestReturning(broken)).when(web3j).ethGasPrice();

        assertThrows(RemoteUnavailableException.class, () -> adapter.feeEstimate());
    }
}
