package com.work.gateway.chain.web3j;

import com.work.gateway.core.chain.ChainAdapter;
import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.chain.ChainTxStatus;
import com.work.gateway.core.chain.FeeQuote;
import com.work.gateway.core.exception.NotSubmittedException;
import com.work.gateway.core.exception.RemoteUnavailableException;
import com.work.gateway.core.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthMaxPriorityFeePerGas;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.EthTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Convert;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

import static com.work.gateway.core.support.ValidationUtils.requireNonEmpty;
import static com.work.gateway.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 Web3j 的 EVM 链适配器：
 * - 地址 nonce eth_getTransactionCount(pending)
 * - 报价 eth_gasPrice，支持 priority fee 的链再加上 eth_maxPriorityFeePerGas
 * - 提交 eth_sendRawTransaction
 * - 状态 eth_getTransactionReceipt，查不到回执再看 eth_getTransactionByHash
 * <p>
 * fee 单位统一为 gwei。
 */
public class Web3jChainAdapter implements ChainAdapter {

    private static final Logger log = LoggerFactory.getLogger(Web3jChainAdapter.class);

    private final ChainKey chainKey;
    private final long chainId;
    private final Web3j web3j;
    private final boolean priorityFee;
    private final GatewayMetrics metrics;

    public Web3jChainAdapter(ChainKey chainKey, long chainId, Web3j web3j, boolean priorityFee, GatewayMetrics metrics) {
        this.chainKey = requireNonNull(chainKey, "chainKey");
        this.chainId = chainId;
        this.web3j = requireNonNull(web3j, "web3j");
        this.priorityFee = priorityFee;
        this.metrics = requireNonNull(metrics, "metrics");
    }

    @Override
    public ChainKey getChainKey() {
        return chainKey;
    }

    @Override
    public long getChainId() {
        return chainId;
    }

    @Override
    public long reportedNonce(String address) {
        requireNonEmpty(address, "address");
        EthGetTransactionCount resp = call("eth_getTransactionCount",
                () -> web3j.ethGetTransactionCount(address, DefaultBlockParameterName.PENDING).send());
        return resp.getTransactionCount().longValue();
    }

    @Override
    public String submitRaw(String signedTx) {
        requireNonEmpty(signedTx, "signedTx");
        metrics.rpcRequest("eth_sendRawTransaction");
        EthSendTransaction resp;
        try {
            resp = web3j.ethSendRawTransaction(signedTx).send();
        } catch (IOException e) {
            // 请求可能已经到达节点，结果不确定
            log.warn("Web3j sendRawTransaction failed. chain={} err={}", chainKey, e.getMessage());
            throw new RemoteUnavailableException("eth_sendRawTransaction failed on " + chainKey + ": " + e.getMessage(), e);
        }
        if (resp.hasError()) {
            // 节点明确拒绝（nonce too low、余额不足、underpriced ...）
            throw new NotSubmittedException("rejected by " + chainKey + ": " + resp.getError().getMessage());
        }
        return resp.getTransactionHash();
    }

    @Override
    public FeeQuote feeEstimate() {
        EthGasPrice gasPrice = call("eth_gasPrice", () -> web3j.ethGasPrice().send());
        BigDecimal base = toGwei(gasPrice.getGasPrice());
        if (!priorityFee) {
            return FeeQuote.baseOnly(base);
        }
        EthMaxPriorityFeePerGas tip = call("eth_maxPriorityFeePerGas", () -> web3j.ethMaxPriorityFeePerGas().send());
        return new FeeQuote(base, toGwei(tip.getMaxPriorityFeePerGas()));
    }

    @Override
    public ChainTxStatus txStatus(String txHash) {
        requireNonEmpty(txHash, "txHash");
        EthGetTransactionReceipt receiptResp = call("eth_getTransactionReceipt",
                () -> web3j.ethGetTransactionReceipt(txHash).send());
        Optional<TransactionReceipt> receipt = receiptResp.getTransactionReceipt();
        if (receipt.isPresent()) {
            TransactionReceipt r = receipt.get();
            long bn = r.getBlockNumber().longValue();
            return isReceiptSuccess(r) ? ChainTxStatus.confirmed(bn) : ChainTxStatus.failed(bn);
        }
        EthTransaction txResp = call("eth_getTransactionByHash", () -> web3j.ethGetTransactionByHash(txHash).send());
        return txResp.getTransaction().isPresent() ? ChainTxStatus.inMempool() : ChainTxStatus.notFound();
    }

    private <R extends Response<?>> R call(String op, RpcCall<R> rpc) {
        metrics.rpcRequest(op);
        R resp;
        try {
            resp = rpc.send();
        } catch (IOException e) {
            log.warn("Web3j {} failed. chain={} err={}", op, chainKey, e.getMessage());
            throw new RemoteUnavailableException(op + " failed on " + chainKey + ": " + e.getMessage(), e);
        }
        if (resp.hasError()) {
            throw new RemoteUnavailableException(op + " error on " + chainKey + ": " + resp.getError().getMessage());
        }
        return resp;
    }

    private static BigDecimal toGwei(BigInteger wei) {
        return Convert.fromWei(new BigDecimal(wei), Convert.Unit.GWEI);
    }

    private static boolean isReceiptSuccess(TransactionReceipt receipt) {
        // EVM receipt status: 0x1 success, 0x0 failure；没有 status 字段的老链按成功处理
        String status = receipt.getStatus();
        return status == null || !"0x0".equalsIgnoreCase(status);
    }

    @FunctionalInterface
    private interface RpcCall<R> {
        R send() throws IOException;
    }
}
