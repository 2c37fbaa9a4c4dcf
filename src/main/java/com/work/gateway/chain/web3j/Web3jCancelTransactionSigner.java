package com.work.gateway.chain.web3j;

import com.work.gateway.core.chain.CancelTransactionSigner;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Convert;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.BigInteger;

import static com.work.gateway.core.support.ValidationUtils.requireNonNull;

/**
 * 用 Web3j 签名 legacy 取消交易：to = from，value = 0，gasLimit = 21000，gasPrice = 提升后的 fee。
 */
public class Web3jCancelTransactionSigner implements CancelTransactionSigner {

    static final BigInteger TRANSFER_GAS_LIMIT = BigInteger.valueOf(21_000L);

    private final CredentialsResolver credentialsResolver;

    public Web3jCancelTransactionSigner(CredentialsResolver credentialsResolver) {
        this.credentialsResolver = requireNonNull(credentialsResolver, "credentialsResolver");
    }

    @Override
    public String signSelfTransfer(String address, long nonce, BigDecimal feeGwei, long chainId) {
        Credentials credentials = credentialsResolver.resolve(address);
        if (credentials == null) {
            throw new IllegalArgumentException("no credentials for " + address);
        }
        if (!credentials.getAddress().equalsIgnoreCase(address)) {
            throw new IllegalArgumentException("credentials do not belong to " + address);
        }
        BigInteger gasPriceWei = Convert.toWei(feeGwei, Convert.Unit.GWEI).toBigInteger();
        RawTransaction raw = RawTransaction.createEtherTransaction(
                BigInteger.valueOf(nonce), gasPriceWei, TRANSFER_GAS_LIMIT, address, BigInteger.ZERO);
        byte[] signed = TransactionEncoder.signMessage(raw, chainId, credentials);
        return Numeric.toHexString(signed);
    }
}
