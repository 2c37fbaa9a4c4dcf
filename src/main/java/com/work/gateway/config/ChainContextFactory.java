package com.work.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.gateway.chain.mock.MockCancelTransactionSigner;
import com.work.gateway.chain.mock.MockChainAdapter;
import com.work.gateway.chain.web3j.CredentialsResolver;
import com.work.gateway.chain.web3j.Web3jCancelTransactionSigner;
import com.work.gateway.chain.web3j.Web3jChainAdapter;
import com.work.gateway.core.chain.CancelTransactionSigner;
import com.work.gateway.core.chain.ChainAdapter;
import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.execution.AddressSerialExecutor;
import com.work.gateway.core.gas.FeeAdjustment;
import com.work.gateway.core.gas.GasPriceOracle;
import com.work.gateway.core.lifecycle.ChainContext;
import com.work.gateway.core.lifecycle.ChainRegistry;
import com.work.gateway.core.lifecycle.TransactionLifecycleCoordinator;
import com.work.gateway.core.metrics.GatewayMetrics;
import com.work.gateway.core.nonce.NonceManager;
import com.work.gateway.core.nonce.NonceRecordRepository;
import com.work.gateway.core.pending.PendingTransactionStore;
import com.work.gateway.core.watch.ConfirmationWatcher;
import com.work.gateway.core.watch.JdkWebSocketLiveChannel;
import com.work.gateway.core.watch.JsonRpcSubscriptionCodec;
import com.work.gateway.core.watch.ReconnectBackoff;
import com.work.gateway.core.watch.SubscriptionMethods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.net.URI;
import java.time.Clock;

import static com.work.gateway.core.support.ValidationUtils.requireNonEmpty;

/**
 * 按 gateway.chains[] 的一项组装一个 {@link ChainContext} 并登记到注册表。
 */
public class ChainContextFactory {

    private static final Logger log = LoggerFactory.getLogger(ChainContextFactory.class);

    private final GatewayProperties properties;
    private final NonceRecordRepository nonceRepository;
    private final PendingTransactionStore pendingStore;
    private final GasPriceOracle gasOracle;
    private final AddressSerialExecutor executor;
    private final Clock clock;
    private final GatewayMetrics metrics;
    private final ObjectMapper objectMapper;
    private final CredentialsResolver credentialsResolver;

    /**
     * @param credentialsResolver 为 null 时 web3j 链不支持取消交易
     */
    public ChainContextFactory(GatewayProperties properties,
                               NonceRecordRepository nonceRepository,
                               PendingTransactionStore pendingStore,
                               GasPriceOracle gasOracle,
                               AddressSerialExecutor executor,
                               Clock clock,
                               GatewayMetrics metrics,
                               ObjectMapper objectMapper,
                               CredentialsResolver credentialsResolver) {
        this.properties = properties;
        this.nonceRepository = nonceRepository;
        this.pendingStore = pendingStore;
        this.gasOracle = gasOracle;
        this.executor = executor;
        this.clock = clock;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.credentialsResolver = credentialsResolver;
    }

    public ChainContext register(GatewayProperties.Chain chain, ChainRegistry registry) {
        ChainKey key = ChainKey.of(chain.getChain(), chain.getNetwork());

        ChainAdapter adapter;
        CancelTransactionSigner cancelSigner;
        if ("web3j".equalsIgnoreCase(chain.getMode())) {
            Web3j web3j = Web3j.build(new HttpService(requireNonEmpty(chain.getRpcUrl(), "rpcUrl")));
            registry.addResource(web3j::shutdown);
            adapter = new Web3jChainAdapter(key, chain.getChainId(), web3j, chain.isPriorityFee(), metrics);
            cancelSigner = credentialsResolver == null ? null : new Web3jCancelTransactionSigner(credentialsResolver);
        } else if ("mock".equalsIgnoreCase(chain.getMode())) {
            adapter = new MockChainAdapter(key, chain.getChainId(), clock, chain.getMockReceiptDelay());
            cancelSigner = new MockCancelTransactionSigner();
        } else {
            throw new IllegalArgumentException("unknown chain mode '" + chain.getMode() + "' for " + key);
        }

        gasOracle.register(adapter, new FeeAdjustment(chain.getFeeFloor(), chain.getFeeMultiplier()),
                chain.getGasRefreshInterval());

        GatewayProperties.Nonce nonce = properties.getNonce();
        NonceManager nonceManager = new NonceManager(adapter, nonceRepository, executor,
                nonce.getSyncTtl(), nonce.getCacheSize(), clock, metrics);

        ConfirmationWatcher watcher = chain.isWatcherEnabled() ? createWatcher(key, chain) : null;

        GatewayProperties.Pending pending = properties.getPending();
        TransactionLifecycleCoordinator coordinator = new TransactionLifecycleCoordinator(adapter, nonceManager,
                pendingStore, gasOracle, watcher, cancelSigner, properties.getCancel().getFeeMultiplier(),
                pending.getNotFoundRetries(), pending.getNotFoundRetryDelay(), clock, metrics);

        ChainContext context = new ChainContext(adapter, nonceManager, watcher, coordinator);
        registry.register(context);
        log.info("chain registered {} mode={} chainId={} watcher={} cancel={}",
                key, chain.getMode(), chain.getChainId(), watcher != null, cancelSigner != null);
        return context;
    }

    private ConfirmationWatcher createWatcher(ChainKey key, GatewayProperties.Chain chain) {
        GatewayProperties.Watcher w = properties.getWatcher();
        GatewayProperties.Subscription s = chain.getSubscription();
        SubscriptionMethods methods = new SubscriptionMethods(s.getSignatureSubscribe(), s.getSignatureUnsubscribe(),
                s.getAccountSubscribe(), s.getAccountUnsubscribe(), s.getCommitment());
        JdkWebSocketLiveChannel channel = new JdkWebSocketLiveChannel(
                URI.create(requireNonEmpty(chain.getWsUrl(), "wsUrl")), w.getConnectTimeout());
        return new ConfirmationWatcher(key, channel, new JsonRpcSubscriptionCodec(objectMapper, methods),
                new ReconnectBackoff(w.getBaseDelay(), w.getMaxDelay()), w.getMaxAttempts(),
                w.getDefaultTimeout(), metrics);
    }
}
