package com.work.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 从 application.yml 读取 gateway.* 配置，再由 {@link GatewayConfiguration} 转换为 core 组件的构造参数。
 */
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * jdbc：MyBatis-Plus 持久化（默认）；memory：纯内存，不具备跨重启持久性
     */
    private String storeMode = "jdbc";

    private final Nonce nonce = new Nonce();
    private final Pending pending = new Pending();
    private final Gas gas = new Gas();
    private final Watcher watcher = new Watcher();
    private final Cancel cancel = new Cancel();
    private final Metrics metrics = new Metrics();
    private List<Chain> chains = new ArrayList<>();

    public String getStoreMode() {
        return storeMode;
    }

    public void setStoreMode(String storeMode) {
        this.storeMode = storeMode;
    }

    public Nonce getNonce() {
        return nonce;
    }

    public Pending getPending() {
        return pending;
    }

    public Gas getGas() {
        return gas;
    }

    public Watcher getWatcher() {
        return watcher;
    }

    public Cancel getCancel() {
        return cancel;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public List<Chain> getChains() {
        return chains;
    }

    public void setChains(List<Chain> chains) {
        this.chains = chains;
    }

    public static class Nonce {

        /**
         * 本地记录超过该时长未与节点对账，则下次使用前重新对账
         */
        private Duration syncTtl = Duration.ofMinutes(5);

        /**
         * 执行临界区的线程数，不同地址之间并行
         */
        private int workerCount = 16;

        /**
         * 单个地址允许排队的最大任务数
         */
        private int queueCapacity = 10_000;

        private int cacheSize = 10_000;

        public Duration getSyncTtl() {
            return syncTtl;
        }

        public void setSyncTtl(Duration syncTtl) {
            this.syncTtl = syncTtl;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getCacheSize() {
            return cacheSize;
        }

        public void setCacheSize(int cacheSize) {
            this.cacheSize = cacheSize;
        }
    }

    public static class Pending {

        /**
         * 启发式分类的等待时长阈值
         */
        private Duration durationLimit = Duration.ofMinutes(3);

        /**
         * 在途条目最长保留时间，超过后由定时任务清理
         */
        private Duration retention = Duration.ofHours(24);

        /**
         * 清理任务间隔（毫秒），由 @Scheduled 直接读取
         */
        private long purgeIntervalMs = 600_000L;

        /**
         * 节点查不到交易时的重试次数与间隔（刚提交的交易可能尚未传播）
         */
        private int notFoundRetries = 3;

        private Duration notFoundRetryDelay = Duration.ofSeconds(1);

        public Duration getDurationLimit() {
            return durationLimit;
        }

        public void setDurationLimit(Duration durationLimit) {
            this.durationLimit = durationLimit;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public long getPurgeIntervalMs() {
            return purgeIntervalMs;
        }

        public void setPurgeIntervalMs(long purgeIntervalMs) {
            this.purgeIntervalMs = purgeIntervalMs;
        }

        public int getNotFoundRetries() {
            return notFoundRetries;
        }

        public void setNotFoundRetries(int notFoundRetries) {
            this.notFoundRetries = notFoundRetries;
        }

        public Duration getNotFoundRetryDelay() {
            return notFoundRetryDelay;
        }

        public void setNotFoundRetryDelay(Duration notFoundRetryDelay) {
            this.notFoundRetryDelay = notFoundRetryDelay;
        }
    }

    public static class Gas {

        private Duration cacheTtl = Duration.ofSeconds(10);

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }
    }

    public static class Watcher {

        private int maxAttempts = 5;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(10);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public Duration getDefaultTimeout() {
            return defaultTimeout;
        }

        public void setDefaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }
    }

    public static class Cancel {

        /**
         * 取消交易默认出价 = max(当前报价, 卡单出价) * feeMultiplier
         */
        private BigDecimal feeMultiplier = new BigDecimal("2");

        public BigDecimal getFeeMultiplier() {
            return feeMultiplier;
        }

        public void setFeeMultiplier(BigDecimal feeMultiplier) {
            this.feeMultiplier = feeMultiplier;
        }
    }

    public static class Metrics {

        private Duration requestLogInterval = Duration.ofMinutes(5);

        public Duration getRequestLogInterval() {
            return requestLogInterval;
        }

        public void setRequestLogInterval(Duration requestLogInterval) {
            this.requestLogInterval = requestLogInterval;
        }
    }

    /**
     * 单个 (chain, network) 的连接配置。
     *
     * mode=mock: 使用 MockChainAdapter
     * mode=web3j: 使用 Web3jChainAdapter
     */
    public static class Chain {

        private String chain;
        private String network;
        private long chainId;
        private String mode = "mock";

        /**
         * HTTP JSON-RPC 地址，例如 http://localhost:8545
         */
        private String rpcUrl;

        /**
         * 实时推送地址，例如 ws://localhost:8900；watcherEnabled=false 时忽略
         */
        private String wsUrl;
        private boolean watcherEnabled;

        /**
         * 是否在 base fee 之上叠加 priority fee
         */
        private boolean priorityFee;

        /**
         * gas 后台刷新间隔，为空表示不启用
         */
        private Duration gasRefreshInterval;

        /**
         * 链特定修正：adjusted = max(raw * feeMultiplier, feeFloor)
         */
        private BigDecimal feeFloor;
        private BigDecimal feeMultiplier;

        /**
         * mock 链出回执的延迟
         */
        private Duration mockReceiptDelay = Duration.ofSeconds(2);

        private final Subscription subscription = new Subscription();

        public String getChain() {
            return chain;
        }

        public void setChain(String chain) {
            this.chain = chain;
        }

        public String getNetwork() {
            return network;
        }

        public void setNetwork(String network) {
            this.network = network;
        }

        public long getChainId() {
            return chainId;
        }

        public void setChainId(long chainId) {
            this.chainId = chainId;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getRpcUrl() {
            return rpcUrl;
        }

        public void setRpcUrl(String rpcUrl) {
            this.rpcUrl = rpcUrl;
        }

        public String getWsUrl() {
            return wsUrl;
        }

        public void setWsUrl(String wsUrl) {
            this.wsUrl = wsUrl;
        }

        public boolean isWatcherEnabled() {
            return watcherEnabled;
        }

        public void setWatcherEnabled(boolean watcherEnabled) {
            this.watcherEnabled = watcherEnabled;
        }

        public boolean isPriorityFee() {
            return priorityFee;
        }

        public void setPriorityFee(boolean priorityFee) {
            this.priorityFee = priorityFee;
        }

        public Duration getGasRefreshInterval() {
            return gasRefreshInterval;
        }

        public void setGasRefreshInterval(Duration gasRefreshInterval) {
            this.gasRefreshInterval = gasRefreshInterval;
        }

        public BigDecimal getFeeFloor() {
            return feeFloor;
        }

        public void setFeeFloor(BigDecimal feeFloor) {
            this.feeFloor = feeFloor;
        }

        public BigDecimal getFeeMultiplier() {
            return feeMultiplier;
        }

        public void setFeeMultiplier(BigDecimal feeMultiplier) {
            this.feeMultiplier = feeMultiplier;
        }

        public Duration getMockReceiptDelay() {
            return mockReceiptDelay;
        }

        public void setMockReceiptDelay(Duration mockReceiptDelay) {
            this.mockReceiptDelay = mockReceiptDelay;
        }

        public Subscription getSubscription() {
            return subscription;
        }
    }

    /**
     * 实时订阅协议的方法名，默认为 signatureSubscribe / accountSubscribe 一族。
     */
    public static class Subscription {

        private String signatureSubscribe = "signatureSubscribe";
        private String signatureUnsubscribe = "signatureUnsubscribe";
        private String accountSubscribe = "accountSubscribe";
        private String accountUnsubscribe = "accountUnsubscribe";
        private String commitment = "confirmed";

        public String getSignatureSubscribe() {
            return signatureSubscribe;
        }

        public void setSignatureSubscribe(String signatureSubscribe) {
            this.signatureSubscribe = signatureSubscribe;
        }

        public String getSignatureUnsubscribe() {
            return signatureUnsubscribe;
        }

        public void setSignatureUnsubscribe(String signatureUnsubscribe) {
            this.signatureUnsubscribe = signatureUnsubscribe;
        }

        public String getAccountSubscribe() {
            return accountSubscribe;
        }

        public void setAccountSubscribe(String accountSubscribe) {
            this.accountSubscribe = accountSubscribe;
        }

        public String getAccountUnsubscribe() {
            return accountUnsubscribe;
        }

        public void setAccountUnsubscribe(String accountUnsubscribe) {
            this.accountUnsubscribe = accountUnsubscribe;
        }

        public String getCommitment() {
            return commitment;
        }

        public void setCommitment(String commitment) {
            this.commitment = commitment;
        }
    }
}
