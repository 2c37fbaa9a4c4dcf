package com.work.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.gateway.chain.web3j.CredentialsResolver;
import com.work.gateway.core.execution.AddressSerialExecutor;
import com.work.gateway.core.execution.AddressQueueExecutor;
import com.work.gateway.core.gas.GasPriceOracle;
import com.work.gateway.core.lifecycle.ChainRegistry;
import com.work.gateway.core.metrics.GatewayMetrics;
import com.work.gateway.core.metrics.RequestCountingGatewayMetrics;
import com.work.gateway.core.nonce.NonceRecordRepository;
import com.work.gateway.core.pending.PendingTransactionRepository;
import com.work.gateway.core.pending.PendingTransactionStore;
import com.work.gateway.core.support.InMemoryNonceRecordRepository;
import com.work.gateway.core.support.InMemoryPendingTransactionRepository;
import com.work.gateway.repository.impl.MybatisNonceRecordRepository;
import com.work.gateway.repository.impl.MybatisPendingTransactionRepository;
import com.work.gateway.repository.mapper.NonceRecordMapper;
import com.work.gateway.repository.mapper.PendingTransactionMapper;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * 将核心组件装配为 Spring Bean。
 * 每条链的组件由 {@link ChainContextFactory} 组装，统一由 {@link ChainRegistry} 持有并管理启停。
 */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
@MapperScan("com.work.gateway.repository.mapper")
public class GatewayConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock gatewayClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(ObjectMapper.class)
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    /**
     * 默认只统计并定期打印 RPC 请求数；平台可自定义 GatewayMetrics Bean 接入 Micrometer 等。
     */
    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean(GatewayMetrics.class)
    public RequestCountingGatewayMetrics gatewayMetrics(GatewayProperties properties) {
        return new RequestCountingGatewayMetrics(properties.getMetrics().getRequestLogInterval());
    }

    @Bean(destroyMethod = "close")
    public AddressQueueExecutor addressSerialExecutor(GatewayProperties properties) {
        GatewayProperties.Nonce nonce = properties.getNonce();
        return new AddressQueueExecutor(nonce.getWorkerCount(), nonce.getQueueCapacity(), "nonce-section-");
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway", name = "store-mode", havingValue = "jdbc", matchIfMissing = true)
    public NonceRecordRepository mybatisNonceRecordRepository(NonceRecordMapper mapper) {
        return new MybatisNonceRecordRepository(mapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway", name = "store-mode", havingValue = "jdbc", matchIfMissing = true)
    public PendingTransactionRepository mybatisPendingTransactionRepository(PendingTransactionMapper mapper,
                                                                            PlatformTransactionManager transactionManager) {
        return new MybatisPendingTransactionRepository(mapper, new TransactionTemplate(transactionManager));
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway", name = "store-mode", havingValue = "memory")
    public NonceRecordRepository inMemoryNonceRecordRepository() {
        return new InMemoryNonceRecordRepository();
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway", name = "store-mode", havingValue = "memory")
    public PendingTransactionRepository inMemoryPendingTransactionRepository() {
        return new InMemoryPendingTransactionRepository();
    }

    @Bean
    public PendingTransactionStore pendingTransactionStore(PendingTransactionRepository repository,
                                                           GatewayProperties properties,
                                                           Clock clock) {
        GatewayProperties.Pending pending = properties.getPending();
        return new PendingTransactionStore(repository, pending.getDurationLimit(), pending.getRetention(), clock);
    }

    // 生命周期交给 ChainRegistry
    @Bean(destroyMethod = "")
    public GasPriceOracle gasPriceOracle(GatewayProperties properties, Clock clock, GatewayMetrics metrics) {
        return new GasPriceOracle(properties.getGas().getCacheTtl(), clock, metrics);
    }

    @Bean
    public ChainContextFactory chainContextFactory(GatewayProperties properties,
                                                   NonceRecordRepository nonceRepository,
                                                   PendingTransactionStore pendingStore,
                                                   GasPriceOracle gasOracle,
                                                   AddressSerialExecutor executor,
                                                   Clock clock,
                                                   GatewayMetrics metrics,
                                                   ObjectMapper objectMapper,
                                                   ObjectProvider<CredentialsResolver> credentialsResolver) {
        return new ChainContextFactory(properties, nonceRepository, pendingStore, gasOracle, executor,
                clock, metrics, objectMapper, credentialsResolver.getIfAvailable());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public ChainRegistry chainRegistry(GatewayProperties properties,
                                       ChainContextFactory factory,
                                       GasPriceOracle gasOracle) {
        ChainRegistry registry = new ChainRegistry(gasOracle,
                properties.getWatcher().getConnectTimeout().plusSeconds(5));
        for (GatewayProperties.Chain chain : properties.getChains()) {
            factory.register(chain, registry);
        }
        return registry;
    }
}
