package com.copytrader.config;

import com.copytrader.event.EventPublisherHelper;
import com.copytrader.execution.BundleRelay;
import com.copytrader.execution.NetworkCallGuard;
import com.copytrader.execution.RpcHealthTracker;
import com.copytrader.execution.TipStrategy;
import com.copytrader.execution.TransactionBuilder;
import com.copytrader.execution.TransactionExecutor;
import com.copytrader.execution.TransactionNetwork;
import com.copytrader.service.AuditService;
import com.copytrader.solana.JitoBundleRelay;
import com.copytrader.solana.JsonRpcClient;
import com.copytrader.solana.NetworkException;
import com.copytrader.solana.SenderRelay;
import com.copytrader.solana.SolanaRpcClient;
import com.copytrader.solana.SwapApiTransactionBuilder;
import com.copytrader.solana.TransactionSigner;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

/**
 * Wires the transaction executor to its network endpoints.
 *
 * <p>Primary and fallback endpoints are two instances of the same client. Relays are
 * registered in submission order and only when their URL is configured.
 */
@Configuration
public class ExecutionConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutionConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate networkRestTemplate(RestTemplateBuilder builder, NetworkProperties networkProperties) {
        return builder.connectTimeout(networkProperties.getConnectTimeout())
                .readTimeout(networkProperties.getReadTimeout())
                .build();
    }

    @Bean
    public JsonRpcClient jsonRpcClient(RestTemplate networkRestTemplate) {
        return new JsonRpcClient(networkRestTemplate);
    }

    @Bean
    public SolanaRpcClient primaryNetwork(NetworkProperties networkProperties, JsonRpcClient jsonRpcClient) {
        return new SolanaRpcClient("primary-rpc", networkProperties.getPrimaryRpcUrl(), jsonRpcClient);
    }

    @Bean
    public SolanaRpcClient fallbackNetwork(NetworkProperties networkProperties, JsonRpcClient jsonRpcClient) {
        String url = networkProperties.getFallbackRpcUrl();
        if (!StringUtils.hasText(url)) {
            log.warn("No fallback RPC configured, fallback mode will reuse the primary endpoint");
            url = networkProperties.getPrimaryRpcUrl();
        }
        return new SolanaRpcClient("fallback-rpc", url, jsonRpcClient);
    }

    @Bean
    public TransactionBuilder transactionBuilder(RestTemplate networkRestTemplate, NetworkProperties networkProperties) {
        if (!StringUtils.hasText(networkProperties.getOperatorKeypair())) {
            log.warn("Operator keypair not configured, every execution will fail until it is set");
            return (signal, tip, blockhash) -> {
                throw new NetworkException("Operator keypair not configured");
            };
        }
        return new SwapApiTransactionBuilder(
                networkRestTemplate, networkProperties, new TransactionSigner(networkProperties.getOperatorKeypair()));
    }

    /** Pool for timeout-bounded network calls; daemon threads so a hung socket never blocks shutdown. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService networkCallExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "network-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public NetworkCallGuard networkCallGuard(ExecutorService networkCallExecutor) {
        return new NetworkCallGuard(networkCallExecutor);
    }

    @Bean
    public TransactionExecutor transactionExecutor(
            @Qualifier("primaryNetwork") TransactionNetwork primaryNetwork,
            @Qualifier("fallbackNetwork") TransactionNetwork fallbackNetwork,
            NetworkProperties networkProperties,
            JsonRpcClient jsonRpcClient,
            TransactionBuilder transactionBuilder,
            TipStrategy tipStrategy,
            RpcHealthTracker rpcHealthTracker,
            NetworkCallGuard networkCallGuard,
            ExecutorProperties executorProperties,
            AuditService auditService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        List<BundleRelay> relays = new ArrayList<>();
        if (StringUtils.hasText(networkProperties.getBundleRelayUrl())) {
            relays.add(new JitoBundleRelay(networkProperties.getBundleRelayUrl(), jsonRpcClient));
        }
        if (StringUtils.hasText(networkProperties.getSecondaryRelayUrl())) {
            relays.add(new SenderRelay(networkProperties.getSecondaryRelayUrl(), jsonRpcClient));
        }
        log.info("Transaction executor: {} relay(s), primary={}, fallback={}", relays.size(),
                primaryNetwork.name(), fallbackNetwork.name());
        return new TransactionExecutor(
                primaryNetwork,
                fallbackNetwork,
                relays,
                transactionBuilder,
                tipStrategy,
                rpcHealthTracker,
                networkCallGuard,
                executorProperties,
                auditService,
                eventPublisherHelper,
                clock);
    }
}
