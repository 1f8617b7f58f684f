package com.minerpayout.ledger.config;

import com.minerpayout.common.RetryPolicy;
import com.minerpayout.ledger.EvmRpcClient;
import com.minerpayout.ledger.RpcEndpointRotator;
import com.minerpayout.ledger.WebClientEvmRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the EVM ledger client: endpoint rotator (primary node first), JSON-RPC transport and local rate limiter.
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerClientConfig {

    @Bean
    public RpcEndpointRotator ledgerEndpointRotator(LedgerProperties properties) {
        List<String> endpoints = new ArrayList<>();
        endpoints.add(properties.getNodeEndpoint().trim());
        properties.getFallbackEndpoints().stream()
                .filter(url -> url != null && !url.isBlank())
                .map(String::trim)
                .filter(url -> !endpoints.contains(url))
                .forEach(endpoints::add);
        LedgerProperties.Retry retry = properties.getRetry();
        return new RpcEndpointRotator(endpoints,
                new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts(), retry.getMaxDelayMs()));
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder, LedgerProperties properties) {
        return new WebClientEvmRpcClient(webClientBuilder, Duration.ofMillis(Math.max(1L, properties.getRequestTimeoutMs())));
    }

    @Bean(name = "ledgerRpcRateLimiter")
    public RateLimiter ledgerRpcRateLimiter(LedgerProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("ledger-rpc", config);
    }
}
