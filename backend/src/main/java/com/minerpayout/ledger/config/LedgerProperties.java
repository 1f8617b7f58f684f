package com.minerpayout.ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Node connection, throttling and retry settings for the ledger client.
 */
@ConfigurationProperties(prefix = "minerpayout.ledger")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class LedgerProperties {

    /** JSON-RPC endpoint of the node that holds the payer account. Transactions are submitted here. */
    @NotBlank
    private String nodeEndpoint;

    /** Extra endpoints used for read retries only. */
    private List<String> fallbackEndpoints = new ArrayList<>();

    /** Local JSON-RPC budget (requests per second). */
    private int maxRequestsPerSecond = 20;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long limiterTimeoutMs = 2_000;

    /** Per-request timeout. */
    private long requestTimeoutMs = 10_000;

    @Valid
    private Retry retry = new Retry();

    public void setFallbackEndpoints(List<String> fallbackEndpoints) {
        this.fallbackEndpoints = fallbackEndpoints != null ? fallbackEndpoints : new ArrayList<>();
    }

    /**
     * Read retry policy (exponential backoff ± jitter).
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {

        private long baseDelayMs = 1000L;

        /** Upper bound for a single backoff wait. */
        private long maxDelayMs = 30_000L;

        /** 0..1, e.g. 0.2 = ±20%. */
        private double jitterFactor = 0.2;

        /** Total attempts including the first call. */
        private int maxAttempts = 5;
    }
}
