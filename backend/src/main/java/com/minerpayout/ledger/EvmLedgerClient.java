package com.minerpayout.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link LedgerClient} over EVM JSON-RPC. Reads retry across endpoints with backoff;
 * eth_sendTransaction goes to the primary node once, signed by the node-managed payer account.
 */
@Slf4j
@Component
public class EvmLedgerClient implements LedgerClient {

    private static final int NATIVE_DECIMALS = 18;

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final EvmAddressValidator addressValidator;

    public EvmLedgerClient(
            EvmRpcClient rpcClient,
            RpcEndpointRotator rotator,
            @Qualifier("ledgerRpcRateLimiter") RateLimiter rateLimiter,
            ObjectMapper objectMapper,
            EvmAddressValidator addressValidator
    ) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.addressValidator = addressValidator;
    }

    @Override
    public BigInteger getCurrentGasPrice() {
        return parseQuantity("eth_gasPrice", callWithRetry("eth_gasPrice", Collections.emptyList()));
    }

    @Override
    public boolean isValidAddress(String address) {
        return addressValidator.isValidAddress(address);
    }

    @Override
    public BigDecimal getBalance(String address) {
        BigInteger wei = parseQuantity("eth_getBalance", callWithRetry("eth_getBalance", List.of(address, "latest")));
        return new BigDecimal(wei).divide(BigDecimal.TEN.pow(NATIVE_DECIMALS), NATIVE_DECIMALS, RoundingMode.UNNECESSARY);
    }

    @Override
    public long getTransactionCount(String address) {
        return parseQuantity("eth_getTransactionCount",
                callWithRetry("eth_getTransactionCount", List.of(address, "pending"))).longValueExact();
    }

    @Override
    public long getCurrentBlockReference() {
        return parseQuantity("eth_blockNumber", callWithRetry("eth_blockNumber", Collections.emptyList())).longValueExact();
    }

    @Override
    public SubmittedTransaction submitTransaction(TransactionRequest request) {
        Map<String, String> tx = new LinkedHashMap<>();
        tx.put("from", request.from());
        tx.put("to", request.to());
        tx.put("value", toQuantity(request.valueWei()));
        tx.put("gas", toQuantity(BigInteger.valueOf(request.gasLimit())));
        tx.put("gasPrice", toQuantity(request.gasPriceWei()));
        tx.put("nonce", toQuantity(BigInteger.valueOf(request.nonce())));

        String endpoint = rotator.getPrimaryEndpoint();
        String txHash;
        try {
            acquirePermit("eth_sendTransaction", endpoint);
            String json = rpcClient.call(endpoint, "eth_sendTransaction", List.of(tx)).block();
            txHash = extractResult("eth_sendTransaction", json).asText();
        } catch (RuntimeException e) {
            throw new SubmissionException("Transaction to " + request.to() + " rejected: " + messageOf(e), e);
        }
        if (txHash == null || !txHash.startsWith("0x")) {
            throw new SubmissionException("eth_sendTransaction returned no transaction hash: " + txHash);
        }
        long blockReference;
        try {
            blockReference = getCurrentBlockReference();
        } catch (RpcException e) {
            // The transaction is already broadcast; a missing block height must not turn it into a failure.
            log.warn("Submitted {} but could not read block number: {}", txHash, e.getMessage());
            blockReference = -1L;
        }
        log.debug("Submitted {} from {} to {} value {} wei nonce {}", txHash, request.from(), request.to(),
                request.valueWei(), request.nonce());
        return new SubmittedTransaction(txHash, blockReference);
    }

    private JsonNode callWithRetry(String method, Object params) {
        Exception lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleepQuietly(method, rotator.retryDelayMs(attempt - 1));
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                acquirePermit(method, endpoint);
                String json = rpcClient.call(endpoint, method, params).block();
                return extractResult(method, json);
            } catch (Exception e) {
                lastException = e;
                log.debug("{} attempt {} on {} failed: {}", method, attempt + 1, endpoint, messageOf(e));
            }
        }
        throw new RpcException(method, "failed after " + rotator.getMaxAttempts() + " attempts: "
                + messageOf(lastException), lastException);
    }

    private void acquirePermit(String method, String endpoint) {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException(method, "local rate limit timeout on " + endpoint);
        }
    }

    private JsonNode extractResult(String method, String json) {
        if (json == null || json.isBlank()) {
            throw new RpcException(method, "empty response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new RpcException(method, "unparseable response", e);
        }
        if (root.has("error") && !root.get("error").isNull()) {
            throw new RpcException(method, "error " + root.get("error"));
        }
        JsonNode result = root.get("result");
        if (result == null || result.isNull()) {
            throw new RpcException(method, "null result");
        }
        return result;
    }

    static BigInteger parseQuantity(String method, JsonNode result) {
        String hex = result.asText(null);
        if (hex == null || !(hex.startsWith("0x") || hex.startsWith("0X"))) {
            throw new RpcException(method, "invalid quantity " + hex);
        }
        String digits = hex.substring(2);
        if (digits.isEmpty()) {
            return BigInteger.ZERO;
        }
        try {
            return new BigInteger(digits, 16);
        } catch (NumberFormatException e) {
            throw new RpcException(method, "invalid quantity " + hex, e);
        }
    }

    static String toQuantity(BigInteger value) {
        return "0x" + value.toString(16);
    }

    private static void sleepQuietly(String method, long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException(method, "interrupted during retry backoff", e);
        }
    }

    private static String messageOf(Exception e) {
        if (e == null) {
            return "unknown";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
