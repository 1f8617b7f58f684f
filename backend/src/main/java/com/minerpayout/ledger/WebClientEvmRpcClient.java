package com.minerpayout.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 over HTTP POST. Returns the raw response body; result and error objects are interpreted
 * by {@link EvmLedgerClient}.
 */
@Slf4j
public class WebClientEvmRpcClient implements EvmRpcClient {

    private final WebClient webClient;
    private final Duration timeout;
    private final AtomicLong nextId = new AtomicLong(1);

    public WebClientEvmRpcClient(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        long id = nextId.getAndIncrement();
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("id", id);
        request.put("method", method);
        request.put("params", params == null ? List.of() : params);
        log.trace("-> {} #{} {}", endpointUrl, id, method);

        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class,
                        e -> new RpcException(method, "HTTP " + e.getStatusCode().value() + " from " + endpointUrl, e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new RpcException(method, "request to " + endpointUrl + " failed: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new RpcException(method, "no response from " + endpointUrl + " within " + timeout.toMillis() + " ms", e));
    }
}
