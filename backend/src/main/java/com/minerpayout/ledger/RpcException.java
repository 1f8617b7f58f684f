package com.minerpayout.ledger;

import lombok.Getter;

/**
 * A ledger read failed: transport error, JSON-RPC error object or unparseable result.
 * Carries the JSON-RPC method so callers can log which read broke.
 */
@Getter
public class RpcException extends RuntimeException {

    private final String method;

    public RpcException(String method, String message) {
        super(method + ": " + message);
        this.method = method;
    }

    public RpcException(String method, String message, Throwable cause) {
        super(method + ": " + message, cause);
        this.method = method;
    }
}
