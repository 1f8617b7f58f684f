package com.minerpayout.api.dto;

import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * Error response: HTTP status, machine-readable code, human-readable message, ISO-8601 timestamp.
 */
public record ErrorBody(int status, String error, String message, Instant timestamp) {

    public static ErrorBody of(HttpStatus status, String error, String message) {
        return new ErrorBody(status.value(), error, message, Instant.now());
    }
}
