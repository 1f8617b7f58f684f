package com.minerpayout.api.dto;

/**
 * POST /api/v1/shares response.
 */
public record ShareSubmissionResponse(String message) {
}
