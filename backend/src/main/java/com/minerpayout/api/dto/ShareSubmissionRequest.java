package com.minerpayout.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * POST /api/v1/shares request body, sent by the share source for each accepted share.
 */
public record ShareSubmissionRequest(
        @NotNull(message = "INVALID_SHARE") @PositiveOrZero(message = "INVALID_SHARE") Long blockReference,
        @NotBlank(message = "INVALID_SHARE") String hash,
        @NotNull(message = "INVALID_SHARE") @Positive(message = "INVALID_SHARE") BigDecimal difficulty
) {
}
