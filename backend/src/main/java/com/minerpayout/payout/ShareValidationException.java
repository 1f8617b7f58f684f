package com.minerpayout.payout;

import lombok.Getter;

/**
 * Malformed share (missing or non-positive difficulty, blank hash). Fails that accrual only.
 * API layer maps to 400 INVALID_SHARE.
 */
@Getter
public class ShareValidationException extends RuntimeException {

    public static final String INVALID_SHARE = "INVALID_SHARE";

    private final String errorCode = INVALID_SHARE;

    public ShareValidationException(String message) {
        super(message);
    }
}
