package com.minerpayout.payout;

import lombok.Getter;

/**
 * Payout destination or sending account is malformed. Raised during initialization; aborts startup.
 */
@Getter
public class PayoutConfigurationException extends RuntimeException {

    public static final String INVALID_ADDRESS = "INVALID_ADDRESS";

    private final String errorCode = INVALID_ADDRESS;

    public PayoutConfigurationException(String message) {
        super(message);
    }
}
