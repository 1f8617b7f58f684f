package com.minerpayout.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Credit for one accepted share. Amount in native units. Not persisted: only the aggregate pending balance
 * and the payout history carry accounting weight.
 */
public record Reward(
        long blockReference,
        String shareIdentifier,
        BigDecimal amount,
        Instant createdAt,
        String beneficiaryAddress,
        RewardStatus status
) {

    public Reward included() {
        return new Reward(blockReference, shareIdentifier, amount, createdAt, beneficiaryAddress, RewardStatus.INCLUDED);
    }
}
