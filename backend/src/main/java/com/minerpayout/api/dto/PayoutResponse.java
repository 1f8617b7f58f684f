package com.minerpayout.api.dto;

import com.minerpayout.domain.PayoutRecord;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One payout ledger entry as exposed over the API.
 */
public record PayoutResponse(
        String id,
        long sequence,
        String transactionHash,
        String feeTransactionHash,
        BigDecimal payoutAmount,
        BigDecimal feeAmount,
        String recipient,
        long blockReference,
        Instant createdAt,
        Instant completedAt,
        String status,
        String failureReason
) {

    public static PayoutResponse from(PayoutRecord r) {
        return new PayoutResponse(
                r.getId(),
                r.getSequence(),
                r.getTransactionHash(),
                r.getFeeTransactionHash(),
                r.getPayoutAmount(),
                r.getFeeAmount(),
                r.getRecipient(),
                r.getBlockReference(),
                r.getCreatedAt(),
                r.getCompletedAt(),
                r.getStatus() != null ? r.getStatus().name() : null,
                r.getFailureReason());
    }
}
