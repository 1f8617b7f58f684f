package com.minerpayout.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One payout attempt. Born EXECUTING in memory; persisted once it reaches COMPLETED or FAILED and never
 * changed afterwards. Invariant: payoutAmount + feeAmount == reservedAmount.
 */
@Document(collection = "payout_records")
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PayoutRecord {

    @Id
    @EqualsAndHashCode.Include
    private final String id;
    /** Append order in the payout ledger; assigned when finalized. */
    @Indexed(unique = true)
    private final long sequence;
    private final String transactionHash;
    /** Null when no fee transaction was sent or it was rejected. */
    private final String feeTransactionHash;
    private final BigDecimal reservedAmount;
    private final BigDecimal payoutAmount;
    private final BigDecimal feeAmount;
    private final String recipient;
    private final String poolWallet;
    private final long blockReference;
    private final Instant createdAt;
    private final Instant completedAt;
    private final PayoutStatus status;
    private final String failureReason;

    public boolean isCompleted() {
        return status == PayoutStatus.COMPLETED;
    }
}
