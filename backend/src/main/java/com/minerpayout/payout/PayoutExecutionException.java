package com.minerpayout.payout;

import com.minerpayout.domain.PayoutRecord;
import lombok.Getter;

/**
 * A payout attempt failed after reservation. The reserved amount has already been credited back;
 * {@link #getFailedRecord()} is the FAILED ledger entry. API layer maps to 502 PAYOUT_FAILED.
 */
@Getter
public class PayoutExecutionException extends RuntimeException {

    public static final String PAYOUT_FAILED = "PAYOUT_FAILED";

    private final String errorCode = PAYOUT_FAILED;
    private final transient PayoutRecord failedRecord;

    public PayoutExecutionException(PayoutRecord failedRecord, Throwable cause) {
        super("Payout of " + failedRecord.getReservedAmount().toPlainString() + " failed: " + failedRecord.getFailureReason(), cause);
        this.failedRecord = failedRecord;
    }
}
