package com.minerpayout.payout;

import java.math.BigDecimal;

/**
 * Snapshot of the pending balance against the payout threshold.
 */
public record PendingBalanceView(BigDecimal amount, BigDecimal minimumPayoutThreshold, boolean readyForPayout) {
}
