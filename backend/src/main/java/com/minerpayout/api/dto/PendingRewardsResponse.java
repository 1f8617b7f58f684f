package com.minerpayout.api.dto;

import java.math.BigDecimal;

/**
 * GET /api/v1/rewards/pending response.
 */
public record PendingRewardsResponse(BigDecimal amount, BigDecimal minimumPayoutThreshold, boolean readyForPayout) {
}
