package com.minerpayout.api.dto;

/**
 * POST /api/v1/rewards/payout response. payout is null when nothing was paid.
 */
public record PayoutTriggerResponse(boolean success, PayoutResponse payout, String message) {
}
