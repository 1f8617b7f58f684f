package com.minerpayout.api.dto;

import java.util.List;

/**
 * GET /api/v1/rewards/history response, oldest first.
 */
public record PayoutHistoryResponse(List<PayoutResponse> items) {
}
