package com.minerpayout.api.dto;

import java.math.BigDecimal;

/**
 * GET /api/v1/rewards/beneficiary response. gasPriceGwei is null until the first sample.
 */
public record BeneficiaryResponse(String address, BigDecimal onChainBalance, BigDecimal gasPriceGwei) {
}
