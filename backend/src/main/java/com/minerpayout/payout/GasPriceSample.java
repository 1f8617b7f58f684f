package com.minerpayout.payout;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Latest observed network gas price.
 */
public record GasPriceSample(BigInteger priceWei, Instant sampledAt) {

    private static final BigDecimal WEI_PER_GWEI = new BigDecimal("1e9");

    public BigDecimal gwei() {
        return new BigDecimal(priceWei).divide(WEI_PER_GWEI, 9, RoundingMode.UNNECESSARY);
    }
}
