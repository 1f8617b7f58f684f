package com.minerpayout.payout;

import com.minerpayout.ledger.LedgerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Caches the last gas price read from the ledger. Only {@link #refresh()} talks to the node; readers get the
 * cached value, however stale.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GasPriceSampler {

    private static final BigDecimal WEI_PER_GWEI = new BigDecimal("1e9");

    private final LedgerClient ledgerClient;
    private final PayoutProperties properties;
    private final AtomicReference<GasPriceSample> latest = new AtomicReference<>();

    /**
     * Fetches the current gas price and replaces the cached sample. Errors propagate and the old sample is kept.
     */
    public GasPriceSample refresh() {
        BigInteger priceWei = ledgerClient.getCurrentGasPrice();
        GasPriceSample sample = new GasPriceSample(priceWei, Instant.now());
        latest.set(sample);
        log.info("Current gas price: {} Gwei", sample.gwei().stripTrailingZeros().toPlainString());
        return sample;
    }

    public Optional<GasPriceSample> current() {
        return Optional.ofNullable(latest.get());
    }

    /**
     * Gas price for payout transactions: sample × multiplier, capped at the configured maximum.
     */
    public BigInteger transactionGasPrice() {
        GasPriceSample sample = current().orElseGet(this::refresh);
        BigInteger boosted = new BigDecimal(sample.priceWei())
                .multiply(properties.getGasPriceMultiplier())
                .setScale(0, RoundingMode.CEILING)
                .toBigIntegerExact();
        BigInteger cap = properties.getMaxGasPriceGwei().multiply(WEI_PER_GWEI)
                .setScale(0, RoundingMode.DOWN)
                .toBigIntegerExact();
        if (boosted.compareTo(cap) > 0) {
            log.warn("Gas price {} wei exceeds cap {} Gwei; submitting at cap", boosted, properties.getMaxGasPriceGwei());
            return cap;
        }
        return boosted;
    }
}
