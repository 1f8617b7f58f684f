package com.minerpayout.payout;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Beneficiary, fee, threshold and gas settings for reward accrual and payouts. Amounts in native units (ether).
 */
@ConfigurationProperties(prefix = "minerpayout.payout")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class PayoutProperties {

    static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    /** Destination of every net payout. Format is checked at engine initialization. */
    @NotBlank
    private String beneficiaryAddress;

    /** Operator wallet receiving the fee. No fee transaction is sent when unset. */
    private String poolWallet;

    /** Node-managed account that signs payouts. Defaults to the pool wallet. */
    private String payerAddress;

    /** Percent of each payout diverted to the pool wallet. */
    @DecimalMin("0")
    @DecimalMax("100")
    private BigDecimal feePercentage = BigDecimal.ONE;

    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal minimumPayoutThreshold = new BigDecimal("0.01");

    /** Base credit of one share at full difficulty and normal gas. */
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal rewardPerShare = new BigDecimal("0.001");

    @Positive
    private long gasLimit = 21_000L;

    /** Applied to the sampled gas price for faster inclusion. */
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal gasPriceMultiplier = new BigDecimal("1.1");

    /** Upper bound for the submitted gas price. */
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal maxGasPriceGwei = new BigDecimal("100");

    private long payoutIntervalMs = 3_600_000L;

    private long gasPriceRefreshMs = 600_000L;

    public boolean hasPoolWallet() {
        return poolWallet != null && !poolWallet.isBlank();
    }

    /**
     * Sending account: payer address, else pool wallet, else the zero address (which the node will reject).
     */
    public String resolvePayerAddress() {
        if (payerAddress != null && !payerAddress.isBlank()) {
            return payerAddress.trim();
        }
        if (hasPoolWallet()) {
            return poolWallet.trim();
        }
        return ZERO_ADDRESS;
    }
}
