package com.minerpayout.payout;

import com.minerpayout.domain.PayoutRecord;
import com.minerpayout.domain.PayoutStatus;
import com.minerpayout.domain.Reward;
import com.minerpayout.domain.RewardStatus;
import com.minerpayout.domain.ShareAcceptedEvent;
import com.minerpayout.ledger.LedgerClient;
import com.minerpayout.ledger.SubmittedTransaction;
import com.minerpayout.ledger.TransactionRequest;
import com.minerpayout.payout.event.PayoutFinishedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reward accrual and payout for one beneficiary.
 *
 * <p>Payout state machine: reserve (atomic check-and-zero of the pending balance) → submit (ledger calls,
 * outside the balance lock) → COMPLETED, or FAILED with the reserved amount credited back. At most one payout
 * is in flight; concurrent triggers are rejected as no-ops.
 */
@Service
@Slf4j
public class RewardPayoutEngine {

    private static final int SCALE = 18;
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final LedgerClient ledgerClient;
    private final RewardCalculator rewardCalculator;
    private final GasPriceSampler gasPriceSampler;
    private final PayoutLedger payoutLedger;
    private final PayoutProperties properties;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final PendingBalance pendingBalance = new PendingBalance();
    private final AtomicBoolean payoutInFlight = new AtomicBoolean(false);
    private volatile boolean initialized;

    public RewardPayoutEngine(
            LedgerClient ledgerClient,
            RewardCalculator rewardCalculator,
            GasPriceSampler gasPriceSampler,
            PayoutLedger payoutLedger,
            PayoutProperties properties,
            ApplicationEventPublisher applicationEventPublisher
    ) {
        this.ledgerClient = ledgerClient;
        this.rewardCalculator = rewardCalculator;
        this.gasPriceSampler = gasPriceSampler;
        this.payoutLedger = payoutLedger;
        this.properties = properties;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        initialize();
    }

    /**
     * Validates the configured addresses, samples the gas price and logs the beneficiary balance.
     * Runs once; later calls return immediately.
     *
     * @throws PayoutConfigurationException when an address is malformed
     */
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        String beneficiary = beneficiary();
        if (!ledgerClient.isValidAddress(beneficiary)) {
            throw new PayoutConfigurationException("Invalid beneficiary address: " + beneficiary);
        }
        if (properties.hasPoolWallet() && !ledgerClient.isValidAddress(properties.getPoolWallet().trim())) {
            throw new PayoutConfigurationException("Invalid pool wallet: " + properties.getPoolWallet());
        }
        if (properties.getPayerAddress() != null && !properties.getPayerAddress().isBlank()
                && !ledgerClient.isValidAddress(properties.getPayerAddress().trim())) {
            throw new PayoutConfigurationException("Invalid payer address: " + properties.getPayerAddress());
        }
        gasPriceSampler.refresh();
        BigDecimal balance = ledgerClient.getBalance(beneficiary);
        log.info("Reward engine initialized for {}; on-chain balance {} ETH, payout threshold {}, fee {}%",
                beneficiary, balance.stripTrailingZeros().toPlainString(),
                properties.getMinimumPayoutThreshold().toPlainString(), properties.getFeePercentage().toPlainString());
        initialized = true;
    }

    /**
     * Credits one accepted share. When the pending balance reaches the threshold a payout runs before returning;
     * its failure is logged and recorded but does not fail the accrual.
     *
     * @throws ShareValidationException when difficulty or hash is missing or difficulty is not positive
     */
    public Reward accrueReward(ShareAcceptedEvent share) {
        validate(share);
        ensureInitialized();
        BigDecimal gasGwei = gasPriceSampler.current()
                .orElseGet(gasPriceSampler::refresh)
                .gwei();
        BigDecimal amount = rewardCalculator.calculate(share.difficulty(), gasGwei);
        BigDecimal total = pendingBalance.credit(amount);
        Reward reward = new Reward(share.blockReference(), share.hash(), amount, Instant.now(), beneficiary(),
                RewardStatus.PENDING);
        log.info("Reward added: {} ETH for share {} (pending {})", amount.stripTrailingZeros().toPlainString(),
                abbreviate(share.hash()), total.stripTrailingZeros().toPlainString());

        if (total.compareTo(properties.getMinimumPayoutThreshold()) >= 0) {
            try {
                Optional<PayoutRecord> payout = executePayoutIfReady();
                if (payout.isPresent()) {
                    return reward.included();
                }
            } catch (PayoutExecutionException e) {
                log.warn("Payout triggered by share {} failed; balance restored: {}", abbreviate(share.hash()), e.getMessage());
            }
        }
        return reward;
    }

    public PendingBalanceView getPendingBalance() {
        BigDecimal amount = pendingBalance.current();
        BigDecimal threshold = properties.getMinimumPayoutThreshold();
        return new PendingBalanceView(amount, threshold, amount.compareTo(threshold) >= 0);
    }

    public List<PayoutRecord> getPayoutHistory() {
        return payoutLedger.history();
    }

    /**
     * History plus failed attempts, in ledger order.
     */
    public List<PayoutRecord> getPayoutAttempts() {
        return payoutLedger.attempts();
    }

    /**
     * Manual trigger. Empty when below threshold or another payout is in flight.
     *
     * @throws PayoutExecutionException when submission failed; the balance has been restored
     */
    public Optional<PayoutRecord> triggerPayoutIfReady() {
        ensureInitialized();
        return executePayoutIfReady();
    }

    /**
     * Re-samples the gas price used for reward scaling and transaction pricing.
     */
    public GasPriceSample refreshGasPrice() {
        return gasPriceSampler.refresh();
    }

    public Optional<GasPriceSample> currentGasPrice() {
        return gasPriceSampler.current();
    }

    public String beneficiary() {
        return properties.getBeneficiaryAddress().trim();
    }

    private Optional<PayoutRecord> executePayoutIfReady() {
        if (!payoutInFlight.compareAndSet(false, true)) {
            log.debug("Payout already in flight; trigger ignored");
            return Optional.empty();
        }
        try {
            BigDecimal reserved = pendingBalance.reserveIfAtLeast(properties.getMinimumPayoutThreshold());
            if (reserved.signum() == 0) {
                return Optional.empty();
            }
            return Optional.of(submit(reserved));
        } finally {
            payoutInFlight.set(false);
        }
    }

    private PayoutRecord submit(BigDecimal reserved) {
        BigDecimal fee = reserved.multiply(properties.getFeePercentage())
                .divide(HUNDRED, SCALE, RoundingMode.DOWN);
        BigDecimal payoutAmount = reserved.subtract(fee);
        String payer = properties.resolvePayerAddress();
        PayoutRecord executing = PayoutRecord.builder()
                .id(UUID.randomUUID().toString())
                .reservedAmount(reserved)
                .payoutAmount(payoutAmount)
                .feeAmount(fee)
                .recipient(beneficiary())
                .poolWallet(properties.hasPoolWallet() ? properties.getPoolWallet().trim() : null)
                .createdAt(Instant.now())
                .status(PayoutStatus.EXECUTING)
                .build();
        log.info("Executing payout {}: {} ETH to {} (fee {})", executing.getId(),
                payoutAmount.stripTrailingZeros().toPlainString(), executing.getRecipient(),
                fee.stripTrailingZeros().toPlainString());

        SubmittedTransaction payoutTx;
        long nonce;
        BigInteger gasPrice;
        try {
            nonce = ledgerClient.getTransactionCount(payer);
            gasPrice = gasPriceSampler.transactionGasPrice();
            payoutTx = ledgerClient.submitTransaction(new TransactionRequest(
                    payer, executing.getRecipient(), toWei(payoutAmount), properties.getGasLimit(), gasPrice, nonce));
        } catch (RuntimeException e) {
            pendingBalance.credit(reserved);
            PayoutRecord failed = payoutLedger.append(executing.toBuilder()
                    .status(PayoutStatus.FAILED)
                    .completedAt(Instant.now())
                    .failureReason(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build());
            log.error("Payout {} failed, {} ETH returned to pending balance: {}", failed.getId(),
                    reserved.stripTrailingZeros().toPlainString(), failed.getFailureReason(), e);
            applicationEventPublisher.publishEvent(new PayoutFinishedEvent(this, failed));
            throw new PayoutExecutionException(failed, e);
        }

        String feeTxHash = submitFee(payer, fee, gasPrice, nonce + 1);
        PayoutRecord completed = payoutLedger.append(executing.toBuilder()
                .status(PayoutStatus.COMPLETED)
                .transactionHash(payoutTx.transactionHash())
                .feeTransactionHash(feeTxHash)
                .blockReference(payoutTx.blockReference())
                .completedAt(Instant.now())
                .build());
        log.info("Payout completed: {} ETH sent to {} in {}", payoutAmount.stripTrailingZeros().toPlainString(),
                completed.getRecipient(), completed.getTransactionHash());
        applicationEventPublisher.publishEvent(new PayoutFinishedEvent(this, completed));
        return completed;
    }

    /**
     * Fee transfer to the pool wallet. A rejection is logged and leaves the payout standing.
     */
    private String submitFee(String payer, BigDecimal fee, BigInteger gasPrice, long nonce) {
        if (!properties.hasPoolWallet() || fee.signum() <= 0) {
            return null;
        }
        String poolWallet = properties.getPoolWallet().trim();
        try {
            SubmittedTransaction feeTx = ledgerClient.submitTransaction(new TransactionRequest(
                    payer, poolWallet, toWei(fee), properties.getGasLimit(), gasPrice, nonce));
            log.info("Pool fee transaction: {}", feeTx.transactionHash());
            return feeTx.transactionHash();
        } catch (RuntimeException e) {
            log.warn("Pool fee transaction of {} ETH to {} failed: {}", fee.stripTrailingZeros().toPlainString(),
                    poolWallet, e.getMessage());
            return null;
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private static void validate(ShareAcceptedEvent share) {
        if (share == null) {
            throw new ShareValidationException("Share is required");
        }
        if (share.difficulty() == null) {
            throw new ShareValidationException("Share difficulty is required");
        }
        if (share.difficulty().signum() <= 0) {
            throw new ShareValidationException("Share difficulty must be positive: " + share.difficulty());
        }
        if (share.hash() == null || share.hash().isBlank()) {
            throw new ShareValidationException("Share hash is required");
        }
    }

    static BigInteger toWei(BigDecimal ether) {
        return ether.movePointRight(SCALE).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
    }

    private static String abbreviate(String hash) {
        return hash.length() > 10 ? hash.substring(0, 10) + "..." : hash;
    }
}
