package com.minerpayout.payout;

import com.minerpayout.ledger.EvmAddressValidator;
import com.minerpayout.ledger.LedgerClient;
import com.minerpayout.ledger.RpcException;
import com.minerpayout.ledger.SubmissionException;
import com.minerpayout.ledger.SubmittedTransaction;
import com.minerpayout.ledger.TransactionRequest;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory ledger for engine tests. Records submissions; can reject transfers to chosen recipients
 * or hold submissions until released.
 */
class FakeLedgerClient implements LedgerClient {

    private final EvmAddressValidator validator = new EvmAddressValidator();
    private final List<TransactionRequest> submitted = new ArrayList<>();
    private final Set<String> rejectedRecipients = new HashSet<>();
    private final AtomicLong txCounter = new AtomicLong();

    private volatile BigInteger gasPriceWei = new BigInteger("35000000000");
    private volatile boolean gasPriceUnavailable;
    private volatile long nonce = 5L;
    private volatile long blockNumber = 1_000L;
    private volatile CountDownLatch submissionGate;
    private final CountDownLatch submissionEntered = new CountDownLatch(1);

    void setGasPriceWei(BigInteger gasPriceWei) {
        this.gasPriceWei = gasPriceWei;
    }

    void setGasPriceUnavailable(boolean unavailable) {
        this.gasPriceUnavailable = unavailable;
    }

    synchronized void rejectTransfersTo(String recipient) {
        rejectedRecipients.add(recipient);
    }

    synchronized void acceptAllTransfers() {
        rejectedRecipients.clear();
    }

    /**
     * Blocks every submission until the returned latch is counted down.
     */
    CountDownLatch holdSubmissions() {
        CountDownLatch gate = new CountDownLatch(1);
        submissionGate = gate;
        return gate;
    }

    boolean awaitSubmissionEntered(long timeoutMs) throws InterruptedException {
        return submissionEntered.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    synchronized List<TransactionRequest> submitted() {
        return List.copyOf(submitted);
    }

    @Override
    public BigInteger getCurrentGasPrice() {
        if (gasPriceUnavailable) {
            throw new RpcException("eth_gasPrice", "failed after 5 attempts: connection refused");
        }
        return gasPriceWei;
    }

    @Override
    public boolean isValidAddress(String address) {
        return validator.isValidAddress(address);
    }

    @Override
    public BigDecimal getBalance(String address) {
        return new BigDecimal("2.5");
    }

    @Override
    public long getTransactionCount(String address) {
        return nonce;
    }

    @Override
    public long getCurrentBlockReference() {
        return blockNumber;
    }

    @Override
    public SubmittedTransaction submitTransaction(TransactionRequest request) {
        submissionEntered.countDown();
        CountDownLatch gate = submissionGate;
        if (gate != null) {
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SubmissionException("interrupted", e);
            }
        }
        synchronized (this) {
            if (rejectedRecipients.contains(request.to())) {
                throw new SubmissionException("Transaction to " + request.to() + " rejected: insufficient funds");
            }
            submitted.add(request);
            nonce = Math.max(nonce, request.nonce() + 1);
        }
        return new SubmittedTransaction(String.format("0x%064x", txCounter.incrementAndGet()), blockNumber);
    }
}
