package com.minerpayout.ledger;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Read/write view of the chain used by the payout engine.
 * Reads may block on network round-trips; callers must not hold locks across them.
 */
public interface LedgerClient {

    /**
     * Current network gas price in wei.
     */
    BigInteger getCurrentGasPrice();

    boolean isValidAddress(String address);

    /**
     * Native balance of the address in whole units (ether), scale 18.
     */
    BigDecimal getBalance(String address);

    /**
     * Next nonce for the address, including pending transactions.
     */
    long getTransactionCount(String address);

    long getCurrentBlockReference();

    /**
     * Submit a transfer. Not retried: a second attempt could double-spend.
     *
     * @throws SubmissionException when the node rejects the transaction or cannot be reached
     */
    SubmittedTransaction submitTransaction(TransactionRequest request);
}
