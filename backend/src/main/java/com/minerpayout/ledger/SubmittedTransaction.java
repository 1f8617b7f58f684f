package com.minerpayout.ledger;

/**
 * Result of an accepted submission: transaction hash and the block height observed at submit time.
 */
public record SubmittedTransaction(String transactionHash, long blockReference) {
}
