package com.minerpayout.ledger;

import java.math.BigInteger;

/**
 * Plain value transfer handed to the node for signing and broadcast. Amounts in wei.
 */
public record TransactionRequest(
        String from,
        String to,
        BigInteger valueWei,
        long gasLimit,
        BigInteger gasPriceWei,
        long nonce
) {
}
