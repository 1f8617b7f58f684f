package com.minerpayout.ledger;

/**
 * The node rejected a transaction, or it could not be delivered. Recoverable: the payout
 * engine credits the reserved amount back when this is thrown.
 */
public class SubmissionException extends RuntimeException {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
