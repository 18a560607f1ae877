package com.pocketledger.exception;

/**
 * The store aborted a multi-step ledger mutation. The whole unit was rolled
 * back, so no partial balance change is visible. Maps to a generic 500.
 */
public class AtomicityFailureException extends RuntimeException {

    public AtomicityFailureException(String message) {
        super(message);
    }

    public AtomicityFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
