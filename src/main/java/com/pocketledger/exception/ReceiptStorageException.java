package com.pocketledger.exception;

/**
 * The object store failed to save, read or remove a receipt. Maps to 500.
 */
public class ReceiptStorageException extends RuntimeException {

    public ReceiptStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
