package com.pocketledger.exception;

/**
 * Transfer rejected: same source and destination, or a non-positive amount. Maps to 400.
 */
public class InvalidTransferException extends IllegalArgumentException {

    public InvalidTransferException(String message) {
        super(message);
    }
}
