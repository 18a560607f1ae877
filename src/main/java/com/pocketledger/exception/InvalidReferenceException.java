package com.pocketledger.exception;

/**
 * An account or category referenced by a request does not belong to the caller
 * (or does not exist). Raised before any mutation. Maps to 400.
 */
public class InvalidReferenceException extends IllegalArgumentException {

    public InvalidReferenceException(String message) {
        super(message);
    }

    public static InvalidReferenceException account(Long accountId) {
        return new InvalidReferenceException("Account not found or not owned by user: " + accountId);
    }

    public static InvalidReferenceException category(Long categoryId) {
        return new InvalidReferenceException("Category not found or not owned by user: " + categoryId);
    }
}
