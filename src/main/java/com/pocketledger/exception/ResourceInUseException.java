package com.pocketledger.exception;

/**
 * Deletion refused because transactions still reference the resource. Maps to 409.
 */
public class ResourceInUseException extends IllegalStateException {

    public ResourceInUseException(String message) {
        super(message);
    }
}
