package com.pocketledger.exception;

/**
 * The resource exists but belongs to another user. Maps to 403.
 *
 * Extends SecurityException like the ownership checks in the controllers;
 * not to be confused with Spring Security's AccessDeniedException, which is
 * raised by the filter chain and never reaches the controller advice.
 */
public class AccessDeniedException extends SecurityException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
