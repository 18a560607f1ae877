package com.pocketledger.exception;

import java.util.NoSuchElementException;

/**
 * No resource with the given id exists at all. Maps to 404.
 */
public class ResourceNotFoundException extends NoSuchElementException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException of(String resource, Object id) {
        return new ResourceNotFoundException(resource + " not found: " + id);
    }
}
