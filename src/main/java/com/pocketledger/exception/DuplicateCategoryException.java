package com.pocketledger.exception;

/**
 * A category with the same name already exists for this user. Maps to 409.
 */
public class DuplicateCategoryException extends IllegalStateException {

    public DuplicateCategoryException(String name) {
        super("Category already exists: " + name);
    }
}
