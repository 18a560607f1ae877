package com.pocketledger.receipt;

/**
 * A receipt as read back from storage.
 */
public record StoredReceipt(String key, String contentType, byte[] content) {
}
