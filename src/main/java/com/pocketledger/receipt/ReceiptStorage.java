package com.pocketledger.receipt;

import java.util.Optional;

/**
 * Binary object storage for transaction receipts.
 *
 * Keys are "{userId}/{transactionId}". Implementations wrap their client
 * failures in {@link com.pocketledger.exception.ReceiptStorageException}.
 */
public interface ReceiptStorage {

    void store(String key, String contentType, byte[] content);

    /**
     * @return empty when nothing is stored under the key
     */
    Optional<StoredReceipt> load(String key);

    /**
     * Remove the object. Removing a missing key is not an error.
     */
    void delete(String key);

    static String keyFor(Long userId, Long transactionId) {
        return userId + "/" + transactionId;
    }
}
