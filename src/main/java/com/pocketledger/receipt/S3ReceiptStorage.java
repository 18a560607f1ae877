package com.pocketledger.receipt;

import com.pocketledger.exception.ReceiptStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.util.Optional;

/**
 * {@link ReceiptStorage} backed by an S3 bucket (AWS or any S3-compatible store).
 *
 * Calls are blocking and bounded by the client's own timeouts.
 */
@Component
public class S3ReceiptStorage implements ReceiptStorage {

    private static final Logger log = LoggerFactory.getLogger(S3ReceiptStorage.class);

    private final S3Client s3Client;
    private final String bucket;

    public S3ReceiptStorage(S3Client s3Client, ReceiptProperties properties) {
        this.s3Client = s3Client;
        this.bucket = properties.bucket();
    }

    @Override
    public void store(String key, String contentType, byte[] content) {
        try {
            s3Client.putObject(
                    PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(contentType)
                            .contentLength((long) content.length)
                            .build(),
                    RequestBody.fromBytes(content));
            log.info("Receipt stored - bucket={}, key={}, bytes={}", bucket, key, content.length);
        } catch (SdkException e) {
            log.error("Receipt upload failed - bucket={}, key={}", bucket, key, e);
            throw new ReceiptStorageException("Failed to store receipt " + key, e);
        }
    }

    @Override
    public Optional<StoredReceipt> load(String key) {
        try {
            ResponseBytes<GetObjectResponse> object = s3Client.getObjectAsBytes(
                    GetObjectRequest.builder().bucket(bucket).key(key).build());
            return Optional.of(new StoredReceipt(key, object.response().contentType(), object.asByteArray()));
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (SdkException e) {
            log.error("Receipt download failed - bucket={}, key={}", bucket, key, e);
            throw new ReceiptStorageException("Failed to load receipt " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
            log.info("Receipt deleted - bucket={}, key={}", bucket, key);
        } catch (SdkException e) {
            log.error("Receipt delete failed - bucket={}, key={}", bucket, key, e);
            throw new ReceiptStorageException("Failed to delete receipt " + key, e);
        }
    }
}
