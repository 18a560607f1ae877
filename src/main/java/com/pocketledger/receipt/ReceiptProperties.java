package com.pocketledger.receipt;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Receipt bucket settings ({@code pocketledger.receipts.*}).
 *
 * endpoint is optional and points the client at an S3-compatible service;
 * blank credentials fall back to the SDK's default provider chain.
 */
@ConfigurationProperties(prefix = "pocketledger.receipts")
public record ReceiptProperties(
        String bucket,
        String endpoint,
        String region,
        String accessKeyId,
        String secretAccessKey,
        boolean pathStyleAccess) {
}
