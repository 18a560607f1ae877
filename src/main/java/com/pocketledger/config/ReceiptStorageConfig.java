package com.pocketledger.config;

import com.pocketledger.receipt.ReceiptProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

/**
 * Builds the process-wide S3 client used for receipts.
 *
 * The client is created once at startup and injected; it is closed with the context.
 */
@Configuration
@EnableConfigurationProperties(ReceiptProperties.class)
public class ReceiptStorageConfig {

    @Bean(destroyMethod = "close")
    public S3Client receiptS3Client(ReceiptProperties properties) {
        var builder = S3Client.builder()
                .region(Region.of(StringUtils.hasText(properties.region()) ? properties.region() : "us-east-1"))
                .credentialsProvider(credentials(properties))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(properties.pathStyleAccess())
                        .build());

        if (StringUtils.hasText(properties.endpoint())) {
            builder.endpointOverride(URI.create(properties.endpoint()));
        }
        return builder.build();
    }

    private AwsCredentialsProvider credentials(ReceiptProperties properties) {
        if (StringUtils.hasText(properties.accessKeyId()) && StringUtils.hasText(properties.secretAccessKey())) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(properties.accessKeyId(), properties.secretAccessKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
