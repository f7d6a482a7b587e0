package com.drautomation.api.client;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.*;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * S3-compatible storage with one client per region.
 * Without static credentials the default AWS provider chain is used.
 */
@Slf4j
@Component
public class S3StorageClient implements StorageClient {

    @Value("${storage.s3.enabled:true}")
    private boolean enabled;

    @Value("${storage.s3.endpoint:}")
    private String endpoint;

    @Value("${storage.s3.access-key:}")
    private String accessKey;

    @Value("${storage.s3.secret-key:}")
    private String secretKey;

    @Value("${storage.s3.path-style:true}")
    private boolean pathStyle;

    private final Map<String, S3Client> clients = new ConcurrentHashMap<>();

    @PreDestroy
    public void cleanup() {
        clients.forEach((region, client) -> {
            try {
                client.close();
                log.debug("S3 client closed for region {}", region);
            } catch (Exception e) {
                log.warn("Error closing S3 client for region {}: {}", region, e.getMessage());
            }
        });
        clients.clear();
    }

    @Override
    public boolean isConfigured() {
        return enabled;
    }

    @Override
    public void ensureBucket(String region, String bucket) {
        S3Client client = clientFor(region);
        try {
            client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
        } catch (NoSuchBucketException e) {
            log.info("Creating bucket {} in region {}", bucket, region);
            client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
        } catch (S3Exception e) {
            if (e.statusCode() != 404) {
                log.error("Failed to check bucket {} in region {}: {}", bucket, region, e.getMessage());
                throw e;
            }
            log.info("Creating bucket {} in region {}", bucket, region);
            client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
        }
    }

    @Override
    public void putObject(String region, String bucket, String key, byte[] data) {
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType("application/octet-stream")
                    .build();

            clientFor(region).putObject(request, RequestBody.fromBytes(data));
            log.debug("Uploaded {} bytes to s3://{}/{} ({})", data.length, bucket, key, region);
        } catch (SdkException e) {
            log.error("Failed to upload s3://{}/{} ({}): {}", bucket, key, region, e.getMessage());
            throw e;
        }
    }

    @Override
    public byte[] getObject(String region, String bucket, String key) {
        try {
            GetObjectRequest request = GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build();

            return clientFor(region).getObjectAsBytes(request).asByteArray();
        } catch (NoSuchKeyException e) {
            log.warn("Object not found: s3://{}/{} ({})", bucket, key, region);
            return null;
        } catch (SdkException e) {
            log.error("Failed to download s3://{}/{} ({}): {}", bucket, key, region, e.getMessage());
            throw e;
        }
    }

    @Override
    public long getObjectSize(String region, String bucket, String key) {
        try {
            HeadObjectRequest request = HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build();

            return clientFor(region).headObject(request).contentLength();
        } catch (NoSuchKeyException e) {
            return -1;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return -1;
            }
            log.error("Failed to head s3://{}/{} ({}): {}", bucket, key, region, e.getMessage());
            throw e;
        }
    }

    @Override
    public void copyObject(String sourceRegion, String sourceBucket, String sourceKey,
                           String targetRegion, String targetBucket, String targetKey) {
        try {
            CopyObjectRequest request = CopyObjectRequest.builder()
                    .sourceBucket(sourceBucket)
                    .sourceKey(sourceKey)
                    .destinationBucket(targetBucket)
                    .destinationKey(targetKey)
                    .build();

            // The destination region's client performs the copy
            clientFor(targetRegion).copyObject(request);
            log.debug("Copied s3://{}/{} ({}) -> s3://{}/{} ({})",
                    sourceBucket, sourceKey, sourceRegion, targetBucket, targetKey, targetRegion);
        } catch (SdkException e) {
            log.error("Failed to copy {} to region {}: {}", sourceKey, targetRegion, e.getMessage());
            throw e;
        }
    }

    @Override
    public List<StoredObject> listObjects(String region, String bucket, String prefix) {
        try {
            ListObjectsV2Request request = ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(prefix)
                    .build();

            return clientFor(region).listObjectsV2Paginator(request).contents().stream()
                    .map(o -> new StoredObject(o.key(), o.size(), o.lastModified()))
                    .collect(Collectors.toList());
        } catch (SdkException e) {
            log.error("Failed to list s3://{}/{} ({}): {}", bucket, prefix, region, e.getMessage());
            throw e;
        }
    }

    @Override
    public void deleteObject(String region, String bucket, String key) {
        try {
            DeleteObjectRequest request = DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build();

            clientFor(region).deleteObject(request);
            log.debug("Deleted s3://{}/{} ({})", bucket, key, region);
        } catch (SdkException e) {
            log.error("Failed to delete s3://{}/{} ({}): {}", bucket, key, region, e.getMessage());
            throw e;
        }
    }

    private S3Client clientFor(String region) {
        checkConfigured();
        return clients.computeIfAbsent(region, this::buildClient);
    }

    private S3Client buildClient(String region) {
        S3ClientBuilder builder = S3Client.builder()
                .credentialsProvider(credentialsProvider())
                .region(Region.of(region))
                .forcePathStyle(pathStyle);
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }
        log.info("S3 client initialized for region {}{}", region,
                endpoint != null && !endpoint.isBlank() ? " with endpoint " + endpoint : "");
        return builder.build();
    }

    private AwsCredentialsProvider credentialsProvider() {
        if (accessKey != null && !accessKey.isBlank() && secretKey != null && !secretKey.isBlank()) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        }
        return DefaultCredentialsProvider.create();
    }

    private void checkConfigured() {
        if (!enabled) {
            throw new IllegalStateException("S3 storage is disabled. Set storage.s3.enabled=true to use backups.");
        }
    }
}
