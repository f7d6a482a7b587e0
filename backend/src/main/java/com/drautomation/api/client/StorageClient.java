package com.drautomation.api.client;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Object storage addressed by region, bucket and key.
 */
public interface StorageClient {

    boolean isConfigured();

    /**
     * Make sure the bucket exists and is reachable, creating it when missing.
     */
    void ensureBucket(String region, String bucket);

    void putObject(String region, String bucket, String key, byte[] data);

    /**
     * @return object content, or {@code null} when the key does not exist
     */
    byte[] getObject(String region, String bucket, String key);

    /**
     * @return object size in bytes, or -1 when the key does not exist
     */
    long getObjectSize(String region, String bucket, String key);

    void copyObject(String sourceRegion, String sourceBucket, String sourceKey,
                    String targetRegion, String targetBucket, String targetKey);

    List<StoredObject> listObjects(String region, String bucket, String prefix);

    void deleteObject(String region, String bucket, String key);

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class StoredObject {
        private String key;
        private long size;
        private Instant lastModified;
    }
}
