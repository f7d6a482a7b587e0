package com.drautomation.api.client;

import java.util.Map;

/**
 * Application configuration captured by full and configuration backups.
 */
public interface ConfigurationSnapshotClient {

    Map<String, String> captureSnapshot();

    /**
     * Persists a captured snapshot so operators can re-apply it.
     *
     * @return location of the written snapshot
     */
    String restoreSnapshot(Map<String, String> snapshot, String backupId);
}
