package com.drautomation.api.model.enums;

/**
 * What a backup captures.
 * Incremental backups hold changes since the last successful backup of any kind,
 * differential backups hold changes since the last successful full backup.
 */
public enum BackupKind {
    FULL,
    INCREMENTAL,
    DIFFERENTIAL,
    SCHEMA,
    DATA,
    FILES,
    CONFIGURATION;

    public boolean includesSchema() {
        return this == FULL || this == SCHEMA;
    }

    public boolean includesData() {
        return this == FULL || this == DATA;
    }

    public boolean includesFiles() {
        return this == FULL || this == FILES;
    }

    public boolean includesConfiguration() {
        return this == FULL || this == CONFIGURATION;
    }

    public boolean isChangeSet() {
        return this == INCREMENTAL || this == DIFFERENTIAL;
    }
}
