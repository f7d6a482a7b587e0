package com.drautomation.api.model.enums;

public enum RecoveryTestType {
    FULL,
    PARTIAL,
    SCHEMA_ONLY,
    DATA_ONLY
}
