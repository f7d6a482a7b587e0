package com.drautomation.api.model.enums;

public enum DisasterType {
    DATABASE_FAILURE,
    STORAGE_FAILURE,
    SERVICE_OUTAGE,
    DATA_CORRUPTION,
    SECURITY_BREACH,
    SYSTEM_FAILURE
}
