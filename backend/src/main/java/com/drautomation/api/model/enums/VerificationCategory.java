package com.drautomation.api.model.enums;

public enum VerificationCategory {
    INTEGRITY,
    DATA_VALIDATION,
    CHECKSUM,
    CONNECTION
}
