package com.drautomation.api.model.enums;

public enum RecoveryStepType {
    VALIDATION,
    DATABASE,
    FILES,
    SERVICE
}
