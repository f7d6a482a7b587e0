package com.drautomation.api.model.enums;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
