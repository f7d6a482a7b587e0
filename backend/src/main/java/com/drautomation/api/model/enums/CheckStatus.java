package com.drautomation.api.model.enums;

public enum CheckStatus {
    PASSED,
    FAILED,
    WARNING
}
