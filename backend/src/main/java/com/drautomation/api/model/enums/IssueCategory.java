package com.drautomation.api.model.enums;

public enum IssueCategory {
    RESTORE,
    VALIDATION,
    PERFORMANCE,
    INTEGRITY
}
