package com.drautomation.api.model.enums;

public enum RetentionTier {
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY,
    MANUAL
}
