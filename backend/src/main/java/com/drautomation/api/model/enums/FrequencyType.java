package com.drautomation.api.model.enums;

public enum FrequencyType {
    DAILY,
    WEEKLY,
    MONTHLY,
    CUSTOM
}
