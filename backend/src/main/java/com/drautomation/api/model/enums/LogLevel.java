package com.drautomation.api.model.enums;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
