package com.drautomation.api.model.enums;

public enum AutomationComponent {
    BACKUP,
    REPLICATION,
    RECOVERY_TESTING,
    DISASTER_RECOVERY,
    ERROR_HANDLING
}
