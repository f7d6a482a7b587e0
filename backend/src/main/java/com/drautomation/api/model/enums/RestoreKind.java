package com.drautomation.api.model.enums;

public enum RestoreKind {
    COMPLETE,
    PARTIAL,
    POINT_IN_TIME,
    TEST,
    CLONE
}
