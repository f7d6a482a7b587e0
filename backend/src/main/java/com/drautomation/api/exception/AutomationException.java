package com.drautomation.api.exception;

import com.drautomation.api.model.enums.ErrorCategory;
import lombok.Getter;

/**
 * Failure raised by the automation components, carrying a stable code and a category.
 */
@Getter
public class AutomationException extends RuntimeException {

    public static final String CODE_BACKUP_ERROR = "BACKUP_ERROR";
    public static final String CODE_RESTORE_ERROR = "RESTORE_ERROR";
    public static final String CODE_REPLICATION_ERROR = "REPLICATION_ERROR";
    public static final String CODE_RECOVERY_TEST_ERROR = "RECOVERY_TEST_ERROR";
    public static final String CODE_RECOVERY_STEP_FAILED = "RECOVERY_STEP_FAILED";
    public static final String CODE_NETWORK_ERROR = "NETWORK_ERROR";
    public static final String CODE_TIMEOUT = "TIMEOUT";
    public static final String CODE_STORAGE_FULL = "STORAGE_FULL";
    public static final String CODE_STORAGE_ERROR = "STORAGE_ERROR";
    public static final String CODE_SIZE_MISMATCH = "SIZE_MISMATCH";
    public static final String CODE_CHECKSUM_MISMATCH = "CHECKSUM_MISMATCH";
    public static final String CODE_VERIFICATION_FAILED = "VERIFICATION_FAILED";
    public static final String CODE_ENCRYPTION_ERROR = "ENCRYPTION_ERROR";
    public static final String CODE_PREREQUISITE_FAILED = "PREREQUISITE_FAILED";
    public static final String CODE_ARTIFACT_NOT_FOUND = "ARTIFACT_NOT_FOUND";
    public static final String CODE_CANCELLED = "CANCELLED";
    public static final String CODE_DISABLED = "FEATURE_DISABLED";

    private final String code;
    private final ErrorCategory category;

    public AutomationException(String code, ErrorCategory category, String message) {
        super(message);
        this.code = code;
        this.category = category;
    }

    public AutomationException(String code, ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.category = category;
    }

    public static AutomationException integrity(String code, String message) {
        return new AutomationException(code, ErrorCategory.INTEGRITY, message);
    }

    public static AutomationException validation(String code, String message) {
        return new AutomationException(code, ErrorCategory.VALIDATION, message);
    }

    public static AutomationException timeout(String message) {
        return new AutomationException(CODE_TIMEOUT, ErrorCategory.TIMEOUT, message);
    }
}
