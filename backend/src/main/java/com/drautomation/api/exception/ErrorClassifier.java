package com.drautomation.api.exception;

import com.drautomation.api.model.entity.JobError;
import com.drautomation.api.model.enums.ErrorCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.nio.file.FileSystemException;
import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps any failure to a {@link JobError}. Only network, timeout and storage-full failures are
 * marked recoverable.
 */
@Component
@RequiredArgsConstructor
public class ErrorClassifier {

    public static final Set<String> RECOVERABLE_CODES = Set.of(
            AutomationException.CODE_NETWORK_ERROR,
            AutomationException.CODE_TIMEOUT,
            AutomationException.CODE_STORAGE_FULL);

    private static final int HTTP_INSUFFICIENT_STORAGE = 507;

    private final Clock clock;

    public JobError classify(Throwable error, String defaultCode) {
        Throwable cause = unwrap(error);
        String code = defaultCode;
        ErrorCategory category = ErrorCategory.INTERNAL;

        if (cause instanceof AutomationException) {
            AutomationException ae = (AutomationException) cause;
            code = ae.getCode();
            category = ae.getCategory();
        } else if (cause instanceof TimeoutException || cause instanceof QueryTimeoutException) {
            code = AutomationException.CODE_TIMEOUT;
            category = ErrorCategory.TIMEOUT;
        } else if (cause instanceof S3Exception) {
            int status = ((S3Exception) cause).statusCode();
            if (status == HTTP_INSUFFICIENT_STORAGE || isQuotaError((S3Exception) cause)) {
                code = AutomationException.CODE_STORAGE_FULL;
                category = ErrorCategory.SERVER;
            } else if (status >= 500) {
                code = AutomationException.CODE_STORAGE_ERROR;
                category = ErrorCategory.SERVER;
            } else {
                code = AutomationException.CODE_STORAGE_ERROR;
                category = ErrorCategory.CLIENT;
            }
        } else if (cause instanceof SdkClientException
                || cause instanceof ResourceAccessException
                || cause instanceof DataAccessResourceFailureException) {
            code = AutomationException.CODE_NETWORK_ERROR;
            category = ErrorCategory.NETWORK;
        } else if (cause instanceof FileSystemException && isDiskFull(cause)) {
            code = AutomationException.CODE_STORAGE_FULL;
            category = ErrorCategory.SERVER;
        } else if (cause instanceof IllegalArgumentException) {
            category = ErrorCategory.VALIDATION;
        }

        return JobError.builder()
                .code(code)
                .message(describe(cause))
                .category(category)
                .recoverable(RECOVERABLE_CODES.contains(code))
                .occurredAt(Instant.now(clock))
                .build();
    }

    public boolean isRecoverable(Throwable error) {
        return Boolean.TRUE.equals(classify(error, AutomationException.CODE_BACKUP_ERROR).getRecoverable());
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private boolean isQuotaError(S3Exception e) {
        if (e.awsErrorDetails() == null || e.awsErrorDetails().errorCode() == null) {
            return false;
        }
        String awsCode = e.awsErrorDetails().errorCode();
        return "QuotaExceeded".equals(awsCode) || "InsufficientStorage".equals(awsCode);
    }

    private boolean isDiskFull(Throwable e) {
        return e.getMessage() != null && e.getMessage().contains("No space left");
    }

    private String describe(Throwable cause) {
        if (cause.getMessage() != null && !cause.getMessage().isBlank()) {
            return cause.getMessage();
        }
        return cause.getClass().getSimpleName();
    }
}
