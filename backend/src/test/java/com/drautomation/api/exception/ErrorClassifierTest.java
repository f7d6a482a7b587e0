package com.drautomation.api.exception;

import com.drautomation.api.model.entity.JobError;
import com.drautomation.api.model.enums.ErrorCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.web.client.ResourceAccessException;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.nio.file.FileSystemException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ErrorClassifier")
class ErrorClassifierTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    private final ErrorClassifier classifier = new ErrorClassifier(Clock.fixed(NOW, ZoneOffset.UTC));

    private JobError classify(Throwable error) {
        return classifier.classify(error, AutomationException.CODE_BACKUP_ERROR);
    }

    private static S3Exception s3Error(int status, String awsCode) {
        return (S3Exception) S3Exception.builder()
                .statusCode(status)
                .message("s3 failure")
                .awsErrorDetails(AwsErrorDetails.builder().errorCode(awsCode).build())
                .build();
    }

    @Nested
    @DisplayName("recoverable failures")
    class Recoverable {

        @Test
        @DisplayName("should classify timeouts")
        void shouldClassifyTimeout() {
            JobError error = classify(new TimeoutException("took too long"));

            assertThat(error.getCode()).isEqualTo(AutomationException.CODE_TIMEOUT);
            assertThat(error.getCategory()).isEqualTo(ErrorCategory.TIMEOUT);
            assertThat(error.getRecoverable()).isTrue();
            assertThat(error.getOccurredAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("should classify connectivity failures as network errors")
        void shouldClassifyNetwork() {
            assertThat(classify(SdkClientException.create("Unable to execute HTTP request")).getCode())
                    .isEqualTo(AutomationException.CODE_NETWORK_ERROR);
            assertThat(classify(new ResourceAccessException("Connection refused")).getCategory())
                    .isEqualTo(ErrorCategory.NETWORK);
            assertThat(classify(new DataAccessResourceFailureException("no connection")).getRecoverable())
                    .isTrue();
        }

        @Test
        @DisplayName("should classify quota and insufficient storage as storage full")
        void shouldClassifyStorageFull() {
            assertThat(classify(s3Error(507, "InsufficientStorage")).getCode())
                    .isEqualTo(AutomationException.CODE_STORAGE_FULL);
            assertThat(classify(s3Error(403, "QuotaExceeded")).getCode())
                    .isEqualTo(AutomationException.CODE_STORAGE_FULL);
            assertThat(classify(new FileSystemException("/backups", null, "No space left on device")).getRecoverable())
                    .isTrue();
        }

        @Test
        @DisplayName("should unwrap async wrappers before classifying")
        void shouldUnwrap() {
            Throwable wrapped = new CompletionException(new ExecutionException(new TimeoutException("late")));

            JobError error = classify(wrapped);

            assertThat(error.getCode()).isEqualTo(AutomationException.CODE_TIMEOUT);
            assertThat(error.getMessage()).isEqualTo("late");
        }
    }

    @Nested
    @DisplayName("non-recoverable failures")
    class NonRecoverable {

        @Test
        @DisplayName("should keep the code and category of automation exceptions")
        void shouldKeepAutomationCode() {
            JobError error = classify(AutomationException.integrity(AutomationException.CODE_CHECKSUM_MISMATCH,
                    "checksum differs"));

            assertThat(error.getCode()).isEqualTo(AutomationException.CODE_CHECKSUM_MISMATCH);
            assertThat(error.getCategory()).isEqualTo(ErrorCategory.INTEGRITY);
            assertThat(error.getRecoverable()).isFalse();
        }

        @Test
        @DisplayName("should split other storage errors by status")
        void shouldClassifyStorageErrors() {
            JobError server = classify(s3Error(503, "SlowDown"));
            JobError client = classify(s3Error(404, "NoSuchKey"));

            assertThat(server.getCode()).isEqualTo(AutomationException.CODE_STORAGE_ERROR);
            assertThat(server.getCategory()).isEqualTo(ErrorCategory.SERVER);
            assertThat(client.getCategory()).isEqualTo(ErrorCategory.CLIENT);
            assertThat(client.getRecoverable()).isFalse();
        }

        @Test
        @DisplayName("should mark bad arguments as validation errors under the default code")
        void shouldClassifyValidation() {
            JobError error = classify(new IllegalArgumentException("bad table name"));

            assertThat(error.getCode()).isEqualTo(AutomationException.CODE_BACKUP_ERROR);
            assertThat(error.getCategory()).isEqualTo(ErrorCategory.VALIDATION);
        }

        @Test
        @DisplayName("should fall back to the exception type when there is no message")
        void shouldDescribeByType() {
            JobError error = classify(new NullPointerException());

            assertThat(error.getMessage()).isEqualTo("NullPointerException");
            assertThat(error.getCategory()).isEqualTo(ErrorCategory.INTERNAL);
            assertThat(classifier.isRecoverable(new NullPointerException())).isFalse();
        }
    }
}
