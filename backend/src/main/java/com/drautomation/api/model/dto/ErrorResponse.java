package com.drautomation.api.model.dto;

import com.drautomation.api.model.entity.JobError;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
public class ErrorResponse {

    private String code;
    private String message;
    private String category;
    private boolean recoverable;
    private Instant occurredAt;

    /**
     * @return null when the job carries no error
     */
    public static ErrorResponse fromEntity(JobError error) {
        if (error == null || error.getCode() == null) {
            return null;
        }
        return ErrorResponse.builder()
                .code(error.getCode())
                .message(error.getMessage())
                .category(error.getCategory() != null ? error.getCategory().name() : null)
                .recoverable(Boolean.TRUE.equals(error.getRecoverable()))
                .occurredAt(error.getOccurredAt())
                .build();
    }
}
