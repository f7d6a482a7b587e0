package com.drautomation.api.model.entity;

import com.drautomation.api.model.enums.ErrorCategory;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Classified failure recorded on a job.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobError {

    @Column(name = "error_code", length = 50)
    private String code;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_category", length = 20)
    private ErrorCategory category;

    @Column(name = "error_recoverable")
    private Boolean recoverable;

    @Column(name = "error_occurred_at")
    private Instant occurredAt;
}
