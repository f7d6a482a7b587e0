package com.drautomation.api.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {

    private String query;
    private boolean passed;
    private long executionTimeMs;
    private long rowCount;
    private String error;
}
