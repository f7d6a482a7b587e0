package com.drautomation.api.model.entity;

import com.drautomation.api.model.enums.IssueCategory;
import com.drautomation.api.model.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestIssue {

    private Severity severity;
    private IssueCategory category;
    private String message;
    private String details;
    private String recommendation;
}
