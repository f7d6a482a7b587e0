package com.drautomation.api.model.dto;

import com.drautomation.api.model.enums.RecoveryTestType;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryTestRequest {

    @NotBlank(message = "Backup id is required")
    private String backupId;

    @Builder.Default
    private RecoveryTestType testType = RecoveryTestType.FULL;

    /**
     * Tables restored by a PARTIAL test. Required for that type, ignored otherwise.
     */
    @Builder.Default
    private List<String> selectedTables = new ArrayList<>();

    /**
     * Extra validation queries run after the configured ones.
     */
    @Builder.Default
    private List<String> customValidations = new ArrayList<>();
}
