package com.drautomation.api.model.dto;

import com.drautomation.api.model.enums.DisasterType;
import com.drautomation.api.model.enums.Severity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
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
public class DisasterRecoveryRequest {

    @NotNull(message = "Disaster type is required")
    private DisasterType type;

    @NotBlank(message = "Description is required")
    private String description;

    @Builder.Default
    private List<String> affectedSystems = new ArrayList<>();

    /**
     * Defaults to CRITICAL.
     */
    private Severity severity;
}
