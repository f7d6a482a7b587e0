package com.drautomation.api.model.dto;

import com.drautomation.api.model.enums.HealthStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentHealth {

    private HealthStatus status;
    private Instant lastCheck;
    private String message;
    @Builder.Default
    private Map<String, Object> metrics = new LinkedHashMap<>();

    public static ComponentHealth of(HealthStatus status, String message, Instant at) {
        return ComponentHealth.builder()
                .status(status)
                .message(message)
                .lastCheck(at)
                .build();
    }
}
