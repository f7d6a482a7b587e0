package com.drautomation.api.model.dto;

import com.drautomation.api.model.entity.SystemAlert;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
public class AlertResponse {

    private String id;
    private String severity;
    private String component;
    private String message;
    private boolean acknowledged;
    private boolean resolved;
    private Instant createdAt;
    private Instant acknowledgedAt;
    private Instant resolvedAt;

    public static AlertResponse fromEntity(SystemAlert alert) {
        return AlertResponse.builder()
                .id(alert.getId())
                .severity(alert.getSeverity().name())
                .component(alert.getComponent().name())
                .message(alert.getMessage())
                .acknowledged(alert.isAcknowledged())
                .resolved(!alert.isOpen())
                .createdAt(alert.getCreatedAt())
                .acknowledgedAt(alert.getAcknowledgedAt())
                .resolvedAt(alert.getResolvedAt())
                .build();
    }
}
