package com.drautomation.api.model.entity;

import com.drautomation.api.model.enums.DisasterType;
import com.drautomation.api.model.enums.Severity;
import com.drautomation.api.util.StringListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DisasterEvent {

    @Column(name = "disaster_id", length = 60)
    private String disasterId;

    @Enumerated(EnumType.STRING)
    @Column(name = "disaster_type", length = 30)
    private DisasterType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "disaster_severity", length = 20)
    private Severity severity;

    @Column(name = "disaster_description", columnDefinition = "TEXT")
    private String description;

    @Convert(converter = StringListConverter.class)
    @Column(name = "affected_systems", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> affectedSystems = new ArrayList<>();

    @Column(name = "detected_at")
    private Instant detectedAt;

    @Column(name = "automatic")
    private boolean automatic;

    @Column(name = "estimated_impact", length = 500)
    private String estimatedImpact;
}
