package com.drautomation.api.model.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * How many backups of each tier to keep, plus age and total-size ceilings.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetentionPolicy {

    @Column(name = "keep_daily")
    @Builder.Default
    private int keepDaily = 7;

    @Column(name = "keep_weekly")
    @Builder.Default
    private int keepWeekly = 4;

    @Column(name = "keep_monthly")
    @Builder.Default
    private int keepMonthly = 12;

    @Column(name = "keep_yearly")
    @Builder.Default
    private int keepYearly = 3;

    @Column(name = "max_age_days")
    @Builder.Default
    private int maxAgeDays = 365;

    @Column(name = "max_size_bytes")
    @Builder.Default
    private long maxSizeBytes = 100L * 1024 * 1024 * 1024;
}
