package com.drautomation.api.model.entity;

import com.drautomation.api.model.enums.FrequencyType;
import com.drautomation.api.util.DayOfWeekListConverter;
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

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleFrequency {

    @Enumerated(EnumType.STRING)
    @Column(name = "frequency_type", length = 20)
    private FrequencyType type;

    // Weekly only; empty means Sunday
    @Convert(converter = DayOfWeekListConverter.class)
    @Column(name = "days_of_week", columnDefinition = "TEXT")
    @Builder.Default
    private List<DayOfWeek> daysOfWeek = new ArrayList<>();

    @Column(name = "day_of_month")
    private Integer dayOfMonth;

    @Column(name = "interval_hours")
    private Integer intervalHours;

    // Five fields: minute hour day-of-month month day-of-week
    @Column(name = "cron_expression", length = 100)
    private String cronExpression;
}
