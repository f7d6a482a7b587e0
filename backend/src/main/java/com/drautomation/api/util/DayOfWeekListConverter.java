package com.drautomation.api.util;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;

@Converter
public class DayOfWeekListConverter extends JsonAttributeConverter<List<DayOfWeek>> {

    public DayOfWeekListConverter() {
        super(new TypeReference<List<DayOfWeek>>() {});
    }

    @Override
    protected List<DayOfWeek> emptyValue() {
        return new ArrayList<>();
    }
}
