package com.drautomation.api.util;

import com.drautomation.api.model.entity.StepExecution;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class StepExecutionListConverter extends JsonAttributeConverter<List<StepExecution>> {

    public StepExecutionListConverter() {
        super(new TypeReference<List<StepExecution>>() {});
    }

    @Override
    protected List<StepExecution> emptyValue() {
        return new ArrayList<>();
    }
}
