package com.drautomation.api.util;

import com.drautomation.api.model.entity.ValidationResult;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class ValidationResultListConverter extends JsonAttributeConverter<List<ValidationResult>> {

    public ValidationResultListConverter() {
        super(new TypeReference<List<ValidationResult>>() {});
    }

    @Override
    protected List<ValidationResult> emptyValue() {
        return new ArrayList<>();
    }
}
