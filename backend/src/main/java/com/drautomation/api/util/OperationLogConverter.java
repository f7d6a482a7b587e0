package com.drautomation.api.util;

import com.drautomation.api.model.entity.OperationLogEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class OperationLogConverter extends JsonAttributeConverter<List<OperationLogEntry>> {

    public OperationLogConverter() {
        super(new TypeReference<List<OperationLogEntry>>() {});
    }

    @Override
    protected List<OperationLogEntry> emptyValue() {
        return new ArrayList<>();
    }
}
