package com.drautomation.api.util;

import com.drautomation.api.model.entity.VerificationResult;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class VerificationResultConverter extends JsonAttributeConverter<VerificationResult> {

    public VerificationResultConverter() {
        super(new TypeReference<VerificationResult>() {});
    }

    @Override
    protected VerificationResult emptyValue() {
        return null;
    }
}
