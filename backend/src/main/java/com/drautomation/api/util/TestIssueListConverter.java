package com.drautomation.api.util;

import com.drautomation.api.model.entity.TestIssue;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class TestIssueListConverter extends JsonAttributeConverter<List<TestIssue>> {

    public TestIssueListConverter() {
        super(new TypeReference<List<TestIssue>>() {});
    }

    @Override
    protected List<TestIssue> emptyValue() {
        return new ArrayList<>();
    }
}
