package com.drautomation.api.util;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * JPA converter for storing List&lt;String&gt; as JSON in a TEXT column.
 */
@Converter
public class StringListConverter extends JsonAttributeConverter<List<String>> {

    public StringListConverter() {
        super(new TypeReference<List<String>>() {});
    }

    @Override
    protected List<String> emptyValue() {
        return new ArrayList<>();
    }
}
