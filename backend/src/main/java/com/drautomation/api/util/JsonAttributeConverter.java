package com.drautomation.api.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.persistence.AttributeConverter;
import lombok.extern.slf4j.Slf4j;

/**
 * Base JPA converter storing a value as JSON in a TEXT column.
 * Subclasses fix the value type and the value used for SQL NULL.
 */
@Slf4j
public abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {

    protected static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final TypeReference<T> typeReference;

    protected JsonAttributeConverter(TypeReference<T> typeReference) {
        this.typeReference = typeReference;
    }

    /**
     * Value returned for a NULL or unreadable column.
     */
    protected abstract T emptyValue();

    @Override
    public String convertToDatabaseColumn(T attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize attribute to JSON: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return emptyValue();
        }
        try {
            return OBJECT_MAPPER.readValue(dbData, typeReference);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON column: {}", e.getOriginalMessage());
            return emptyValue();
        }
    }
}
