package com.parichay.core.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Serializes {@link EvidencePayload} to its JSON column.
 */
@Converter
public class EvidencePayloadConverter implements AttributeConverter<EvidencePayload, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(EvidencePayload attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize evidence payload", e);
        }
    }

    @Override
    public EvidencePayload convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(dbData, EvidencePayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored evidence payload is not readable", e);
        }
    }
}
