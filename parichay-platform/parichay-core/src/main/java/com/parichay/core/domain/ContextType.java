package com.parichay.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.Converter;

/**
 * Real-world subject a conversation is attached to.
 */
public enum ContextType implements WireEnum {
    MARRIAGE("marriage"),
    JOB("job"),
    BUSINESS("business"),
    HELP("help"),
    GENERAL("general");

    private final String wireValue;

    ContextType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    @Override
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ContextType fromWire(String value) {
        return WireEnum.fromWire(ContextType.class, value);
    }

    @Converter
    public static class JpaConverter extends WireEnumConverter<ContextType> {
        public JpaConverter() {
            super(ContextType.class);
        }
    }
}
