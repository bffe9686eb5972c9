package com.parichay.core.domain;

import jakarta.persistence.AttributeConverter;

/**
 * Base JPA converter storing a {@link WireEnum} as its wire value.
 */
public abstract class WireEnumConverter<E extends Enum<E> & WireEnum> implements AttributeConverter<E, String> {

    private final Class<E> type;

    protected WireEnumConverter(Class<E> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(E attribute) {
        return attribute == null ? null : attribute.wireValue();
    }

    @Override
    public E convertToEntityAttribute(String dbData) {
        return WireEnum.fromWire(type, dbData);
    }
}
