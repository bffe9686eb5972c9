package com.parichay.core.domain;

/**
 * Enumeration persisted and exchanged by a fixed lowercase wire value
 * rather than by its Java constant name.
 */
public interface WireEnum {

    String wireValue();

    static <E extends Enum<E> & WireEnum> E fromWire(Class<E> type, String value) {
        if (value == null) {
            return null;
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.wireValue().equalsIgnoreCase(value) || constant.name().equalsIgnoreCase(value)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " value: " + value);
    }
}
