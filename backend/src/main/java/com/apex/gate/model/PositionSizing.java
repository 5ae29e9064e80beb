package com.apex.gate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PositionSizing {
    FIXED_FRACTION,
    FIXED_SIZE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PositionSizing fromValue(String value) {
        return PositionSizing.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
