package com.apex.gate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OrderType {
    MARKET,
    LIMIT;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OrderType fromValue(String value) {
        return OrderType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
