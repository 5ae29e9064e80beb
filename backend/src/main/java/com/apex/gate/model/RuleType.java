package com.apex.gate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RuleType {
    ENTRY,
    EXIT;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RuleType fromValue(String value) {
        return RuleType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
