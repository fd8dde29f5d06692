package com.nevis.pdfscan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kinds of sensitive data a scanner can report. New kinds are added here.
 */
public enum FindingType {
    SSN("ssn"),
    EMAIL("email");

    private final String value;

    FindingType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static FindingType fromValue(String value) {
        return Arrays.stream(values())
            .filter(type -> type.value.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown finding type: " + value));
    }
}
