package com.planttracker.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorSeverity {
    ERROR("error"),
    WARNING("warning");

    private final String value;

    ErrorSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
