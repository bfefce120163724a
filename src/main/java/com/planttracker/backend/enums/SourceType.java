package com.planttracker.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceType {
    INTERNAL("internal"),
    EXTERNAL("external");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
