package com.planttracker.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictType {
    DUPLICATE_PLANT("duplicate_plant"),
    MISSING_PARENT("missing_parent"),
    INVALID_TAXONOMY("invalid_taxonomy");

    private final String value;

    ConflictType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
