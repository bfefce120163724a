package com.planttracker.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ImportType {
    PLANT_TAXONOMY("plant_taxonomy", "Plant taxonomy"),
    PLANT_INSTANCES("plant_instances", "Plant instances"),
    PROPAGATIONS("propagations", "Propagations");

    private final String value;
    private final String displayName;

    ImportType(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Accepts the wire value ("plant_taxonomy") or the constant name, case-insensitive
     */
    @JsonCreator
    public static ImportType fromValue(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("Import type is required");
        }
        String normalized = raw.trim();
        for (ImportType type : values()) {
            if (type.value.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported import type: " + raw);
    }
}
