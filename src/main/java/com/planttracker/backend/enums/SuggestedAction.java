package com.planttracker.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SuggestedAction {
    SKIP("skip"),
    MERGE("merge"),
    CREATE_NEW("create_new"),
    MANUAL_REVIEW("manual_review");

    private final String value;

    SuggestedAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SuggestedAction fromValue(String raw) {
        for (SuggestedAction action : values()) {
            if (action.value.equalsIgnoreCase(raw) || action.name().equalsIgnoreCase(raw)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Invalid resolution action: " + raw);
    }
}
