package com.planttracker.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a taxonomy import suggests when the exact taxonomy is already in the catalog
 */
public enum DuplicateHandling {
    SKIP("skip", SuggestedAction.SKIP),
    MERGE("merge", SuggestedAction.MERGE),
    CREATE_NEW("create_new", SuggestedAction.CREATE_NEW);

    private final String value;
    private final SuggestedAction suggestedAction;

    DuplicateHandling(String value, SuggestedAction suggestedAction) {
        this.value = value;
        this.suggestedAction = suggestedAction;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public SuggestedAction toSuggestedAction() {
        return suggestedAction;
    }

    @JsonCreator
    public static DuplicateHandling fromValue(String raw) {
        for (DuplicateHandling handling : values()) {
            if (handling.value.equalsIgnoreCase(raw) || handling.name().equalsIgnoreCase(raw)) {
                return handling;
            }
        }
        throw new IllegalArgumentException("Invalid duplicate handling: " + raw);
    }
}
