package com.planttracker.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DateFormatPreference {
    AUTO("auto"),
    MONTH_DAY_YEAR("MM/DD/YYYY"),
    DAY_MONTH_YEAR("DD/MM/YYYY"),
    ISO("YYYY-MM-DD");

    private final String pattern;

    DateFormatPreference(String pattern) {
        this.pattern = pattern;
    }

    @JsonValue
    public String getPattern() {
        return pattern;
    }

    @JsonCreator
    public static DateFormatPreference fromValue(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return AUTO;
        }
        for (DateFormatPreference preference : values()) {
            if (preference.pattern.equalsIgnoreCase(raw.trim()) || preference.name().equalsIgnoreCase(raw.trim())) {
                return preference;
            }
        }
        throw new IllegalArgumentException("Unsupported date format: " + raw);
    }
}
