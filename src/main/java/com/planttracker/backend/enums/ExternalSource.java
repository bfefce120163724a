package com.planttracker.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public enum ExternalSource {
    GIFT("gift", List.of("gift", "given")),
    TRADE("trade", List.of("trade", "swap", "exchange")),
    PURCHASE("purchase", List.of("purchase", "bought", "buy")),
    OTHER("other", List.of());

    private final String value;
    private final List<String> keywords;

    ExternalSource(String value, List<String> keywords) {
        this.value = value;
        this.keywords = keywords;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Maps free-text "Source" cells such as "Bought at farmers market" to a source.
     * Unknown text maps to OTHER.
     */
    public static ExternalSource detect(String sourceText) {
        if (sourceText == null || sourceText.trim().isEmpty()) {
            return OTHER;
        }
        String lower = sourceText.toLowerCase(Locale.ROOT);
        for (ExternalSource source : values()) {
            for (String keyword : source.keywords) {
                if (lower.contains(keyword)) {
                    return source;
                }
            }
        }
        return OTHER;
    }
}
