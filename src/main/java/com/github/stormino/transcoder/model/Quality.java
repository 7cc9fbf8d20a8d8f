package com.github.stormino.transcoder.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Requested quality tier, mapped onto the variants a playlist offers.
 */
public enum Quality {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    Quality(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Quality fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Quality quality : values()) {
                if (quality.value.equals(normalized)) {
                    return quality;
                }
            }
        }
        throw new IllegalArgumentException("Unknown quality: " + value + " (expected high, medium or low)");
    }
}
