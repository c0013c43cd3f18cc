package com.guardian.rag.evaluation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SafetyLevel {
    SAFE("safe"),
    NOT_SAFE("not safe");

    private final String value;

    SafetyLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Strict lookup by wire value; anything but the two exact strings is rejected.
     */
    @JsonCreator
    public static SafetyLevel fromValue(String value) {
        for (SafetyLevel level : values()) {
            if (level.value.equals(value)) return level;
        }
        throw new IllegalArgumentException("Unknown safety_level: " + value);
    }
}
