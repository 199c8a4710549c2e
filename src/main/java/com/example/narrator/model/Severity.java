package com.example.narrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    LOW(5),
    MEDIUM(10),
    HIGH(20),
    CRITICAL(30);

    private final int penalty;

    Severity(int penalty) {
        this.penalty = penalty;
    }

    public int penalty() {
        return penalty;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Severity fromValue(String value) {
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
