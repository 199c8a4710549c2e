package com.example.narrator.util;

import java.util.Locale;

public enum SourceType {
    TEXT,
    URL,
    DOCUMENT;

    public static SourceType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return URL;
        }
        return SourceType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
