package com.example.narrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SectionType {
    HOOK("Opening"),
    INTRODUCTION("Introduction"),
    MAIN_CONTENT("Main content"),
    SUMMARY("Summary"),
    CONCLUSION("Conclusion"),
    CALL_TO_ACTION("Call to action");

    private final String title;

    SectionType(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
