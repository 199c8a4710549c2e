package com.example.narrator.model;

public enum ElementRole {
    TITLE,
    BODY,
    TEXTBOX,
    PICTURE,
    OTHER
}
