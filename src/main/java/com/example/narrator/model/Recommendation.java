package com.example.narrator.model;

public enum Recommendation {
    APPROVE,
    REVISE,
    REJECT
}
