package com.example.narrator.model;

public enum JobStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
