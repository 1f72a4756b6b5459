package com.fitcoach.backend.resolution.model;

public enum RecordKind {
    ASSIGNMENT,
    PROGRAM,
    WORKOUT,
    NUTRITION,
    SUPPLEMENT,
    STEPS
}
