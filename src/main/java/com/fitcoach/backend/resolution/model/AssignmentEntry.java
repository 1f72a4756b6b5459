package com.fitcoach.backend.resolution.model;

import java.time.Instant;

public record AssignmentEntry(
        String id,
        String programId,
        String programName,
        Instant assignedAt,
        boolean active,
        String notes
) {}
