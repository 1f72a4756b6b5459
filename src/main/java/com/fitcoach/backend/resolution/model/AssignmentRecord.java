package com.fitcoach.backend.resolution.model;

import java.time.Instant;

public record AssignmentRecord(
        String id,
        String programId,
        String customerId,
        String leadId,
        boolean active,
        Instant assignedAt,
        String notes
) {}
