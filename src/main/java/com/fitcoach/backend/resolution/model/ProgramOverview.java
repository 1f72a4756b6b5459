package com.fitcoach.backend.resolution.model;

import java.time.Instant;

/**
 * 目前生效的 Budget 概要。name 為 null 代表 budget_id 已經找不到對應的 Budget（孤兒）。
 */
public record ProgramOverview(
        String programId,
        String name,
        String description,
        String eatingOrder,
        String eatingRules,
        String nutritionTemplateId,
        String workoutTemplateId,
        String assignmentId,
        Instant assignedAt,
        String notes
) {

    public boolean isOrphaned() {
        return name == null;
    }
}
