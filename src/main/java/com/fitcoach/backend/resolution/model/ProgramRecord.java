package com.fitcoach.backend.resolution.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Budget（Program 模板）的唯讀快照。
 */
public record ProgramRecord(
        String id,
        String name,
        String description,
        JsonNode nutritionTargets,
        Integer stepsGoal,
        String stepsInstructions,
        List<SupplementItem> supplements,
        String eatingOrder,
        String eatingRules,
        String nutritionTemplateId,
        String workoutTemplateId
) {

    public ProgramRecord {
        supplements = (supplements == null) ? List.of() : List.copyOf(supplements);
    }
}
