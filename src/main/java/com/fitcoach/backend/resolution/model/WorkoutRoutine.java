package com.fitcoach.backend.resolution.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record WorkoutRoutine(
        String description,
        String templateId,
        WorkoutSplit split,
        JsonNode customAttributes
) {

    public static final String DEFAULT_NAME = "Workout plan";

    @JsonProperty("name")
    public String displayName() {
        return (description == null || description.isBlank()) ? DEFAULT_NAME : description;
    }
}
