package com.fitcoach.backend.resolution.model;

public record StepsPayload(String description, Integer stepsGoal, String stepsInstructions) {}
