package com.fitcoach.backend.resolution.model;

public record CurrentWorkoutView(
        String programId,
        String planId,
        EffectiveValue<WorkoutRoutine> routine,
        String workoutTemplateId
) {}
