package com.fitcoach.backend.resolution.model;

public record CurrentStepsView(
        String programId,
        String planId,
        EffectiveValue<Integer> goal,
        EffectiveValue<String> instructions
) {}
