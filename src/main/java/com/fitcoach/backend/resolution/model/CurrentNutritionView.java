package com.fitcoach.backend.resolution.model;

public record CurrentNutritionView(
        String programId,
        String planId,
        EffectiveValue<NutritionTargets> targets,
        String eatingOrder,
        String eatingRules,
        String nutritionTemplateId
) {}
