package com.fitcoach.backend.resolution.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * targets 保留原始 JSON；是否可信由 EffectiveValueResolver 判斷。
 */
public record NutritionPayload(String description, String templateId, JsonNode targets) {}
