package com.fitcoach.backend.resolution.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 每日營養目標。waterMin 單位是公升。
 */
public record NutritionTargets(
        Double calories,
        Double protein,
        Double carbs,
        Double fat,
        Double fiberMin,
        Double waterMin
) {

    /** node 不是 object 時全部為 null；非數字欄位也當 null */
    public static NutritionTargets from(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new NutritionTargets(null, null, null, null, null, null);
        }
        return new NutritionTargets(
                num(node, "calories"),
                num(node, "protein"),
                num(node, "carbs"),
                num(node, "fat"),
                num(node, "fiber_min", "fiber"),
                num(node, "water_min", "water")
        );
    }

    private static Double num(JsonNode node, String... keys) {
        for (String k : keys) {
            JsonNode v = node.get(k);
            if (v == null || v.isNull()) continue;
            if (v.isNumber()) return v.doubleValue();
            if (v.isTextual()) {
                try {
                    return Double.parseDouble(v.asText().trim());
                } catch (NumberFormatException e) {
                    return null;
                }
            }
            return null;
        }
        return null;
    }
}
