package com.fitcoach.backend.resolution.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fitcoach.backend.resolution.model.EffectiveValue;
import com.fitcoach.backend.resolution.model.NutritionTargets;
import com.fitcoach.backend.resolution.model.ProgramRecord;
import com.fitcoach.backend.resolution.model.SupplementItem;

import java.util.List;
import java.util.function.Predicate;

/**
 * 逐欄位決定顯示值：plan（有意義才算）→ program 模板（有值就用）→ NONE。
 * 每個欄位群組獨立判斷，同一個 client 可以 targets 來自 plan、步數來自 program。
 */
public final class EffectiveValueResolver {
    private EffectiveValueResolver() {}

    /** meaningful 只檢查 plan 值；program 值只要 present 就採用 */
    public static <T> EffectiveValue<T> cascade(T planValue, T programValue,
                                                Predicate<T> meaningful, Predicate<T> present) {
        if (planValue != null && meaningful.test(planValue)) return EffectiveValue.fromPlan(planValue);
        if (programValue != null && present.test(programValue)) return EffectiveValue.fromProgram(programValue);
        return EffectiveValue.none();
    }

    /** planTargets / program 任一可為 null；program targets 只要是 object 就逐欄位顯示 */
    public static EffectiveValue<NutritionTargets> nutritionTargets(JsonNode planTargets, ProgramRecord program) {
        JsonNode programTargets = (program == null) ? null : program.nutritionTargets();
        EffectiveValue<JsonNode> raw = cascade(planTargets, programTargets,
                EffectiveValueResolver::isMeaningfulTargets, JsonNode::isObject);
        if (!raw.isPresent()) return EffectiveValue.none();
        return new EffectiveValue<>(raw.source(), NutritionTargets.from(raw.value()));
    }

    public static EffectiveValue<Integer> stepsGoal(Integer planGoal, ProgramRecord program) {
        return cascade(planGoal, program == null ? null : program.stepsGoal(),
                EffectiveValueResolver::isMeaningfulGoal, g -> true);
    }

    public static EffectiveValue<String> stepsInstructions(String planInstructions, ProgramRecord program) {
        return cascade(planInstructions, program == null ? null : program.stepsInstructions(),
                EffectiveValueResolver::isMeaningfulText, t -> true);
    }

    // ProgramRecord 會把 null 正規化成空 list，所以空 list = 模板沒有設定
    public static EffectiveValue<List<SupplementItem>> supplements(List<SupplementItem> planItems, ProgramRecord program) {
        return cascade(planItems, program == null ? null : program.supplements(), l -> !l.isEmpty(), l -> !l.isEmpty());
    }

    // ===== meaningful =====

    /** 必須是非空 object，而且 calories > 0；其他欄位有填也不算數 */
    public static boolean isMeaningfulTargets(JsonNode node) {
        if (node == null || !node.isObject() || node.isEmpty()) return false;
        Double calories = NutritionTargets.from(node).calories();
        return calories != null && calories > 0;
    }

    public static boolean isMeaningfulGoal(Integer goal) {
        return goal != null && goal > 0;
    }

    public static boolean isMeaningfulText(String s) {
        return s != null && !s.isBlank();
    }
}
