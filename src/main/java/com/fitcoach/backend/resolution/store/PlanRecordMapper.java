package com.fitcoach.backend.resolution.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fitcoach.backend.budget.entity.Budget;
import com.fitcoach.backend.budget.entity.BudgetAssignment;
import com.fitcoach.backend.lead.entity.Lead;
import com.fitcoach.backend.plan.entity.NutritionPlanEntity;
import com.fitcoach.backend.plan.entity.StepsPlanEntity;
import com.fitcoach.backend.plan.entity.SupplementPlanEntity;
import com.fitcoach.backend.plan.entity.WorkoutPlanEntity;
import com.fitcoach.backend.resolution.model.*;

import java.util.ArrayList;
import java.util.List;

/**
 * entity → engine record。JSON 欄位形狀不可靠，這裡只做「盡量讀」，不丟例外。
 */
public final class PlanRecordMapper {
    private PlanRecordMapper() {}

    public static PlanRecord<WorkoutRoutine> toRecord(WorkoutPlanEntity e) {
        WorkoutRoutine routine = new WorkoutRoutine(
                e.getDescription(),
                e.getTemplateId(),
                split(e.getSplit(), e.getStrength(), e.getCardio(), e.getIntervals()),
                e.getCustomAttributes()
        );
        return new PlanRecord<>(e.getId(), e.getBudgetId(), e.getCustomerId(), e.getLeadId(),
                e.getStartDate(), e.getEndDate(), e.getCreatedAt(), routine);
    }

    public static PlanRecord<NutritionPayload> toRecord(NutritionPlanEntity e) {
        NutritionPayload payload = new NutritionPayload(e.getDescription(), e.getTemplateId(), e.getTargets());
        return new PlanRecord<>(e.getId(), e.getBudgetId(), e.getCustomerId(), e.getLeadId(),
                e.getStartDate(), e.getEndDate(), e.getCreatedAt(), payload);
    }

    public static PlanRecord<SupplementPayload> toRecord(SupplementPlanEntity e) {
        SupplementPayload payload = new SupplementPayload(e.getDescription(), supplements(e.getSupplements()));
        return new PlanRecord<>(e.getId(), e.getBudgetId(), e.getCustomerId(), e.getLeadId(),
                e.getStartDate(), e.getEndDate(), e.getCreatedAt(), payload);
    }

    public static PlanRecord<StepsPayload> toRecord(StepsPlanEntity e) {
        StepsPayload payload = new StepsPayload(e.getDescription(), e.getStepsGoal(), e.getStepsInstructions());
        return new PlanRecord<>(e.getId(), e.getBudgetId(), e.getCustomerId(), e.getLeadId(),
                e.getStartDate(), e.getEndDate(), e.getCreatedAt(), payload);
    }

    public static ProgramRecord toRecord(Budget b) {
        return new ProgramRecord(
                b.getId(),
                b.getName(),
                b.getDescription(),
                b.getNutritionTargets(),
                b.getStepsGoal(),
                b.getStepsInstructions(),
                supplements(b.getSupplements()),
                b.getEatingOrder(),
                b.getEatingRules(),
                b.getNutritionTemplateId(),
                b.getWorkoutTemplateId()
        );
    }

    public static AssignmentRecord toRecord(BudgetAssignment a) {
        return new AssignmentRecord(a.getId(), a.getBudgetId(), a.getCustomerId(), a.getLeadId(),
                a.isActive(), a.getAssignedAt(), a.getNotes());
    }

    public static LeadRecord toRecord(Lead l) {
        return new LeadRecord(l.getId(), l.getCustomerId());
    }

    // ===== JSON helpers =====

    /** split JSON 有值就用它，否則退回舊的三個欄位 */
    static WorkoutSplit split(JsonNode split, Integer strength, Integer cardio, Integer intervals) {
        if (split != null && split.isObject() && !split.isEmpty()) {
            return new WorkoutSplit(
                    intOr(split.get("strength"), nz(strength)),
                    intOr(split.get("cardio"), nz(cardio)),
                    intOr(split.get("intervals"), nz(intervals))
            );
        }
        return new WorkoutSplit(nz(strength), nz(cardio), nz(intervals));
    }

    /** 元素可能是字串或 object；其他型別跳過 */
    static List<SupplementItem> supplements(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        List<SupplementItem> out = new ArrayList<>(node.size());
        for (JsonNode el : node) {
            if (el.isTextual()) {
                if (!el.asText().isBlank()) out.add(SupplementItem.named(el.asText().trim()));
            } else if (el.isObject()) {
                String name = text(el, "name");
                if (name == null) continue;
                out.add(new SupplementItem(name, text(el, "dosage"), text(el, "timing"),
                        text(el, "link1"), text(el, "link2")));
            }
        }
        return out;
    }

    private static String text(JsonNode obj, String key) {
        JsonNode v = obj.get(key);
        if (v == null || v.isNull()) return null;
        String s = v.asText();
        return s.isBlank() ? null : s.trim();
    }

    private static int intOr(JsonNode v, int dft) {
        if (v == null || v.isNull()) return dft;
        if (v.isNumber()) return v.intValue();
        if (v.isTextual()) {
            try {
                return Integer.parseInt(v.asText().trim());
            } catch (NumberFormatException e) {
                return dft;
            }
        }
        return dft;
    }

    private static int nz(Integer v) {
        return (v == null) ? 0 : v;
    }
}
