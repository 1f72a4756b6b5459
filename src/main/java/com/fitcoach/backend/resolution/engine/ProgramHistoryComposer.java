package com.fitcoach.backend.resolution.engine;

import com.fitcoach.backend.resolution.model.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 已知 governing assignment 後，把四種 plan 組成 current view + history。純函式，沒有 I/O。
 */
public class ProgramHistoryComposer {

    public ProgramHistory compose(ClientKey client, ClientSnapshot snapshot, AssignmentRecord governing, LocalDate today) {
        String programId = (governing == null) ? null : governing.programId();
        // 找不到 = 孤兒 budget_id：history 照樣標 active，但沒有模板 fallback
        ProgramRecord program = (programId == null) ? null : snapshot.programs().get(programId);

        List<PlanEntry<WorkoutRoutine>> workout =
                PlanActivityFlagger.flag(PlanDeduplicator.deduplicate(snapshot.workoutPlans()), programId);
        List<PlanEntry<NutritionPayload>> nutrition =
                PlanActivityFlagger.flag(PlanDeduplicator.deduplicate(snapshot.nutritionPlans()), programId);
        List<PlanEntry<SupplementPayload>> supplements =
                PlanActivityFlagger.flag(PlanDeduplicator.deduplicate(snapshot.supplementPlans()), programId);
        List<PlanEntry<StepsPayload>> steps =
                PlanActivityFlagger.flagSteps(PlanDeduplicator.deduplicate(snapshot.stepsPlans()), programId, program, today);

        List<AssignmentEntry> assignmentHistory = assignmentHistory(snapshot, governing);

        if (governing == null) {
            return new ProgramHistory(client, null, null, null, null, null,
                    nutrition, steps, supplements, workout, assignmentHistory, snapshot.degradedKinds());
        }

        return new ProgramHistory(
                client,
                overview(governing, program),
                currentNutrition(programId, activeEntry(nutrition), program),
                currentSteps(programId, activeEntry(steps), program),
                currentSupplements(programId, activeEntry(supplements), program),
                currentWorkout(programId, activeEntry(workout), program),
                nutrition,
                steps,
                supplements,
                workout,
                assignmentHistory,
                snapshot.degradedKinds()
        );
    }

    // ===== current views =====

    private static CurrentNutritionView currentNutrition(String programId, PlanEntry<NutritionPayload> active, ProgramRecord program) {
        var targets = EffectiveValueResolver.nutritionTargets(active == null ? null : active.payload().targets(), program);
        return new CurrentNutritionView(
                programId,
                planId(active),
                targets,
                program == null ? null : program.eatingOrder(),
                program == null ? null : program.eatingRules(),
                program == null ? null : program.nutritionTemplateId()
        );
    }

    private static CurrentStepsView currentSteps(String programId, PlanEntry<StepsPayload> active, ProgramRecord program) {
        // synthetic entry 本來就是 program 的值，不當成 plan 來源
        StepsPayload plan = (active == null || active.synthetic()) ? null : active.payload();
        return new CurrentStepsView(
                programId,
                planId(active),
                EffectiveValueResolver.stepsGoal(plan == null ? null : plan.stepsGoal(), program),
                EffectiveValueResolver.stepsInstructions(plan == null ? null : plan.stepsInstructions(), program)
        );
    }

    private static CurrentSupplementsView currentSupplements(String programId, PlanEntry<SupplementPayload> active, ProgramRecord program) {
        return new CurrentSupplementsView(
                programId,
                planId(active),
                EffectiveValueResolver.supplements(active == null ? null : active.payload().supplements(), program)
        );
    }

    private static CurrentWorkoutView currentWorkout(String programId, PlanEntry<WorkoutRoutine> active, ProgramRecord program) {
        EffectiveValue<WorkoutRoutine> routine = (active == null)
                ? EffectiveValue.none()
                : EffectiveValue.fromPlan(active.payload());
        return new CurrentWorkoutView(
                programId,
                planId(active),
                routine,
                program == null ? null : program.workoutTemplateId()
        );
    }

    private static <P> PlanEntry<P> activeEntry(List<PlanEntry<P>> entries) {
        if (entries.isEmpty() || !entries.get(0).active()) return null;
        return entries.get(0);
    }

    private static String planId(PlanEntry<?> e) {
        return (e == null) ? null : e.id();
    }

    // ===== overview / assignments =====

    private static ProgramOverview overview(AssignmentRecord governing, ProgramRecord program) {
        return new ProgramOverview(
                governing.programId(),
                program == null ? null : program.name(),
                program == null ? null : program.description(),
                program == null ? null : program.eatingOrder(),
                program == null ? null : program.eatingRules(),
                program == null ? null : program.nutritionTemplateId(),
                program == null ? null : program.workoutTemplateId(),
                governing.id(),
                governing.assignedAt(),
                governing.notes()
        );
    }

    /** governing 在最前，其餘依 assigned_at 新到舊（null 最後） */
    private static List<AssignmentEntry> assignmentHistory(ClientSnapshot snapshot, AssignmentRecord governing) {
        List<AssignmentRecord> rest = new ArrayList<>();
        for (AssignmentRecord a : snapshot.assignments()) {
            if (a == null || a == governing) continue;
            rest.add(a);
        }
        rest.sort(Comparator.comparing(AssignmentRecord::assignedAt,
                Comparator.nullsLast(Comparator.<Instant>reverseOrder())));

        List<AssignmentEntry> out = new ArrayList<>(rest.size() + 1);
        if (governing != null) out.add(toEntry(governing, snapshot, true));
        for (AssignmentRecord a : rest) out.add(toEntry(a, snapshot, false));
        return List.copyOf(out);
    }

    private static AssignmentEntry toEntry(AssignmentRecord a, ClientSnapshot snapshot, boolean governing) {
        ProgramRecord p = (a.programId() == null) ? null : snapshot.programs().get(a.programId());
        return new AssignmentEntry(
                a.id(),
                a.programId(),
                p == null ? null : p.name(),
                a.assignedAt(),
                governing,
                a.notes()
        );
    }
}
