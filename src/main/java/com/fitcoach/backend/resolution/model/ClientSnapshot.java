package com.fitcoach.backend.resolution.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一次 resolution 所需的全部 raw records（I/O 都在外面做完）。
 * programs 只需要包含被引用到的 Budget；找不到的 id 視為孤兒。
 */
public record ClientSnapshot(
        List<AssignmentRecord> assignments,
        Map<String, ProgramRecord> programs,
        List<PlanRecord<WorkoutRoutine>> workoutPlans,
        List<PlanRecord<NutritionPayload>> nutritionPlans,
        List<PlanRecord<SupplementPayload>> supplementPlans,
        List<PlanRecord<StepsPayload>> stepsPlans,
        Set<RecordKind> degradedKinds
) {

    public ClientSnapshot {
        assignments = (assignments == null) ? List.of() : List.copyOf(assignments);
        programs = (programs == null) ? Map.of() : Map.copyOf(programs);
        workoutPlans = (workoutPlans == null) ? List.of() : List.copyOf(workoutPlans);
        nutritionPlans = (nutritionPlans == null) ? List.of() : List.copyOf(nutritionPlans);
        supplementPlans = (supplementPlans == null) ? List.of() : List.copyOf(supplementPlans);
        stepsPlans = (stepsPlans == null) ? List.of() : List.copyOf(stepsPlans);
        degradedKinds = (degradedKinds == null || degradedKinds.isEmpty())
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(degradedKinds));
    }

    public static ClientSnapshot empty() {
        return new ClientSnapshot(null, null, null, null, null, null, null);
    }
}
