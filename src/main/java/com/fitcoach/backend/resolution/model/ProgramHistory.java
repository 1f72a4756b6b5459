package com.fitcoach.backend.resolution.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * resolution 的唯一對外結果。current* 為 null 代表沒有 active program。
 */
public record ProgramHistory(
        ClientKey client,
        ProgramOverview activeProgram,
        CurrentNutritionView currentNutrition,
        CurrentStepsView currentSteps,
        CurrentSupplementsView currentSupplements,
        CurrentWorkoutView currentWorkout,
        List<PlanEntry<NutritionPayload>> nutritionHistory,
        List<PlanEntry<StepsPayload>> stepsHistory,
        List<PlanEntry<SupplementPayload>> supplementHistory,
        List<PlanEntry<WorkoutRoutine>> workoutHistory,
        List<AssignmentEntry> assignmentHistory,
        Set<RecordKind> degradedKinds
) {

    public static ProgramHistory empty(ClientKey client) {
        return new ProgramHistory(client, null, null, null, null, null,
                List.of(), List.of(), List.of(), List.of(), List.of(), Set.of());
    }

    @JsonProperty("hasActiveProgram")
    public boolean hasActiveProgram() {
        return activeProgram != null;
    }
}
