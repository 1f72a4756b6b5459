package com.fitcoach.backend.resolution.model;

public record WorkoutSplit(int strength, int cardio, int intervals) {

    public static final WorkoutSplit EMPTY = new WorkoutSplit(0, 0, 0);
}
