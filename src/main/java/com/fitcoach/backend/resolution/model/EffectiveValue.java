package com.fitcoach.backend.resolution.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 顯示給 client 的值 + 它從哪裡來（plan / program / none）。
 */
public record EffectiveValue<T>(ValueSource source, T value) {

    private static final EffectiveValue<?> NONE = new EffectiveValue<>(ValueSource.NONE, null);

    public static <T> EffectiveValue<T> fromPlan(T value) {
        return new EffectiveValue<>(ValueSource.PLAN, value);
    }

    public static <T> EffectiveValue<T> fromProgram(T value) {
        return new EffectiveValue<>(ValueSource.PROGRAM, value);
    }

    @SuppressWarnings("unchecked")
    public static <T> EffectiveValue<T> none() {
        return (EffectiveValue<T>) NONE;
    }

    @JsonIgnore
    public boolean isPresent() {
        return source != ValueSource.NONE;
    }
}
