package com.fitcoach.backend.resolution.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * history 列表的一筆。synthetic=true 表示不是真的 plan row，而是從 Budget 欄位補出來的（id 為 null）。
 */
public record PlanEntry<P>(
        String id,
        String programId,
        LocalDate startDate,
        LocalDate endDate,
        Instant createdAt,
        boolean active,
        boolean synthetic,
        P payload
) {

    public static <P> PlanEntry<P> of(PlanRecord<P> r, boolean active) {
        return new PlanEntry<>(r.id(), r.programId(), r.startDate(), r.endDate(), r.createdAt(), active, false, r.payload());
    }

    /** 有起訖日才算得出天數，否則 null（= 沒有結束日） */
    @JsonProperty("durationDays")
    public Long durationDays() {
        if (startDate == null || endDate == null) return null;
        return ChronoUnit.DAYS.between(startDate, endDate);
    }
}
