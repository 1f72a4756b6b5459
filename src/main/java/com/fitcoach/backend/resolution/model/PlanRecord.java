package com.fitcoach.backend.resolution.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 一筆 plan row（四種 kind 共用），payload 依 kind 不同。
 * programId 可以是 null（沒有綁 Budget 的 ad-hoc plan）。
 */
public record PlanRecord<P>(
        String id,
        String programId,
        String customerId,
        String leadId,
        LocalDate startDate,
        LocalDate endDate,
        Instant createdAt,
        P payload
) {}
