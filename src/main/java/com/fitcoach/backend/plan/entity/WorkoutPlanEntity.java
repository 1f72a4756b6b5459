package com.fitcoach.backend.plan.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "workout_plans",
        indexes = {
                @Index(name = "idx_workout_plans_customer", columnList = "customer_id,created_at"),
                @Index(name = "idx_workout_plans_lead", columnList = "lead_id,created_at")
        })
public class WorkoutPlanEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "budget_id", length = 36)
    private String budgetId;

    @Column(name = "customer_id", length = 36)
    private String customerId;

    @Column(name = "lead_id", length = 36)
    private String leadId;

    @Column(name = "template_id", length = 36)
    private String templateId;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(columnDefinition = "TEXT")
    private String description;

    // 舊資料只有這三欄；新資料會另外寫 split
    private Integer strength;
    private Integer cardio;
    private Integer intervals;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "split", columnDefinition = "JSON")
    private JsonNode split;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "custom_attributes", columnDefinition = "JSON")
    private JsonNode customAttributes;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "deleted_at")
    private Instant deletedAt;
}
