package com.fitcoach.backend.plan.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "steps_plans",
        indexes = {
                @Index(name = "idx_steps_plans_customer", columnList = "customer_id,created_at"),
                @Index(name = "idx_steps_plans_lead", columnList = "lead_id,created_at")
        })
public class StepsPlanEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "budget_id", length = 36)
    private String budgetId;

    @Column(name = "customer_id", length = 36)
    private String customerId;

    @Column(name = "lead_id", length = 36)
    private String leadId;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "steps_goal", nullable = false)
    private Integer stepsGoal = 0;

    @Column(name = "steps_instructions", columnDefinition = "TEXT")
    private String stepsInstructions;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();
}
