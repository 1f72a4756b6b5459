package com.fitcoach.backend.budget.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * client（customer 或 lead，至少一個）↔ Budget 的連結。
 * 同一 client 同時最多一筆 is_active=true（由資料庫端維護，這裡只讀）。
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "budget_assignments",
        indexes = {
                @Index(name = "idx_budget_assignments_customer", columnList = "customer_id,is_active"),
                @Index(name = "idx_budget_assignments_lead", columnList = "lead_id,is_active")
        })
public class BudgetAssignment {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "budget_id", length = 36, nullable = false)
    private String budgetId;

    @Column(name = "customer_id", length = 36)
    private String customerId;

    @Column(name = "lead_id", length = 36)
    private String leadId;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "assigned_at", nullable = false)
    private Instant assignedAt = Instant.now();

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void touch() { this.updatedAt = Instant.now(); }
}
