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
@Table(name = "supplement_plans",
        indexes = {
                @Index(name = "idx_supplement_plans_customer", columnList = "customer_id,created_at"),
                @Index(name = "idx_supplement_plans_lead", columnList = "lead_id,created_at")
        })
public class SupplementPlanEntity {

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

    // 元素可能是字串（只有名稱）或 {name, dosage, timing, link1, link2}
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "supplements", columnDefinition = "JSON")
    private JsonNode supplements;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();
}
