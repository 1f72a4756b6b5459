package com.fitcoach.backend.budget.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * 教練建立的「計畫模板」（Program）。內容可隨時改，id 不變。
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "budgets")
public class Budget {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "nutrition_template_id", length = 36)
    private String nutritionTemplateId;

    // {calories, protein, carbs, fat, fiber_min, water_min}
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "nutrition_targets", columnDefinition = "JSON")
    private JsonNode nutritionTargets;

    @Column(name = "steps_goal")
    private Integer stepsGoal;

    @Column(name = "steps_instructions", columnDefinition = "TEXT")
    private String stepsInstructions;

    @Column(name = "workout_template_id", length = 36)
    private String workoutTemplateId;

    // [{name, dosage, timing, link1, link2}]
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "supplements", columnDefinition = "JSON")
    private JsonNode supplements;

    @Column(name = "eating_order", columnDefinition = "TEXT")
    private String eatingOrder;

    @Column(name = "eating_rules", columnDefinition = "TEXT")
    private String eatingRules;

    @Column(name = "is_public", nullable = false)
    private boolean publicBudget = false;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void touch() { this.updatedAt = Instant.now(); }
}
