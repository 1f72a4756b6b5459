package com.fitcoach.backend.resolution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fitcoach.backend.budget.entity.Budget;
import com.fitcoach.backend.budget.entity.BudgetAssignment;
import com.fitcoach.backend.budget.repo.BudgetAssignmentRepository;
import com.fitcoach.backend.budget.repo.BudgetRepository;
import com.fitcoach.backend.lead.entity.Lead;
import com.fitcoach.backend.lead.repo.LeadRepository;
import com.fitcoach.backend.plan.entity.NutritionPlanEntity;
import com.fitcoach.backend.plan.entity.WorkoutPlanEntity;
import com.fitcoach.backend.plan.repo.NutritionPlanRepository;
import com.fitcoach.backend.plan.repo.WorkoutPlanRepository;
import com.fitcoach.backend.testsupport.MySqlContainerBaseTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * DB → store → engine → JSON 全部串起來跑一次。
 */
@SpringBootTest
@AutoConfigureMockMvc
class ProgramResolutionFlowTest extends MySqlContainerBaseTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper om;

    @Autowired BudgetRepository budgetRepo;
    @Autowired BudgetAssignmentRepository assignmentRepo;
    @Autowired WorkoutPlanRepository workoutRepo;
    @Autowired NutritionPlanRepository nutritionRepo;
    @Autowired LeadRepository leadRepo;

    private static String uid() {
        return UUID.randomUUID().toString();
    }

    private Budget budget(String name) throws Exception {
        Budget b = new Budget();
        b.setId(uid());
        b.setName(name);
        b.setNutritionTargets(om.readTree("{\"calories\":1800,\"protein\":140,\"carbs\":200,\"fat\":60}"));
        b.setStepsGoal(10000);
        b.setEatingOrder("protein first");
        return budgetRepo.saveAndFlush(b);
    }

    private void assign(String budgetId, String customerId, String leadId) {
        BudgetAssignment a = new BudgetAssignment();
        a.setId(uid());
        a.setBudgetId(budgetId);
        a.setCustomerId(customerId);
        a.setLeadId(leadId);
        a.setActive(true);
        a.setAssignedAt(Instant.parse("2024-01-01T00:00:00Z"));
        assignmentRepo.saveAndFlush(a);
    }

    private WorkoutPlanEntity workout(String budgetId, String customerId, LocalDate start) {
        WorkoutPlanEntity w = new WorkoutPlanEntity();
        w.setId(uid());
        w.setBudgetId(budgetId);
        w.setCustomerId(customerId);
        w.setStartDate(start);
        w.setDescription("Upper / lower");
        w.setStrength(4);
        return workoutRepo.saveAndFlush(w);
    }

    @Test
    void customer_page_shows_latest_workout_and_program_targets() throws Exception {
        String customerId = uid();
        Budget y = budget("Program Y");
        assign(y.getId(), customerId, null);
        workout(y.getId(), customerId, LocalDate.of(2024, 1, 1));
        WorkoutPlanEntity latest = workout(y.getId(), customerId, LocalDate.of(2024, 3, 1));

        NutritionPlanEntity n = new NutritionPlanEntity();
        n.setId(uid());
        n.setBudgetId(y.getId());
        n.setCustomerId(customerId);
        n.setTargets(om.readTree("{\"calories\":0,\"protein\":150}"));
        nutritionRepo.saveAndFlush(n);

        mvc.perform(get("/api/v1/program-resolution").param("customerId", customerId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeProgram.name").value("Program Y"))
                .andExpect(jsonPath("$.workoutHistory.length()").value(1))
                .andExpect(jsonPath("$.workoutHistory[0].id").value(latest.getId()))
                .andExpect(jsonPath("$.workoutHistory[0].active").value(true))
                .andExpect(jsonPath("$.currentWorkout.routine.value.name").value("Upper / lower"))
                .andExpect(jsonPath("$.currentNutrition.targets.source").value("PROGRAM"))
                .andExpect(jsonPath("$.currentNutrition.targets.value.protein").value(140.0))
                .andExpect(jsonPath("$.currentSteps.goal.value").value(10000))
                .andExpect(jsonPath("$.stepsHistory[0].synthetic").value(true))
                .andExpect(jsonPath("$.degradedKinds").isEmpty());
    }

    @Test
    void lead_page_falls_back_to_customer_assignment() throws Exception {
        String customerId = uid();
        Lead lead = new Lead();
        lead.setId(uid());
        lead.setCustomerId(customerId);
        leadRepo.saveAndFlush(lead);

        Budget p = budget("Program P");
        assign(p.getId(), customerId, null);

        mvc.perform(get("/api/v1/program-resolution/leads/{leadId}", lead.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeProgram.programId").value(p.getId()))
                .andExpect(jsonPath("$.client.customerId").value(customerId));
    }

    @Test
    void unknown_client_is_empty_not_error() throws Exception {
        mvc.perform(get("/api/v1/program-resolution").param("leadId", uid()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasActiveProgram").value(false))
                .andExpect(jsonPath("$.workoutHistory").isEmpty());
    }
}
