package com.fitcoach.backend.resolution.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fitcoach.backend.budget.entity.Budget;
import com.fitcoach.backend.budget.entity.BudgetAssignment;
import com.fitcoach.backend.budget.repo.BudgetAssignmentRepository;
import com.fitcoach.backend.budget.repo.BudgetRepository;
import com.fitcoach.backend.lead.entity.Lead;
import com.fitcoach.backend.lead.repo.LeadRepository;
import com.fitcoach.backend.plan.entity.NutritionPlanEntity;
import com.fitcoach.backend.plan.entity.StepsPlanEntity;
import com.fitcoach.backend.plan.repo.NutritionPlanRepository;
import com.fitcoach.backend.plan.repo.StepsPlanRepository;
import com.fitcoach.backend.resolution.model.*;
import com.fitcoach.backend.testsupport.MySqlContainerBaseTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(JpaClientRecordStore.class)
class JpaClientRecordStoreTest extends MySqlContainerBaseTest {

    @Autowired JpaClientRecordStore store;
    @Autowired BudgetRepository budgetRepo;
    @Autowired BudgetAssignmentRepository assignmentRepo;
    @Autowired NutritionPlanRepository nutritionRepo;
    @Autowired StepsPlanRepository stepsRepo;
    @Autowired LeadRepository leadRepo;

    private final ObjectMapper om = new ObjectMapper();

    private static String uid() {
        return UUID.randomUUID().toString();
    }

    private NutritionPlanEntity nutrition(String customerId, String leadId, String budgetId, Instant deletedAt) throws Exception {
        NutritionPlanEntity e = new NutritionPlanEntity();
        e.setId(uid());
        e.setCustomerId(customerId);
        e.setLeadId(leadId);
        e.setBudgetId(budgetId);
        e.setStartDate(LocalDate.of(2024, 1, 1));
        e.setTargets(om.readTree("{\"calories\":2000,\"protein\":150}"));
        e.setDeletedAt(deletedAt);
        return nutritionRepo.saveAndFlush(e);
    }

    private BudgetAssignment assignment(String budgetId, String customerId, String leadId, boolean active) {
        BudgetAssignment a = new BudgetAssignment();
        a.setId(uid());
        a.setBudgetId(budgetId);
        a.setCustomerId(customerId);
        a.setLeadId(leadId);
        a.setActive(active);
        return assignmentRepo.saveAndFlush(a);
    }

    @Test
    void plans_match_customer_or_lead_and_skip_soft_deleted() throws Exception {
        String c = uid();
        String l = uid();
        var viaCustomer = nutrition(c, null, "B1", null);
        var viaLead = nutrition(null, l, "B1", null);
        nutrition(c, null, "B1", Instant.now());
        nutrition(uid(), uid(), "B1", null);

        List<PlanRecord<NutritionPayload>> out = store.fetchNutritionPlans(ClientKey.of(c, l));

        assertThat(out).extracting(PlanRecord::id)
                .containsExactlyInAnyOrder(viaCustomer.getId(), viaLead.getId());
        assertThat(out.get(0).payload().targets().path("calories").asInt()).isEqualTo(2000);
    }

    @Test
    void only_one_identifier_given_matches_only_that_column() throws Exception {
        String c = uid();
        nutrition(c, null, "B1", null);
        nutrition(null, uid(), "B1", null);

        assertThat(store.fetchNutritionPlans(ClientKey.of(c, null))).hasSize(1);
        assertThat(store.fetchNutritionPlans(ClientKey.of(null, null))).isEmpty();
    }

    @Test
    void steps_plan_goal_defaults_to_zero() {
        String c = uid();
        StepsPlanEntity s = new StepsPlanEntity();
        s.setId(uid());
        s.setCustomerId(c);
        stepsRepo.saveAndFlush(s);

        List<PlanRecord<StepsPayload>> out = store.fetchStepsPlans(ClientKey.of(c, null));

        assertThat(out).singleElement().satisfies(r -> assertThat(r.payload().stepsGoal()).isZero());
    }

    @Test
    void assignments_for_customer_or_any_of_its_leads() {
        String c = uid();
        String l1 = uid();
        String l2 = uid();
        var own = assignment("B1", null, l1, true);
        var sibling = assignment("B2", null, l2, false);
        var customer = assignment("B3", c, null, true);
        assignment("B4", uid(), uid(), true);

        List<AssignmentRecord> out = store.fetchAssignmentsForCustomerOrLeads(c, List.of(l1, l2));

        assertThat(out).extracting(AssignmentRecord::id)
                .containsExactlyInAnyOrder(own.getId(), sibling.getId(), customer.getId());
    }

    @Test
    void empty_lead_list_falls_back_to_customer_only() {
        String c = uid();
        var customer = assignment("B3", c, null, true);

        assertThat(store.fetchAssignmentsForCustomerOrLeads(c, List.of()))
                .extracting(AssignmentRecord::id).containsExactly(customer.getId());
    }

    @Test
    void programs_and_leads_are_looked_up_by_id() throws Exception {
        Budget b = new Budget();
        b.setId(uid());
        b.setName("Lean bulk");
        b.setNutritionTargets(om.readTree("{\"calories\":2600}"));
        b.setSupplements(om.readTree("[\"Creatine\",{\"name\":\"Whey\",\"dosage\":\"30g\"}]"));
        budgetRepo.saveAndFlush(b);

        String c = uid();
        Lead lead = new Lead();
        lead.setId(uid());
        lead.setCustomerId(c);
        leadRepo.saveAndFlush(lead);

        Map<String, ProgramRecord> programs = store.findPrograms(List.of(b.getId(), "missing"));

        assertThat(programs).containsOnlyKeys(b.getId());
        assertThat(programs.get(b.getId()).supplements()).extracting(SupplementItem::name)
                .containsExactly("Creatine", "Whey");
        assertThat(store.findLead(lead.getId())).map(LeadRecord::customerId).contains(c);
        assertThat(store.findLeadIdsOfCustomer(c)).containsExactly(lead.getId());
    }
}
