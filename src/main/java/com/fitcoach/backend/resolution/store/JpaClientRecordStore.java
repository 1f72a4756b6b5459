package com.fitcoach.backend.resolution.store;

import com.fitcoach.backend.budget.entity.Budget;
import com.fitcoach.backend.budget.repo.BudgetAssignmentRepository;
import com.fitcoach.backend.budget.repo.BudgetRepository;
import com.fitcoach.backend.lead.repo.LeadRepository;
import com.fitcoach.backend.plan.repo.NutritionPlanRepository;
import com.fitcoach.backend.plan.repo.StepsPlanRepository;
import com.fitcoach.backend.plan.repo.SupplementPlanRepository;
import com.fitcoach.backend.plan.repo.WorkoutPlanRepository;
import com.fitcoach.backend.resolution.model.*;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaClientRecordStore implements ClientRecordStore {

    private final BudgetRepository budgets;
    private final BudgetAssignmentRepository assignments;
    private final WorkoutPlanRepository workoutPlans;
    private final NutritionPlanRepository nutritionPlans;
    private final SupplementPlanRepository supplementPlans;
    private final StepsPlanRepository stepsPlans;
    private final LeadRepository leads;

    @Override
    public List<AssignmentRecord> fetchAssignments(ClientKey key) {
        if (key == null || key.isEmpty()) return List.of();
        return assignments.findForClient(key.customerId(), key.leadId()).stream()
                .map(PlanRecordMapper::toRecord)
                .toList();
    }

    @Override
    public List<AssignmentRecord> fetchAssignmentsForCustomerOrLeads(String customerId, Collection<String> leadIds) {
        Set<String> ids = new LinkedHashSet<>();
        if (leadIds != null) {
            leadIds.stream().filter(Objects::nonNull).forEach(ids::add);
        }
        // IN () 在部分 DB 會爆，空集合時退回單純 customer 查詢
        if (ids.isEmpty()) return fetchAssignments(ClientKey.of(customerId, null));
        return assignments.findForCustomerOrLeads(customerId, ids).stream()
                .map(PlanRecordMapper::toRecord)
                .toList();
    }

    @Override
    public List<PlanRecord<WorkoutRoutine>> fetchWorkoutPlans(ClientKey key) {
        if (key == null || key.isEmpty()) return List.of();
        return workoutPlans.findForClient(key.customerId(), key.leadId()).stream()
                .map(PlanRecordMapper::toRecord)
                .toList();
    }

    @Override
    public List<PlanRecord<NutritionPayload>> fetchNutritionPlans(ClientKey key) {
        if (key == null || key.isEmpty()) return List.of();
        return nutritionPlans.findForClient(key.customerId(), key.leadId()).stream()
                .map(PlanRecordMapper::toRecord)
                .toList();
    }

    @Override
    public List<PlanRecord<SupplementPayload>> fetchSupplementPlans(ClientKey key) {
        if (key == null || key.isEmpty()) return List.of();
        return supplementPlans.findForClient(key.customerId(), key.leadId()).stream()
                .map(PlanRecordMapper::toRecord)
                .toList();
    }

    @Override
    public List<PlanRecord<StepsPayload>> fetchStepsPlans(ClientKey key) {
        if (key == null || key.isEmpty()) return List.of();
        return stepsPlans.findForClient(key.customerId(), key.leadId()).stream()
                .map(PlanRecordMapper::toRecord)
                .toList();
    }

    @Override
    public Map<String, ProgramRecord> findPrograms(Collection<String> programIds) {
        if (programIds == null || programIds.isEmpty()) return Map.of();
        Map<String, ProgramRecord> out = new LinkedHashMap<>();
        for (Budget b : budgets.findAllById(programIds)) {
            out.put(b.getId(), PlanRecordMapper.toRecord(b));
        }
        return out;
    }

    @Override
    public Optional<LeadRecord> findLead(String leadId) {
        if (leadId == null || leadId.isBlank()) return Optional.empty();
        return leads.findById(leadId).map(PlanRecordMapper::toRecord);
    }

    @Override
    public List<String> findLeadIdsOfCustomer(String customerId) {
        if (customerId == null || customerId.isBlank()) return List.of();
        return leads.findIdsByCustomerId(customerId);
    }
}
