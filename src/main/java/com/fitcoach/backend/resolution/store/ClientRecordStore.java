package com.fitcoach.backend.resolution.store;

import com.fitcoach.backend.resolution.model.*;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * resolution 唯一的資料來源（唯讀）。
 * fetch 類方法：customer_id = ? OR lead_id = ?，新到舊；ClientKey 為空時回空 list，不查 DB。
 */
public interface ClientRecordStore {

    List<AssignmentRecord> fetchAssignments(ClientKey key);

    /** customer 層級 + customer 底下任一 lead 的 assignments */
    List<AssignmentRecord> fetchAssignmentsForCustomerOrLeads(String customerId, Collection<String> leadIds);

    List<PlanRecord<WorkoutRoutine>> fetchWorkoutPlans(ClientKey key);

    List<PlanRecord<NutritionPayload>> fetchNutritionPlans(ClientKey key);

    List<PlanRecord<SupplementPayload>> fetchSupplementPlans(ClientKey key);

    List<PlanRecord<StepsPayload>> fetchStepsPlans(ClientKey key);

    /** 找不到的 id 不會出現在結果裡 */
    Map<String, ProgramRecord> findPrograms(Collection<String> programIds);

    Optional<LeadRecord> findLead(String leadId);

    List<String> findLeadIdsOfCustomer(String customerId);
}
