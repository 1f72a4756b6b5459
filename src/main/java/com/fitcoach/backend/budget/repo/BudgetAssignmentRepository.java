package com.fitcoach.backend.budget.repo;

import com.fitcoach.backend.budget.entity.BudgetAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface BudgetAssignmentRepository extends JpaRepository<BudgetAssignment, String> {

    // customer_id = ? OR lead_id = ?（只給一個時就只比那一個）
    @Query("""
           select a from BudgetAssignment a
           where (:customerId is not null and a.customerId = :customerId)
              or (:leadId is not null and a.leadId = :leadId)
           order by a.assignedAt desc
           """)
    List<BudgetAssignment> findForClient(String customerId, String leadId);

    // leadIds 不可為空集合，呼叫端自己擋
    @Query("""
           select a from BudgetAssignment a
           where (:customerId is not null and a.customerId = :customerId)
              or a.leadId in :leadIds
           order by a.assignedAt desc
           """)
    List<BudgetAssignment> findForCustomerOrLeads(String customerId, Collection<String> leadIds);
}
