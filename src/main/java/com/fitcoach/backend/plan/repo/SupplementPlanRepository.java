package com.fitcoach.backend.plan.repo;

import com.fitcoach.backend.plan.entity.SupplementPlanEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SupplementPlanRepository extends JpaRepository<SupplementPlanEntity, String> {

    // customer_id = ? OR lead_id = ?，新到舊
    @Query("""
           select p from SupplementPlanEntity p
           where ((:customerId is not null and p.customerId = :customerId)
               or (:leadId is not null and p.leadId = :leadId))
           order by p.createdAt desc
           """)
    List<SupplementPlanEntity> findForClient(String customerId, String leadId);
}
