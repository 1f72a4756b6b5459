package com.fitcoach.backend.plan.repo;

import com.fitcoach.backend.plan.entity.WorkoutPlanEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WorkoutPlanRepository extends JpaRepository<WorkoutPlanEntity, String> {

    // customer_id = ? OR lead_id = ?，新到舊；軟刪的不算
    @Query("""
           select p from WorkoutPlanEntity p
           where p.deletedAt is null
             and ((:customerId is not null and p.customerId = :customerId)
               or (:leadId is not null and p.leadId = :leadId))
           order by p.createdAt desc
           """)
    List<WorkoutPlanEntity> findForClient(String customerId, String leadId);
}
