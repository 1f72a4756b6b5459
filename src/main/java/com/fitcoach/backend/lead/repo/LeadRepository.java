package com.fitcoach.backend.lead.repo;

import com.fitcoach.backend.lead.entity.Lead;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LeadRepository extends JpaRepository<Lead, String> {

    @Query("""
           select l.id from Lead l
           where l.customerId = :customerId
           order by l.id asc
           """)
    List<String> findIdsByCustomerId(String customerId);
}
