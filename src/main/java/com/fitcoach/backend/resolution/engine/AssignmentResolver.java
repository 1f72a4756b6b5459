package com.fitcoach.backend.resolution.engine;

import com.fitcoach.backend.resolution.model.AssignmentRecord;
import com.fitcoach.backend.resolution.model.LeadScope;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * lead 頁面要顯示哪個 program：
 * (a) 這個 lead 自己的 active assignment 優先
 * (b) 否則用 customer 層級、或同 customer 其他 lead 的 active assignment
 */
public class AssignmentResolver {

    private final ActiveProgramLocator locator;

    public AssignmentResolver(ActiveProgramLocator locator) {
        this.locator = locator;
    }

    public Optional<AssignmentRecord> resolve(LeadScope scope, List<AssignmentRecord> assignments) {
        if (scope == null || assignments == null || assignments.isEmpty()) return Optional.empty();

        String leadId = scope.leadId();
        if (leadId != null) {
            List<AssignmentRecord> leadSpecific = assignments.stream()
                    .filter(Objects::nonNull)
                    .filter(a -> leadId.equals(a.leadId()))
                    .toList();
            Optional<AssignmentRecord> own = locator.locate(leadSpecific);
            if (own.isPresent()) return own;
        }

        Set<String> siblingLeads = new HashSet<>(scope.customerLeadIds());
        if (leadId != null) siblingLeads.remove(leadId);
        String customerId = scope.customerId();

        List<AssignmentRecord> customerLevel = assignments.stream()
                .filter(Objects::nonNull)
                .filter(a -> (customerId != null && customerId.equals(a.customerId()))
                        || (a.leadId() != null && siblingLeads.contains(a.leadId())))
                .toList();
        return locator.locate(customerLevel);
    }
}
