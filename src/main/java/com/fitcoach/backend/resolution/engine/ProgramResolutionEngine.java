package com.fitcoach.backend.resolution.engine;

import com.fitcoach.backend.resolution.model.AssignmentRecord;
import com.fitcoach.backend.resolution.model.ClientKey;
import com.fitcoach.backend.resolution.model.ClientSnapshot;
import com.fitcoach.backend.resolution.model.LeadScope;
import com.fitcoach.backend.resolution.model.ProgramHistory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * resolve(client, snapshot) → ProgramHistory。沒有狀態，可同時被多個 request 使用。
 */
@Component
public class ProgramResolutionEngine {

    private final ActiveProgramLocator locator;
    private final AssignmentResolver assignmentResolver;
    private final ProgramHistoryComposer composer = new ProgramHistoryComposer();

    public ProgramResolutionEngine(AssignmentConflictPolicy policy) {
        this.locator = new ActiveProgramLocator(policy);
        this.assignmentResolver = new AssignmentResolver(locator);
    }

    public ProgramHistory resolve(ClientKey client, ClientSnapshot snapshot, LocalDate today) {
        if (client == null || client.isEmpty()) return ProgramHistory.empty(client);
        AssignmentRecord governing = locator.locate(snapshot.assignments()).orElse(null);
        return composer.compose(client, snapshot, governing, today);
    }

    /** lead 頁面：lead 自己的 assignment 優先，其次 customer / 同 customer 其他 lead */
    public ProgramHistory resolveForLead(LeadScope scope, ClientSnapshot snapshot, LocalDate today) {
        ClientKey client = scope.clientKey();
        if (client.isEmpty()) return ProgramHistory.empty(client);
        AssignmentRecord governing = assignmentResolver.resolve(scope, snapshot.assignments()).orElse(null);
        return composer.compose(client, snapshot, governing, today);
    }
}
