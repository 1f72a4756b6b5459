package com.fitcoach.backend.resolution.engine;

import com.fitcoach.backend.resolution.model.AssignmentRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * 從 client 的 assignments 找出唯一的 active 那筆。
 */
@Slf4j
public class ActiveProgramLocator {

    private final AssignmentConflictPolicy policy;

    public ActiveProgramLocator(AssignmentConflictPolicy policy) {
        this.policy = policy;
    }

    public Optional<AssignmentRecord> locate(List<AssignmentRecord> assignments) {
        if (assignments == null || assignments.isEmpty()) return Optional.empty();

        List<AssignmentRecord> active = assignments.stream()
                .filter(a -> a != null && a.active())
                .toList();

        if (active.isEmpty()) return Optional.empty();
        if (active.size() == 1) return Optional.of(active.get(0));

        AssignmentRecord chosen = policy.choose(active);
        log.warn("multiple active assignments count={} chosen={} programId={}",
                active.size(), chosen.id(), chosen.programId());
        return Optional.of(chosen);
    }
}
