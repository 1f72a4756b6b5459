package com.fitcoach.backend.resolution.engine;

import com.fitcoach.backend.resolution.model.AssignmentRecord;

import java.time.Instant;
import java.util.List;

/**
 * 同一個 client 出現多筆 is_active=true 時（上游資料不一致）要選哪一筆。
 * 這只是決定性的 tie-break，不是資料正確性的保證。
 */
@FunctionalInterface
public interface AssignmentConflictPolicy {

    /** candidates 至少一筆、全部都是 active */
    AssignmentRecord choose(List<AssignmentRecord> candidates);

    /** assigned_at 最新的勝；assigned_at 相同（或都 null）時先出現的勝 */
    static AssignmentConflictPolicy pickMostRecentlyAssigned() {
        return candidates -> {
            AssignmentRecord best = candidates.get(0);
            for (int i = 1; i < candidates.size(); i++) {
                AssignmentRecord c = candidates.get(i);
                if (isLater(c.assignedAt(), best.assignedAt())) best = c;
            }
            return best;
        };
    }

    private static boolean isLater(Instant a, Instant b) {
        if (a == null) return false;
        if (b == null) return true;
        return a.isAfter(b);
    }
}
