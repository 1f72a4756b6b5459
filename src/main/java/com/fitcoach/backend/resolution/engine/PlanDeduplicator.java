package com.fitcoach.backend.resolution.engine;

import com.fitcoach.backend.resolution.model.PlanRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把同一個 client 的 raw plan rows 收斂成「每個 programId 最多一筆」。
 * 重複多半來自 customer_id / lead_id 兩邊都連到同一個人，不是刻意的多筆。
 */
public final class PlanDeduplicator {
    private PlanDeduplicator() {}

    /**
     * 1) 同 id 只留第一次出現的
     * 2) 同 programId 留最新的（start_date → created_at），完全平手留先看到的
     * 沒有 programId 的 ad-hoc plan 原樣保留、彼此不合併。輸出維持第一次出現的位置。
     */
    public static <P> List<PlanRecord<P>> deduplicate(List<PlanRecord<P>> raw) {
        if (raw == null || raw.isEmpty()) return List.of();

        Set<String> seenIds = new HashSet<>();
        List<PlanRecord<P>> unique = new ArrayList<>(raw.size());
        for (PlanRecord<P> r : raw) {
            if (r == null) continue;
            if (r.id() != null && !seenIds.add(r.id())) continue;
            unique.add(r);
        }

        Map<String, Integer> slotByProgram = new HashMap<>();
        List<PlanRecord<P>> out = new ArrayList<>(unique.size());
        for (PlanRecord<P> r : unique) {
            if (r.programId() == null) {
                out.add(r);
                continue;
            }
            Integer slot = slotByProgram.get(r.programId());
            if (slot == null) {
                slotByProgram.put(r.programId(), out.size());
                out.add(r);
            } else if (PlanOrdering.isNewer(r, out.get(slot))) {
                out.set(slot, r);
            }
        }
        return List.copyOf(out);
    }
}
